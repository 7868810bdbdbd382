package com.qqsuccubus.chash.core.error;

/**
 * Raised by lookups on a ring that holds no virtual nodes.
 */
public class EmptyRingException extends HashRingException {

    public EmptyRingException() {
        super("Ring has no virtual nodes");
    }
}
