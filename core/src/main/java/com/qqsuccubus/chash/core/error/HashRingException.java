package com.qqsuccubus.chash.core.error;

/**
 * Base type of every failure raised by the hash ring.
 */
public abstract class HashRingException extends RuntimeException {

    protected HashRingException(String message) {
        super(message);
    }
}
