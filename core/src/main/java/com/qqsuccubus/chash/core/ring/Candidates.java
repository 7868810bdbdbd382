package com.qqsuccubus.chash.core.ring;

import com.google.common.collect.AbstractIterator;
import com.qqsuccubus.chash.core.model.Node;
import com.qqsuccubus.chash.core.model.VirtualNode;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Clockwise walk over the ring yielding each real node once, in preference order.
 */
final class Candidates<K extends Comparable<? super K>, V> extends AbstractIterator<Node<K, V>> {
    private final List<VirtualNode<K, V>> ring;
    private final int distinctNodes;
    private final Set<K> seen = new HashSet<>();
    private int cursor;
    private int visited;

    Candidates(List<VirtualNode<K, V>> ring, int distinctNodes, int start) {
        this.ring = ring;
        this.distinctNodes = distinctNodes;
        this.cursor = start;
    }

    @Override
    protected Node<K, V> computeNext() {
        while (seen.size() < distinctNodes && visited < ring.size()) {
            VirtualNode<K, V> vnode = ring.get(cursor);
            cursor = (cursor + 1) % ring.size();
            visited++;
            if (seen.add(vnode.getOwner())) {
                return vnode.getNode();
            }
        }
        return endOfData();
    }
}
