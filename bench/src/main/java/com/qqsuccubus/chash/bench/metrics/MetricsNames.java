package com.qqsuccubus.chash.bench.metrics;

/**
 * Micrometer metric names recorded by the benchmark.
 * <p>
 * <b>Naming convention:</b> {@code chash.<component>.<metric>}
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Timer: Ring construction.
     */
    public static final String RING_BUILD = "chash.ring.build";

    /**
     * Timer: Selecting a node for every word.
     */
    public static final String RING_SELECT = "chash.ring.select";

    /**
     * Counter: Selections per node.
     * <p>
     * Tags: node
     * </p>
     */
    public static final String RING_SELECTED_TOTAL = "chash.ring.selected.total";

    public static final String TAG_NODE = "node";
}
