package com.qqsuccubus.chash.bench.report;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Result of one benchmark run. Serialized as-is with {@code --json}.
 */
@Value
@Builder
public class BenchReport {
    String hash;
    int wordCount;
    int realNodeCount;
    int virtualNodeCount;
    int vnodesPerNode;

    /**
     * Node key → number of words routed to it, in node input order.
     */
    Map<String, Integer> selectedCountPerNode;

    long buildMillis;
    long selectMillis;
    long wordsPerSecond;

    public String render() {
        StringBuilder sb = new StringBuilder();
        sb.append("WORD COUNT: ").append(wordCount).append('\n');
        sb.append("REAL NODE COUNT: ").append(realNodeCount).append('\n');
        sb.append("VIRTUAL NODE COUNT: ").append(virtualNodeCount)
                .append(" (").append(vnodesPerNode).append(" per node)").append('\n');
        sb.append('\n');
        sb.append("SELECTED COUNT PER NODE:").append('\n');
        selectedCountPerNode.forEach((node, count) ->
                sb.append("- ").append(node).append(": \t").append(count).append('\n'));
        sb.append('\n');
        sb.append("ELAPSED: ").append(buildMillis).append(" ms (for building ring), ")
                .append(selectMillis).append(" ms (for selecting nodes)").append('\n');
        sb.append("WORDS PER SECOND: ").append(wordsPerSecond);
        return sb.toString();
    }
}
