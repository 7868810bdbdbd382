package com.qqsuccubus.chash.bench;

import com.google.common.io.MoreFiles;
import com.qqsuccubus.chash.bench.config.BenchConfig;
import com.qqsuccubus.chash.bench.metrics.MetricsNames;
import com.qqsuccubus.chash.bench.report.BenchReport;
import com.qqsuccubus.chash.core.hash.Hashers;
import com.qqsuccubus.chash.core.hash.RingHasher;
import com.qqsuccubus.chash.core.model.Node;
import com.qqsuccubus.chash.core.ring.StaticHashRing;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Builds a ring over the configured nodes and routes every word of a word list through it.
 */
public class BenchRunner {
    private static final Logger log = LoggerFactory.getLogger(BenchRunner.class);

    private final BenchConfig config;
    private final MeterRegistry meterRegistry;

    public BenchRunner(BenchConfig config, MeterRegistry meterRegistry) {
        this.config = config;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Runs the benchmark.
     *
     * @return Report with per-node selection counts and timings
     * @throws IOException if the word file cannot be read
     */
    public BenchReport run() throws IOException {
        List<String> words = MoreFiles.asCharSource(config.getWordFile(), StandardCharsets.UTF_8).readLines();
        log.info("Loaded {} words from {}", words.size(), config.getWordFile());

        RingHasher hasher = Hashers.byName(config.getHash());
        Timer buildTimer = Timer.builder(MetricsNames.RING_BUILD).register(meterRegistry);
        Timer selectTimer = Timer.builder(MetricsNames.RING_SELECT).register(meterRegistry);

        // Report values come from this run only; the registry may be shared across runs
        Timer.Sample buildSample = Timer.start(meterRegistry);
        StaticHashRing<String, Void> ring = StaticHashRing.build(hasher, config.getNodes(), config.getVnodeCount());
        long buildNanos = buildSample.stop(buildTimer);
        log.info("Built {} with {} hash", ring, config.getHash());

        Timer.Sample selectSample = Timer.start(meterRegistry);
        for (String word : words) {
            ring.lookup(word);
        }
        long selectNanos = selectSample.stop(selectTimer);

        Map<String, Counter> counters = new LinkedHashMap<>();
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Node<String, Void> node : ring.nodes()) {
            counters.put(node.getKey(), Counter.builder(MetricsNames.RING_SELECTED_TOTAL)
                    .tag(MetricsNames.TAG_NODE, node.getKey())
                    .register(meterRegistry));
            counts.put(node.getKey(), 0);
        }
        for (String word : words) {
            String owner = ring.lookup(word);
            counts.merge(owner, 1, Integer::sum);
            counters.get(owner).increment();
        }

        double selectSeconds = selectNanos / 1e9;
        long wordsPerSecond = selectSeconds > 0 ? (long) (words.size() / selectSeconds) : 0;

        return BenchReport.builder()
                .hash(config.getHash())
                .wordCount(words.size())
                .realNodeCount(ring.nodes().size())
                .virtualNodeCount(ring.size())
                .vnodesPerNode(config.getVnodeCount())
                .selectedCountPerNode(counts)
                .buildMillis(TimeUnit.NANOSECONDS.toMillis(buildNanos))
                .selectMillis(TimeUnit.NANOSECONDS.toMillis(selectNanos))
                .wordsPerSecond(wordsPerSecond)
                .build();
    }
}
