package com.qqsuccubus.chash.bench;

import com.qqsuccubus.chash.bench.config.BenchConfig;
import com.qqsuccubus.chash.bench.report.BenchReport;
import com.qqsuccubus.chash.bench.util.JsonUtils;
import com.qqsuccubus.chash.core.error.HashRingException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

public class BenchApp {
    private static final Logger log = LoggerFactory.getLogger(BenchApp.class);

    public static void main(String[] args) {
        BenchConfig config;
        try {
            config = BenchConfig.fromArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(BenchConfig.USAGE);
            System.exit(2);
            return;
        }

        log.info("Starting ring benchmark");
        log.info("  Nodes: {}", config.getNodes());
        log.info("  Vnodes per node: {}", config.getVnodeCount());

        BenchReport report;
        try {
            report = new BenchRunner(config, new SimpleMeterRegistry()).run();
        } catch (IOException e) {
            log.error("Cannot read words from {}", config.getWordFile(), e);
            System.exit(1);
            return;
        } catch (HashRingException | IllegalArgumentException e) {
            log.error("Cannot build ring: {}", e.getMessage());
            System.exit(2);
            return;
        }

        System.out.println(config.isJson() ? JsonUtils.writeValueAsString(report) : report.render());
    }
}
