package com.qqsuccubus.chash.bench.config;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Configuration for the ring benchmark, loaded from command-line arguments
 * with environment variables as defaults.
 */
@Value
@Builder(toBuilder = true)
public class BenchConfig {

    public static final String USAGE =
            "usage: bench WORD_FILE --nodes NODE... [--vnode_count N] [--hash murmur3|siphash|farmhash] [--json]";

    Path wordFile;
    List<String> nodes;
    int vnodeCount;        // virtual nodes per real node
    String hash;           // hasher name, see Hashers.byName
    boolean json;          // print the report as JSON

    public static BenchConfig fromArgs(String[] args) {
        return fromArgs(args, System.getenv());
    }

    /**
     * Parses arguments; {@code VNODE_COUNT} and {@code RING_HASH} supply defaults.
     *
     * @throws IllegalArgumentException on missing or malformed arguments
     */
    public static BenchConfig fromArgs(String[] args, Map<String, String> env) {
        Path wordFile = null;
        List<String> nodes = new ArrayList<>();
        String vnodeCount = env.getOrDefault("VNODE_COUNT", "1000");
        String hash = env.getOrDefault("RING_HASH", "murmur3");
        boolean json = false;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--nodes":
                    while (i + 1 < args.length && !args[i + 1].startsWith("--")) {
                        nodes.add(args[++i]);
                    }
                    break;
                case "--vnode_count":
                    vnodeCount = value(args, ++i, arg);
                    break;
                case "--hash":
                    hash = value(args, ++i, arg);
                    break;
                case "--json":
                    json = true;
                    break;
                default:
                    if (arg.startsWith("--")) {
                        throw new IllegalArgumentException("Unknown option: " + arg);
                    }
                    if (wordFile != null) {
                        throw new IllegalArgumentException("Unexpected argument: " + arg);
                    }
                    wordFile = Paths.get(arg);
            }
        }

        if (wordFile == null) {
            throw new IllegalArgumentException("WORD_FILE is required");
        }
        if (nodes.isEmpty()) {
            throw new IllegalArgumentException("--nodes requires at least one node");
        }

        return BenchConfig.builder()
                .wordFile(wordFile)
                .nodes(List.copyOf(nodes))
                .vnodeCount(parseCount(vnodeCount))
                .hash(hash)
                .json(json)
                .build();
    }

    private static String value(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException(option + " requires a value");
        }
        return args[index];
    }

    private static int parseCount(String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Wrong integer: " + value, e);
        }
    }
}
