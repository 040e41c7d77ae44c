package com.petmind.shared.config;

import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.function.Function;
import java.util.function.UnaryOperator;

public class ConfigLoader {

    private static final Path DEFAULT_PATH = Path.of(
        System.getProperty("user.home"), ".petmind", "config.yaml"
    );

    public static PetMindConfig load() {
        return load(DEFAULT_PATH);
    }

    public static PetMindConfig load(Path path) {
        return load(path, System::getenv);
    }

    @SuppressWarnings("unchecked")
    static PetMindConfig load(Path path, UnaryOperator<String> env) {
        Object parsed = null;
        if (Files.exists(path)) {
            try (var in = Files.newInputStream(path)) {
                parsed = new Yaml().load(in);
            } catch (IOException | YAMLException e) {
                throw new IllegalStateException("Failed to load config: " + path, e);
            }
        }
        if (parsed != null && !(parsed instanceof Map)) {
            throw new IllegalStateException("Config root must be a mapping: " + path);
        }
        Map<String, Object> raw = parsed == null ? Map.of() : (Map<String, Object>) parsed;

        var memory = section(raw, "memory");
        var bridge = section(raw, "bridge");
        return new PetMindConfig(parseMemoryConfig(memory, env), parseBridgeConfig(bridge));
    }

    private static MemoryConfig parseMemoryConfig(Map<String, Object> memory, UnaryOperator<String> env) {
        var defaults = MemoryConfig.defaults();
        return new MemoryConfig(
            parse("PETMIND_RECENT_CAPACITY", envOrDefault(env, "PETMIND_RECENT_CAPACITY",
                value(memory, "recent-capacity", defaults.recentCapacity())), Integer::parseInt),
            parse("PETMIND_IMPORTANT_CAPACITY", envOrDefault(env, "PETMIND_IMPORTANT_CAPACITY",
                value(memory, "important-capacity", defaults.importantCapacity())), Integer::parseInt),
            parse("memory.promotion-threshold",
                value(memory, "promotion-threshold", defaults.promotionThreshold()), Double::parseDouble),
            parse("memory.residual-floor",
                value(memory, "residual-floor", defaults.residualFloor()), Double::parseDouble),
            Duration.ofSeconds(parse("memory.half-life-seconds",
                value(memory, "half-life-seconds", defaults.halfLife().toSeconds()), Long::parseLong)),
            Duration.ofSeconds(parse("memory.archive-after-seconds",
                value(memory, "archive-after-seconds", defaults.archiveAfter().toSeconds()), Long::parseLong)),
            parse("PETMIND_SWEEP_INTERVAL", envOrDefault(env, "PETMIND_SWEEP_INTERVAL",
                value(memory, "sweep-interval", defaults.sweepInterval())), Integer::parseInt)
        );
    }

    private static BridgeConfig parseBridgeConfig(Map<String, Object> bridge) {
        var defaults = BridgeConfig.defaults();
        return new BridgeConfig(
            parse("bridge.queue-capacity",
                value(bridge, "queue-capacity", defaults.queueCapacity()), Integer::parseInt),
            parse("bridge.summary-max-lines",
                value(bridge, "summary-max-lines", defaults.summaryMaxLines()), Integer::parseInt)
        );
    }

    private static String value(Map<String, Object> section, String key, Object fallback) {
        return String.valueOf(section.getOrDefault(key, fallback)).trim();
    }

    private static <T> T parse(String key, String raw, Function<String, T> parser) {
        try {
            return parser.apply(raw);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid value for " + key + ": " + raw, e);
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(Map<String, Object> raw, String name) {
        var value = raw.get(name);
        return value instanceof Map ? (Map<String, Object>) value : Map.of();
    }

    private static String envOrDefault(UnaryOperator<String> env, String name, String fallback) {
        var val = env.apply(name);
        return val != null ? val : fallback;
    }
}
