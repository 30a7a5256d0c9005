package com.deskclaw.common.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads and caches DeskClaw configuration from a JSON file.
 * A missing or unreadable file yields a config with every section present and empty.
 */
@Slf4j
public class ConfigService {

    private static final Duration DEFAULT_CACHE_TTL = Duration.ofMillis(200);
    private static final Pattern ENV_VAR_PATTERN = Pattern.compile("\\$\\{([^}:]+)(?::-(.*?))?}");

    private final ObjectMapper objectMapper;
    private final Cache<String, DeskClawConfig> cache;
    private final Path configPath;
    private final Function<String, String> env;

    public ConfigService(Path configPath) {
        this(configPath, DEFAULT_CACHE_TTL, System::getenv);
    }

    public ConfigService(Path configPath, Duration cacheTtl, Function<String, String> env) {
        // Expand ~ to user home directory
        String pathStr = configPath.toString();
        if (pathStr.startsWith("~")) {
            pathStr = System.getProperty("user.home") + pathStr.substring(1);
            configPath = Path.of(pathStr);
        }
        this.configPath = configPath;
        this.env = env;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(cacheTtl)
                .maximumSize(1)
                .build();
    }

    /**
     * Load config with caching.
     */
    public DeskClawConfig loadConfig() {
        return cache.get(configPath.toString(), key -> doLoadConfig());
    }

    /**
     * Force reload config, bypassing cache.
     */
    public DeskClawConfig reloadConfig() {
        cache.invalidateAll();
        return loadConfig();
    }

    public Path getConfigPath() {
        return configPath;
    }

    private DeskClawConfig doLoadConfig() {
        if (!Files.exists(configPath)) {
            log.warn("Config file not found: {}, using defaults", configPath);
            return applyDefaults(new DeskClawConfig());
        }
        try {
            String raw = Files.readString(configPath);
            raw = substituteEnvVars(raw);
            DeskClawConfig config = objectMapper.readValue(raw, DeskClawConfig.class);
            log.info("Config loaded from: {}", configPath);
            return applyDefaults(config != null ? config : new DeskClawConfig());
        } catch (IOException e) {
            log.error("Failed to load config from: {}", configPath, e);
            return applyDefaults(new DeskClawConfig());
        }
    }

    /**
     * Substitute ${VAR} and ${VAR:-default} patterns.
     */
    String substituteEnvVars(String raw) {
        Matcher matcher = ENV_VAR_PATTERN.matcher(raw);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            String varName = matcher.group(1);
            String defaultValue = matcher.group(2);
            String value = env.apply(varName);
            if (value == null) {
                value = defaultValue != null ? defaultValue : "";
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Make sure every section exists so callers never null-check a section.
     */
    static DeskClawConfig applyDefaults(DeskClawConfig config) {
        if (config.getSnapshot() == null) {
            config.setSnapshot(new DeskClawConfig.SnapshotConfig());
        }
        if (config.getFind() == null) {
            config.setFind(new DeskClawConfig.FindConfig());
        }
        if (config.getRead() == null) {
            config.setRead(new DeskClawConfig.ReadConfig());
        }
        if (config.getPeek() == null) {
            config.setPeek(new DeskClawConfig.PeekConfig());
        }
        if (config.getStatus() == null) {
            config.setStatus(new DeskClawConfig.StatusConfig());
        }
        return config;
    }

    /**
     * Build a service whose env lookup is backed by a fixed map (tests, embedded use).
     */
    public static ConfigService withEnv(Path configPath, Map<String, String> env) {
        return new ConfigService(configPath, DEFAULT_CACHE_TTL, env::get);
    }
}
