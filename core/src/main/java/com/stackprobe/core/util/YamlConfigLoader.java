package com.stackprobe.core.util;

import com.stackprobe.core.model.AnalyzerConfig;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;

/**
 * stackprobe.yml을 읽어 AnalyzerConfig로 변환.
 *
 * 예상 YAML 키:
 * timeoutMs: 10000
 * followRedirects: true
 * userAgent: "Mozilla/5.0 ..."
 * parallelJobs: 3          # 1~10
 * rps: 10
 * probeFiles: true
 * output:
 *   dir: "out"
 * retry:
 *   maxAttempts: 3
 *   baseDelayMs: 250
 */
public final class YamlConfigLoader {

    public static final String DEFAULT_FILE = "stackprobe.yml";

    private YamlConfigLoader() {}

    /** 파일이 없으면 defaults, 있으면 load */
    public static AnalyzerConfig loadOrDefaults(Path yamlPath) throws IOException {
        if (yamlPath == null || !Files.exists(yamlPath)) return AnalyzerConfig.defaults();
        return load(yamlPath);
    }

    public static AnalyzerConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException(DEFAULT_FILE + " not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            return parse(in);
        }
    }

    public static AnalyzerConfig parse(InputStream in) {
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        Object root = yaml.load(in);

        AnalyzerConfig cfg = AnalyzerConfig.defaults();
        if (!(root instanceof Map<?, ?> map)) {
            // 비어있거나 단순 스칼라면 defaults 유지
            cfg.validate();
            return cfg;
        }

        // 1) 평면 키
        setLong(map, "timeoutMs", ms -> { if (ms > 0) cfg.setTimeoutMs(ms); });
        setBoolean(map, "followRedirects", cfg::setFollowRedirects);
        setString(map, "userAgent", cfg::setUserAgent);
        setInt(map, "parallelJobs", cfg::setParallelJobs);
        setInt(map, "rps", cfg::setRps);
        setBoolean(map, "probeFiles", cfg::setProbeFiles);

        // 2) output.dir
        Map<String, Object> output = getMap(map, "output");
        if (output != null) {
            setString(output, "dir", s -> cfg.setOutputDir(Path.of(s)));
        }

        // 3) retry.*
        Map<String, Object> retry = getMap(map, "retry");
        if (retry != null) {
            setInt(retry, "maxAttempts", i -> cfg.retry().setMaxAttempts(i));
            setLong(retry, "baseDelayMs", l -> cfg.retry().setBaseDelayMs(l));
        }

        cfg.validate();
        return cfg;
    }

    // ------------ helpers ------------
    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        if (v instanceof Map<?, ?> m) return (Map<String, Object>) m;
        return null;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v).trim()));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept(parseNumber(key, v).intValue());
    }

    private static void setLong(Map<?, ?> map, String key, LongConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.longValue());
        else if (v != null) setter.accept(parseNumber(key, v));
    }

    private static Long parseNumber(String key, Object v) {
        try {
            return Long.parseLong(String.valueOf(v).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("'" + key + "' must be a number: " + v, e);
        }
    }
}
