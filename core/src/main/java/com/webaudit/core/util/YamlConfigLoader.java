package com.webaudit.core.util;

import com.webaudit.core.model.ScanConfig;
import com.webaudit.core.model.ScanConfig.SqlmapMode;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.IntConsumer;

/**
 * webaudit.yml 을 읽어 ScanConfig 로 변환.
 *
 * 예상 YAML 키:
 * userAgent: "webaudit/1.0"
 * timeoutMs: 10000
 * followRedirects: true
 * limits:   { maxPages: 50, maxConcurrency: 5 }
 * crawl:    { maxPages: 50, concurrency: 5 }
 * fetch:    { maxAttempts: 2, backoffMs: 250, maxBodyChars: 2000000 }
 * ports:    { list: [80, 443], connectTimeoutMs: 1000, concurrency: 16 }
 * params:   { concurrency: 10 }
 * sqli:     { threshold: 0.90 }
 * phase1:   { timeoutSeconds: 300 }
 * output:   { dir: "out" }
 * sqlmap:   { mode: docker, image: "...", executable: sqlmap, timeoutSeconds: 600,
 *             maxOutputBytes: 1048576, localhostAlias: host.docker.internal }
 * server:   { host: 0.0.0.0, port: 8000 }
 *
 * 환경변수 SQLMAP_IMAGE / SQLMAP_TIMEOUT 이 있으면 sqlmap 값보다 우선한다.
 */
public final class YamlConfigLoader {

    public static final String DEFAULT_FILE = "webaudit.yml";

    private YamlConfigLoader() {}

    /** -Dwa.config → ./webaudit.yml → classpath:webaudit.yml → defaults */
    public static ScanConfig loadDefault() throws IOException {
        String prop = System.getProperty("wa.config");
        if (prop != null && !prop.isBlank()) return load(Path.of(prop.trim()));

        Path local = Path.of(DEFAULT_FILE);
        if (Files.exists(local)) return load(local);

        try (InputStream in = YamlConfigLoader.class.getClassLoader().getResourceAsStream(DEFAULT_FILE)) {
            if (in != null) return load(in);
        }
        ScanConfig cfg = ScanConfig.defaults();
        applyEnv(cfg, System.getenv());
        cfg.validate();
        return cfg;
    }

    public static ScanConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("config not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            return load(in);
        }
    }

    public static ScanConfig load(InputStream in) {
        return load(in, System.getenv());
    }

    static ScanConfig load(InputStream in, Map<String, String> env) {
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        Object root = yaml.load(in);

        ScanConfig cfg = ScanConfig.defaults();
        if (root instanceof Map<?, ?> map) {
            apply(cfg, map);
        }
        applyEnv(cfg, env);
        cfg.validate();
        return cfg;
    }

    private static void apply(ScanConfig cfg, Map<?, ?> map) {
        // 1) 평면 키
        setString(map, "userAgent", cfg::setUserAgent);
        setDurationMs(map, "timeoutMs", cfg::setTimeout);
        setBoolean(map, "followRedirects", cfg::setFollowRedirects);

        // 2) limits.* / crawl.*
        Map<?, ?> limits = getMap(map, "limits");
        if (limits != null) {
            setInt(limits, "maxPages", cfg::setMaxPagesLimit);
            setInt(limits, "maxConcurrency", cfg::setMaxConcurrencyLimit);
        }
        Map<?, ?> crawl = getMap(map, "crawl");
        if (crawl != null) {
            setInt(crawl, "maxPages", cfg::setDefaultMaxPages);
            setInt(crawl, "concurrency", cfg::setDefaultConcurrency);
        }

        // 3) fetch.*
        Map<?, ?> fetch = getMap(map, "fetch");
        if (fetch != null) {
            setInt(fetch, "maxAttempts", cfg::setFetchMaxAttempts);
            setInt(fetch, "backoffMs", cfg::setFetchBackoffMs);
            setInt(fetch, "maxBodyChars", cfg::setMaxBodyChars);
        }

        // 4) ports.*
        Map<?, ?> ports = getMap(map, "ports");
        if (ports != null) {
            setIntList(ports, "list", cfg::setPorts);
            setDurationMs(ports, "connectTimeoutMs", cfg::setPortConnectTimeout);
            setInt(ports, "concurrency", cfg::setPortConcurrency);
        }

        // 5) 테스터
        Map<?, ?> params = getMap(map, "params");
        if (params != null) setInt(params, "concurrency", cfg::setParamConcurrency);
        Map<?, ?> sqli = getMap(map, "sqli");
        if (sqli != null) setDouble(sqli, "threshold", cfg::setSqliThreshold);
        Map<?, ?> phase1 = getMap(map, "phase1");
        if (phase1 != null) setDurationSec(phase1, "timeoutSeconds", cfg::setPhase1Timeout);

        // 6) output.dir
        Map<?, ?> output = getMap(map, "output");
        if (output != null) setString(output, "dir", s -> cfg.setOutputDir(Path.of(s)));

        // 7) sqlmap.*
        Map<?, ?> sm = getMap(map, "sqlmap");
        if (sm != null) {
            var c = cfg.sqlmap();
            setEnum(sm, "mode", SqlmapMode.class, c::setMode);
            setString(sm, "image", c::setImage);
            setString(sm, "executable", c::setExecutable);
            setDurationSec(sm, "timeoutSeconds", c::setTimeout);
            setInt(sm, "maxOutputBytes", c::setMaxOutputBytes);
            setString(sm, "localhostAlias", c::setLocalhostAlias);
        }

        // 8) server.*
        Map<?, ?> server = getMap(map, "server");
        if (server != null) {
            setString(server, "host", cfg.server()::setHost);
            setInt(server, "port", cfg.server()::setPort);
        }
    }

    /** 컨테이너 배포 호환: SQLMAP_IMAGE, SQLMAP_TIMEOUT(초) */
    static void applyEnv(ScanConfig cfg, Map<String, String> env) {
        if (env == null) return;
        String image = env.get("SQLMAP_IMAGE");
        if (image != null && !image.isBlank()) cfg.sqlmap().setImage(image.trim());
        String timeout = env.get("SQLMAP_TIMEOUT");
        if (timeout != null && !timeout.isBlank()) {
            try {
                cfg.sqlmap().setTimeout(Duration.ofSeconds(Long.parseLong(timeout.trim())));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("SQLMAP_TIMEOUT must be an integer: " + timeout, e);
            }
        }
    }

    // ------------ helpers ------------
    private static Map<?, ?> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        return (v instanceof Map<?, ?> m) ? m : null;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept(parseInt(key, v));
    }

    private static void setDouble(Map<?, ?> map, String key, Consumer<Double> setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.doubleValue());
        else if (v != null) {
            try {
                setter.accept(Double.parseDouble(String.valueOf(v).trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(key + " must be a number: " + v, e);
            }
        }
    }

    private static void setDurationMs(Map<?, ?> map, String key, Consumer<Duration> setter) {
        Object v = map.get(key);
        if (v == null) return;
        long ms = (v instanceof Number n) ? n.longValue() : parseInt(key, v);
        if (ms > 0) setter.accept(Duration.ofMillis(ms));
    }

    private static void setDurationSec(Map<?, ?> map, String key, Consumer<Duration> setter) {
        Object v = map.get(key);
        if (v == null) return;
        long sec = (v instanceof Number n) ? n.longValue() : parseInt(key, v);
        if (sec > 0) setter.accept(Duration.ofSeconds(sec));
    }

    private static void setIntList(Map<?, ?> map, String key, Consumer<List<Integer>> setter) {
        Object v = map.get(key);
        if (v == null) return;
        List<Integer> out = new ArrayList<>();
        if (v instanceof List<?> list) {
            for (Object o : list) if (o != null) out.add(o instanceof Number n ? n.intValue() : parseInt(key, o));
        } else {
            // "80, 443" 형태 지원
            for (String p : String.valueOf(v).split("\\s*,\\s*")) {
                if (!p.isBlank()) out.add(parseInt(key, p));
            }
        }
        if (!out.isEmpty()) setter.accept(List.copyOf(out));
    }

    private static <E extends Enum<E>> void setEnum(Map<?, ?> map, String key, Class<E> type, Consumer<E> setter) {
        Object v = map.get(key);
        if (v == null) return;
        String s = String.valueOf(v).trim();
        for (E e : type.getEnumConstants()) {
            if (e.name().equalsIgnoreCase(s)) {
                setter.accept(e);
                return;
            }
        }
        throw new IllegalArgumentException(key + " must be one of "
                + java.util.Arrays.toString(type.getEnumConstants()).toLowerCase(Locale.ROOT) + ": " + s);
    }

    private static int parseInt(String key, Object v) {
        try {
            return Integer.parseInt(String.valueOf(v).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer: " + v, e);
        }
    }
}
