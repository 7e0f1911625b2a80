package com.webaudit.core.util;

import com.webaudit.core.model.ScanConfig;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class YamlConfigLoaderTest {

    private static InputStream yaml(String s) {
        return new ByteArrayInputStream(s.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void loads_fixture_from_classpath() throws IOException {
        ScanConfig cfg;
        try (InputStream in = getClass().getClassLoader().getResourceAsStream("webaudit-test.yml")) {
            assertNotNull(in, "fixture missing");
            cfg = YamlConfigLoader.load(in, Map.of());
        }
        assertEquals("wa-test/0.1", cfg.getUserAgent());
        assertEquals(Duration.ofMillis(3000), cfg.getTimeout());
        assertEquals(20, cfg.getMaxPagesLimit());
        assertEquals(3, cfg.getMaxConcurrencyLimit());
        assertEquals(10, cfg.getDefaultMaxPages());
        assertEquals(List.of(80, 443, 8080), cfg.getPorts());
        assertEquals(Duration.ofMillis(500), cfg.getPortConnectTimeout());
        assertEquals(0.85, cfg.getSqliThreshold(), 1e-9);
        assertEquals(Duration.ofSeconds(120), cfg.getPhase1Timeout());
        assertEquals(Path.of("build/reports"), cfg.getOutputDir());
        assertEquals(ScanConfig.SqlmapMode.LOCAL, cfg.sqlmap().getMode());
        assertEquals("/opt/sqlmap/sqlmap.py", cfg.sqlmap().getExecutable());
        assertEquals(Duration.ofSeconds(90), cfg.sqlmap().getTimeout());
        assertEquals(9000, cfg.server().getPort());
    }

    @Test
    void empty_document_yields_defaults() {
        ScanConfig cfg = YamlConfigLoader.load(yaml(""), Map.of());
        assertEquals(50, cfg.getMaxPagesLimit());
        assertEquals(5, cfg.getMaxConcurrencyLimit());
        assertEquals(ScanConfig.DEFAULT_PORTS, cfg.getPorts());
        assertEquals(ScanConfig.SqlmapMode.DOCKER, cfg.sqlmap().getMode());
        assertEquals(Duration.ofSeconds(600), cfg.sqlmap().getTimeout());
    }

    @Test
    void env_overrides_sqlmap_image_and_timeout() {
        ScanConfig cfg = YamlConfigLoader.load(yaml("sqlmap:\n  image: from-yaml\n  timeoutSeconds: 30\n"),
                Map.of("SQLMAP_IMAGE", "from-env:1", "SQLMAP_TIMEOUT", "45"));
        assertEquals("from-env:1", cfg.sqlmap().getImage());
        assertEquals(Duration.ofSeconds(45), cfg.sqlmap().getTimeout());
    }

    @Test
    void comma_separated_ports_are_accepted() {
        ScanConfig cfg = YamlConfigLoader.load(yaml("ports:\n  list: \"22, 80,443\"\n"), Map.of());
        assertEquals(List.of(22, 80, 443), cfg.getPorts());
    }

    @Test
    void invalid_values_are_rejected() {
        IllegalArgumentException mode = assertThrows(IllegalArgumentException.class,
                () -> YamlConfigLoader.load(yaml("sqlmap:\n  mode: kubernetes\n"), Map.of()));
        assertThat(mode.getMessage()).contains("mode");

        assertThrows(IllegalArgumentException.class,
                () -> YamlConfigLoader.load(yaml("ports:\n  list: [80, 70000]\n"), Map.of()));
        assertThrows(IllegalArgumentException.class,
                () -> YamlConfigLoader.load(yaml("crawl:\n  maxPages: 80\n"), Map.of()));
        assertThrows(IllegalArgumentException.class,
                () -> YamlConfigLoader.load(yaml(""), Map.of("SQLMAP_TIMEOUT", "ten")));
    }

    @Test
    void missing_file_is_io_error() {
        assertThrows(IOException.class, () -> YamlConfigLoader.load(Path.of("no-such-dir/webaudit.yml")));
    }
}
