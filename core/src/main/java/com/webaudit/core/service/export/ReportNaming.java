package com.webaudit.core.service.export;

import java.net.URI;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * <out>/reports/<host>/report_<slug>_<scanId 앞 8자>_<yyyyMMdd'T'HHmmss'Z'>.json
 * 같은 대상, 같은 초에 끝난 두 잡도 파일이 겹치지 않는다.
 */
public final class ReportNaming {
    private ReportNaming() {}

    public static final DateTimeFormatter TS_FMT =
            DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'").withZone(ZoneOffset.UTC);

    public static Path jsonPath(Path baseDir, String target, String scanId, Instant generated) {
        return reportsDir(baseDir, target).resolve(
                "report_" + slug(target) + "_" + shortId(scanId) + "_" + TS_FMT.format(generated) + ".json");
    }

    public static Path reportsDir(Path baseDir, String target) {
        Path out = (baseDir == null ? Paths.get("out") : baseDir);
        return out.resolve("reports").resolve(host(target));
    }

    // ---------- helpers ----------
    static String host(String target) {
        try {
            String h = URI.create(target).getHost();
            return (h == null ? "unknown-host" : h.toLowerCase(Locale.ROOT)).replaceAll("[^a-z0-9._-]", "-");
        } catch (IllegalArgumentException | NullPointerException e) {
            return "unknown-host";
        }
    }

    static String shortId(String scanId) {
        String s = (scanId == null) ? "" : scanId.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
        if (s.isEmpty()) return "noid";
        return s.length() > 8 ? s.substring(0, 8) : s;
    }

    static String slug(String url) {
        if (url == null || url.isBlank()) return "no-url";
        String s = url.toLowerCase(Locale.ROOT).replaceFirst("^https?://", "");
        s = s.replaceAll("[^a-z0-9._/-]", "-").replaceAll("-{2,}", "-");
        if (s.length() > 60) s = s.substring(0, 60);
        s = s.replace('/', '-').replaceAll("-{2,}", "-").replaceAll("^-+|-+$", "");
        return s.isEmpty() ? "no-url" : s;
    }
}
