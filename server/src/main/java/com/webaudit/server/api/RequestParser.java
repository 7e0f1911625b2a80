package com.webaudit.server.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.webaudit.core.api.ScanArgumentException;
import com.webaudit.core.model.ScanConfig;
import com.webaudit.core.model.ScanRequest;
import com.webaudit.core.model.SqlmapArgs;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 요청 본문(JSON) → 엔진 요청. 타입/필수값만 여기서 보고, 범위는 오케스트레이터가 본다.
 * sqlmap_args 는 객체 {level, risk, threads, tamper} 또는 문자열 배열 ["--level=3", ...].
 */
public final class RequestParser {

    /** POST /api/scan-deep 본문 */
    public record DeepRequest(String scanId, String url, SqlmapArgs sqlmapArgs) {}

    private final ObjectMapper om;
    private final ScanConfig config;

    public RequestParser(ObjectMapper om, ScanConfig config) {
        this.om = Objects.requireNonNull(om, "om");
        this.config = Objects.requireNonNull(config, "config");
    }

    /** POST /api/scan */
    public ScanRequest parseScan(byte[] body) {
        JsonNode n = readObject(body);
        return new ScanRequest(
                requiredText(n, "url"),
                optInt(n, "max_pages", config.getDefaultMaxPages()),
                optInt(n, "concurrency", config.getDefaultConcurrency()),
                optBool(n, "run_sqlmap", false),
                sqlmapArgs(n.get("sqlmap_args")));
    }

    /** POST /api/scan-base */
    public ScanRequest parseBase(byte[] body) {
        JsonNode n = readObject(body);
        return ScanRequest.base(
                requiredText(n, "url"),
                optInt(n, "max_pages", config.getDefaultMaxPages()),
                optInt(n, "concurrency", config.getDefaultConcurrency()));
    }

    public DeepRequest parseDeep(byte[] body) {
        JsonNode n = readObject(body);
        String url = optText(n, "url");
        return new DeepRequest(requiredText(n, "scan_id"), url, sqlmapArgs(n.get("sqlmap_args")));
    }

    /** null/누락이면 null(호출자 기본값) */
    SqlmapArgs sqlmapArgs(JsonNode n) {
        if (n == null || n.isNull()) return null;
        if (n.isArray()) {
            List<String> opts = new ArrayList<>();
            for (JsonNode e : n) {
                if (!e.isTextual()) throw new ScanArgumentException("sqlmap_args entries must be strings");
                opts.add(e.asText());
            }
            return SqlmapArgs.fromOptions(opts);
        }
        if (n.isObject()) {
            return SqlmapArgs.of(optInt(n, "level"), optInt(n, "risk"), optInt(n, "threads"), optText(n, "tamper"));
        }
        throw new ScanArgumentException("sqlmap_args must be an object or a list of strings");
    }

    // ---------- helpers ----------
    private JsonNode readObject(byte[] body) {
        if (body == null || body.length == 0) throw new ScanArgumentException("request body is required");
        JsonNode n;
        try {
            n = om.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ScanArgumentException("malformed JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ScanArgumentException("unreadable body: " + e.getMessage(), e);
        }
        if (n == null || !n.isObject()) throw new ScanArgumentException("request body must be a JSON object");
        return n;
    }

    private static String requiredText(JsonNode n, String field) {
        String v = optText(n, field);
        if (v == null || v.isBlank()) throw new ScanArgumentException(field + " is required");
        return v.trim();
    }

    private static String optText(JsonNode n, String field) {
        JsonNode v = n.get(field);
        if (v == null || v.isNull()) return null;
        if (!v.isTextual()) throw new ScanArgumentException(field + " must be a string");
        return v.asText();
    }

    private static int optInt(JsonNode n, String field, int def) {
        Integer v = optInt(n, field);
        return v == null ? def : v;
    }

    private static Integer optInt(JsonNode n, String field) {
        JsonNode v = n.get(field);
        if (v == null || v.isNull()) return null;
        if (!v.isIntegralNumber() || !v.canConvertToInt()) {
            throw new ScanArgumentException(field + " must be an integer");
        }
        return v.intValue();
    }

    private static boolean optBool(JsonNode n, String field, boolean def) {
        JsonNode v = n.get(field);
        if (v == null || v.isNull()) return def;
        if (!v.isBoolean()) throw new ScanArgumentException(field + " must be a boolean");
        return v.booleanValue();
    }
}
