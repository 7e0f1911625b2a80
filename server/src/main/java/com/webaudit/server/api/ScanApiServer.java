package com.webaudit.server.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import com.webaudit.core.api.ScanArgumentException;
import com.webaudit.core.api.ScanBusyException;
import com.webaudit.core.api.ScanNotFoundException;
import com.webaudit.core.model.ScanJob;
import com.webaudit.core.model.ScanRequest;
import com.webaudit.core.scanner.sqlmap.ProcessLaunchException;
import com.webaudit.core.service.ScanOrchestrator;
import com.webaudit.core.service.export.ReportJsonMapper;
import com.webaudit.core.util.NamedThreadFactory;
import com.webaudit.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * JDK HttpServer 기반 JSON API.
 *  POST /api/scan       : Phase 1 (+ run_sqlmap 이면 Phase 2)
 *  POST /api/scan-base  : Phase 1
 *  POST /api/scan-deep  : Phase 2 (scan_id)
 *  GET  /api/health
 * 모든 응답에 CORS 허용 헤더, OPTIONS 는 204.
 */
public final class ScanApiServer {

    private static final Logger LOG = LoggerFactory.getLogger(ScanApiServer.class);
    private static final StructuredLog SLOG = StructuredLog.get(ScanApiServer.class);

    private static final int MAX_BODY_BYTES = 64 * 1024;

    /** 예외 → 상태코드 매핑용 핸들러 */
    @FunctionalInterface
    interface Endpoint {
        ObjectNode handle(byte[] body) throws Exception;
    }

    private final ScanOrchestrator orchestrator;
    private final RequestParser parser;
    private final ReportJsonMapper json;
    private final ObjectMapper om;

    private HttpServer server;
    private ExecutorService executor;

    public ScanApiServer(ScanOrchestrator orchestrator) {
        this(orchestrator, new ReportJsonMapper());
    }

    public ScanApiServer(ScanOrchestrator orchestrator, ReportJsonMapper json) {
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
        this.json = Objects.requireNonNull(json, "json");
        this.om = json.mapper();
        this.parser = new RequestParser(om, orchestrator.getConfig());
    }

    public synchronized void start(String host, int port) throws IOException {
        if (server != null) throw new IllegalStateException("server already started");
        server = HttpServer.create(new InetSocketAddress(host, port), 0);
        server.createContext("/api/scan", ex -> serve(ex, "/api/scan", "POST", this::scan));
        server.createContext("/api/scan-base", ex -> serve(ex, "/api/scan-base", "POST", this::scanBase));
        server.createContext("/api/scan-deep", ex -> serve(ex, "/api/scan-deep", "POST", this::scanDeep));
        server.createContext("/api/health", ex -> serve(ex, "/api/health", "GET", body -> health()));
        executor = Executors.newFixedThreadPool(8, new NamedThreadFactory("http"));
        server.setExecutor(executor);
        server.start();
        LOG.info("API listening on http://{}:{}", host, port());
    }

    public synchronized void stop() {
        if (server == null) return;
        server.stop(1);
        executor.shutdownNow();
        server = null;
        LOG.info("API stopped");
    }

    /** 실제 바인딩 포트(0 으로 띄운 경우 확인용) */
    public synchronized int port() {
        if (server == null) throw new IllegalStateException("server not started");
        return server.getAddress().getPort();
    }

    // ---------- endpoints ----------
    private ObjectNode scan(byte[] body) throws Exception {
        ScanRequest req = parser.parseScan(body);
        ScanJob job = orchestrator.runFull(req);
        ObjectNode out = envelope(job);
        out.set("parts", json.parts(job.getReport()));
        return out;
    }

    private ObjectNode scanBase(byte[] body) throws Exception {
        ScanRequest req = parser.parseBase(body);
        ScanJob job = orchestrator.runBase(req);
        ObjectNode out = envelope(job);
        out.set("parts", json.baseParts(job.getReport()));
        return out;
    }

    private ObjectNode scanDeep(byte[] body) throws Exception {
        RequestParser.DeepRequest req = parser.parseDeep(body);
        ScanJob job = orchestrator.runDeep(req.scanId(), req.url(), req.sqlmapArgs());
        ObjectNode out = envelope(job);
        ObjectNode parts = out.putObject("parts");
        parts.set("sqlmap", json.sqlmap(job.getReport()));
        return out;
    }

    private ObjectNode health() {
        ObjectNode out = om.createObjectNode();
        out.put("status", "ok");
        return out;
    }

    private ObjectNode envelope(ScanJob job) {
        ObjectNode out = om.createObjectNode();
        out.put("scan_id", job.getId());
        out.put("status", job.getStatus().wireName());
        out.put("report", job.getReportPath() == null ? null : job.getReportPath().toString());
        return out;
    }

    // ---------- plumbing ----------
    private void serve(HttpExchange ex, String path, String method, Endpoint endpoint) throws IOException {
        try {
            cors(ex);
            String m = ex.getRequestMethod();
            if ("OPTIONS".equalsIgnoreCase(m)) {
                ex.sendResponseHeaders(204, -1);
                return;
            }
            if (!path.equals(ex.getRequestURI().getPath())) {
                send(ex, 404, error("not found"));
                return;
            }
            if (!method.equalsIgnoreCase(m)) {
                ex.getResponseHeaders().set("Allow", method + ", OPTIONS");
                send(ex, 405, error("method not allowed"));
                return;
            }

            int status = 200;
            ObjectNode out;
            try {
                out = endpoint.handle(readBody(ex));
            } catch (ScanNotFoundException e) {
                status = 404;
                out = error(e.getMessage());
            } catch (ScanArgumentException e) {
                status = 400;
                out = error(e.getMessage());
            } catch (ScanBusyException e) {
                status = 409;
                out = error(e.getMessage());
            } catch (ProcessLaunchException e) {
                status = 502;
                out = error(e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                status = 500;
                out = error("interrupted");
            } catch (Exception e) {
                LOG.error("Request failed: {} {}", m, path, e);
                status = 500;
                out = error("internal error");
            }
            if (status >= 400) {
                SLOG.warn("api-error", "path", path, "status", status, "detail", out.path("detail").asText());
            }
            send(ex, status, out);
        } finally {
            ex.close();
        }
    }

    private byte[] readBody(HttpExchange ex) throws IOException {
        try (InputStream in = ex.getRequestBody()) {
            byte[] b = in.readNBytes(MAX_BODY_BYTES + 1);
            if (b.length > MAX_BODY_BYTES) throw new ScanArgumentException("request body too large");
            return b;
        }
    }

    private ObjectNode error(String detail) {
        ObjectNode n = om.createObjectNode();
        n.put("detail", detail == null ? "" : detail);
        return n;
    }

    private void send(HttpExchange ex, int status, ObjectNode body) throws IOException {
        byte[] bytes = om.writeValueAsBytes(body);
        ex.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        ex.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = ex.getResponseBody()) {
            os.write(bytes);
        }
    }

    private static void cors(HttpExchange ex) {
        ex.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
        ex.getResponseHeaders().set("Access-Control-Allow-Methods", "GET, POST, OPTIONS");
        ex.getResponseHeaders().set("Access-Control-Allow-Headers", "*");
    }
}
