package com.webaudit.core.testsupport;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;

/**
 * 로컬 점검 대상 사이트.
 * "/"   : /x?id=1 과 외부 링크, HSTS 없음
 * "/x"  : 파라미터와 무관한 고정 본문(반사/차이 없음)
 */
public final class TargetSite implements AutoCloseable {

    private final HttpServer server;

    private TargetSite(HttpServer server) {
        this.server = server;
    }

    public static TargetSite start() throws IOException {
        HttpServer s = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        s.createContext("/", ex -> {
            if (!"/".equals(ex.getRequestURI().getPath())) {
                respond(ex, 404, "not found");
                return;
            }
            respond(ex, 200, "<html><body><h1>Home</h1>"
                    + "<a href='/x?id=1'>item</a>"
                    + "<a href='http://elsewhere.test/'>partner</a>"
                    + "</body></html>");
        });
        s.createContext("/x", ex -> respond(ex, 200,
                "<html><body><h1>Item</h1><p>A plain item page with fixed content.</p></body></html>"));
        s.start();
        return new TargetSite(s);
    }

    public int port() { return server.getAddress().getPort(); }

    public String baseUrl() { return "http://127.0.0.1:" + port() + "/"; }

    @Override public void close() { server.stop(0); }

    public static void respond(HttpExchange ex, int code, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        ex.getResponseHeaders().set("Content-Type", "text/html; charset=utf-8");
        ex.getResponseHeaders().set("X-Frame-Options", "DENY");
        ex.sendResponseHeaders(code, bytes.length);
        try (OutputStream os = ex.getResponseBody()) {
            os.write(bytes);
        }
    }
}
