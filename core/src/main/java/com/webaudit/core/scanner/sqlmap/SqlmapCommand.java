package com.webaudit.core.scanner.sqlmap;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.webaudit.core.api.ScanArgumentException;
import com.webaudit.core.model.FormSpec;
import com.webaudit.core.model.ScanConfig;
import com.webaudit.core.model.SqlmapArgs;
import com.webaudit.core.util.UrlParamUtil;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * sqlmap 커맨드 조립.
 * argv     : 실제 실행 리스트(docker 모드면 docker run --rm --name ... image 접두)
 * sqlmapArgv: sqlmap 에 넘어가는 인자만(리포트 표시용)
 * containerName: docker 모드의 컨테이너 이름(local 모드면 null). 타임아웃 시 docker rm -f 대상.
 */
public record SqlmapCommand(List<String> argv, List<String> sqlmapArgv, String target, String containerName) {

    static final String CONTAINER_PREFIX = "wa-sqlmap-";

    private static final ObjectMapper JSON = new ObjectMapper();

    public SqlmapCommand {
        argv = List.copyOf(argv);
        sqlmapArgv = List.copyOf(sqlmapArgv);
    }

    public static SqlmapCommand build(ScanConfig.SqlmapCfg cfg, String scanId, String targetUrl,
                                      SqlmapArgs args, FormSpec postForm) {
        Objects.requireNonNull(cfg, "cfg");
        Objects.requireNonNull(scanId, "scanId");
        Objects.requireNonNull(args, "args");
        URI target = requireTarget(targetUrl);
        if (cfg.getMode() == ScanConfig.SqlmapMode.DOCKER) {
            target = rewriteLocalhost(target, cfg.getLocalhostAlias());
        }

        List<String> sq = new ArrayList<>();
        sq.add("-u");
        sq.add(target.toString());
        sq.addAll(args.toCommandArgs());
        if (postForm != null && postForm.isPost()) {
            Map<String, String> data = new LinkedHashMap<>();
            postForm.inputs().forEach((k, v) -> data.put(k, (v == null || v.isEmpty()) ? "test" : v));
            if (postForm.isJson()) {
                sq.add("--data=" + toJson(data));
                sq.add("--headers=Content-Type: application/json");
            } else {
                sq.add("--data=" + UrlParamUtil.formEncode(data));
            }
        }

        List<String> argv = new ArrayList<>();
        String container = null;
        if (cfg.getMode() == ScanConfig.SqlmapMode.DOCKER) {
            container = containerName(scanId);
            argv.add("docker");
            argv.add("run");
            argv.add("--rm");
            argv.add("--name");
            argv.add(container);
            argv.add(cfg.getImage());
        } else {
            argv.add(cfg.getExecutable());
        }
        argv.addAll(sq);
        return new SqlmapCommand(argv, sq, target.toString(), container);
    }

    /** docker 이름 규칙([a-zA-Z0-9][a-zA-Z0-9_.-]*)에 맞춘 scan 별 컨테이너 이름 */
    static String containerName(String scanId) {
        String id = scanId.replaceAll("[^a-zA-Z0-9_.-]", "-");
        return CONTAINER_PREFIX + (id.isEmpty() ? "scan" : id);
    }

    /** 절대 http(s) URL, 공백/제어문자 없음 */
    static URI requireTarget(String url) {
        if (url == null || url.isBlank()) throw new ScanArgumentException("sqlmap target url is required");
        for (int i = 0; i < url.length(); i++) {
            char c = url.charAt(i);
            if (Character.isWhitespace(c) || Character.isISOControl(c)) {
                throw new ScanArgumentException("sqlmap target url must not contain whitespace");
            }
        }
        URI u;
        try {
            u = new URI(url);
        } catch (URISyntaxException e) {
            throw new ScanArgumentException("invalid sqlmap target url: " + url, e);
        }
        String scheme = (u.getScheme() == null) ? "" : u.getScheme().toLowerCase(Locale.ROOT);
        if (!u.isAbsolute() || !(scheme.equals("http") || scheme.equals("https")) || u.getHost() == null) {
            throw new ScanArgumentException("sqlmap target must be an absolute http(s) url: " + url);
        }
        return u;
    }

    /** 컨테이너 안에서 호스트의 localhost 에 닿도록 host 교체(포트 유지) */
    static URI rewriteLocalhost(URI u, String alias) {
        String host = u.getHost().toLowerCase(Locale.ROOT);
        if (alias == null || alias.isBlank() || !(host.equals("localhost") || host.equals("127.0.0.1"))) return u;
        StringBuilder sb = new StringBuilder();
        sb.append(u.getScheme()).append("://");
        if (u.getRawUserInfo() != null) sb.append(u.getRawUserInfo()).append('@');
        sb.append(alias);
        if (u.getPort() != -1) sb.append(':').append(u.getPort());
        sb.append(u.getRawPath() == null || u.getRawPath().isEmpty() ? "/" : u.getRawPath());
        if (u.getRawQuery() != null) sb.append('?').append(u.getRawQuery());
        return URI.create(sb.toString());
    }

    private static String toJson(Map<String, String> data) {
        try {
            return JSON.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("form body serialization failed", e);
        }
    }
}
