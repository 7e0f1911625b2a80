package com.webaudit.core.service.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.webaudit.core.model.CrawlResult;
import com.webaudit.core.model.FormSpec;
import com.webaudit.core.model.HeaderFinding;
import com.webaudit.core.model.HeaderReport;
import com.webaudit.core.model.PageRecord;
import com.webaudit.core.model.PortTable;
import com.webaudit.core.model.Report;
import com.webaudit.core.model.SqliFinding;
import com.webaudit.core.model.SqlmapFinding;
import com.webaudit.core.model.SqlmapRun;
import com.webaudit.core.model.XssFinding;

import java.util.List;
import java.util.Locale;

/**
 * Report → Jackson 트리. 리포트 파일과 HTTP 응답이 같은 모양을 쓴다.
 * 아직 기록되지 않은 그룹은 null.
 */
public final class ReportJsonMapper {

    private final ObjectMapper om;

    public ReportJsonMapper() {
        this(new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS));
    }

    public ReportJsonMapper(ObjectMapper om) {
        this.om = om;
    }

    public ObjectMapper mapper() { return om; }

    /** ports/crawl/headers/xss/sqli + sqlmap */
    public ObjectNode parts(Report r) {
        ObjectNode n = baseParts(r);
        n.set("sqlmap", sqlmap(r));
        return n;
    }

    /** Phase 1 그룹만 */
    public ObjectNode baseParts(Report r) {
        ObjectNode n = om.createObjectNode();
        n.set("ports", r.getPorts() == null ? null : ports(r.getPorts()));
        n.set("crawl", r.getCrawl() == null ? null : crawl(r.getCrawl()));
        n.set("headers", r.getHeaders() == null ? null : headers(r.getHeaders()));
        n.set("xss", xss(r.getXss()));
        n.set("sqli", sqli(r.getSqli()));
        return n;
    }

    /** 모든 run 의 finding 평탄화 */
    public ArrayNode sqlmap(Report r) {
        ArrayNode arr = om.createArrayNode();
        for (SqlmapFinding f : r.getSqlmapFindings()) arr.add(sqlmapFinding(f));
        return arr;
    }

    /** run 단위(상태/exit/시각/커맨드 포함) */
    public ArrayNode sqlmapRuns(Report r) {
        ArrayNode arr = om.createArrayNode();
        for (SqlmapRun run : r.getSqlmapRuns()) {
            ObjectNode n = arr.addObject();
            n.put("status", run.status().name().toLowerCase(Locale.ROOT));
            n.put("exit_code", run.exitCode());
            n.putPOJO("started_at", run.startedAt());
            n.putPOJO("finished_at", run.finishedAt());
            ArrayNode cmd = n.putArray("command");
            run.command().forEach(cmd::add);
            n.put("output_truncated", run.outputTruncated());
            n.put("findings", run.findings().size());
        }
        return arr;
    }

    public ObjectNode ports(PortTable t) {
        ObjectNode n = om.createObjectNode();
        n.put("host", t.host());
        ObjectNode tcp = n.putObject("tcp");
        t.tcp().forEach((port, open) -> tcp.put(String.valueOf(port), open));
        if (t.isError()) n.put("error", t.error());
        return n;
    }

    public ObjectNode crawl(CrawlResult c) {
        ObjectNode n = om.createObjectNode();
        ArrayNode urls = n.putArray("urls");
        c.urls().forEach(urls::add);
        ArrayNode pages = n.putArray("pages");
        for (PageRecord p : c.pages()) {
            ObjectNode pn = pages.addObject();
            pn.put("url", p.url());
            pn.put("status", p.status());
            ArrayNode forms = pn.putArray("forms");
            for (FormSpec f : p.forms()) {
                ObjectNode fn = forms.addObject();
                fn.put("action", f.action());
                fn.put("method", f.method());
                fn.put("enctype", f.enctype());
                ObjectNode inputs = fn.putObject("inputs");
                f.inputs().forEach(inputs::put);
            }
        }
        ObjectNode errors = n.putObject("errors");
        c.errors().forEach(errors::put);
        return n;
    }

    public ObjectNode headers(HeaderReport h) {
        ObjectNode n = om.createObjectNode();
        n.put("url", h.url());
        if (h.isError()) {
            n.put("error", h.error());
            return n;
        }
        ObjectNode present = n.putObject("present");
        h.present().forEach(present::put);
        ArrayNode missing = n.putArray("missing");
        h.missing().forEach(missing::add);
        ArrayNode findings = n.putArray("findings");
        for (HeaderFinding f : h.findings()) {
            ObjectNode fn = findings.addObject();
            fn.put("header", f.header());
            fn.put("gap", f.gap().name().toLowerCase(Locale.ROOT));
            fn.put("severity", f.severity().name());
            fn.put("evidence", f.evidence());
        }
        return n;
    }

    public ArrayNode xss(List<XssFinding> list) {
        ArrayNode arr = om.createArrayNode();
        for (XssFinding f : list) {
            ObjectNode n = arr.addObject();
            n.put("url", f.url());
            n.put("param", f.param());
            n.put("method", f.method());
            n.put("marker", f.marker());
            n.put("reflected", f.reflected());
            n.put("verbatim", f.verbatim());
            n.put("status", f.status());
            n.put("snippet", f.snippet());
            n.put("severity", f.severity().name());
        }
        return arr;
    }

    public ArrayNode sqli(List<SqliFinding> list) {
        ArrayNode arr = om.createArrayNode();
        for (SqliFinding f : list) {
            ObjectNode n = arr.addObject();
            n.put("url", f.url());
            n.put("param", f.param());
            n.put("method", f.method());
            n.put("payload", f.payload());
            n.put("similarity", Math.round(f.similarity() * 1000.0) / 1000.0);
            n.put("status", f.status());
            n.put("baseline_status", f.baselineStatus());
            n.put("suspected", f.suspected());
            n.put("reason", f.reason().name().toLowerCase(Locale.ROOT));
            n.put("severity", f.severity().name());
        }
        return arr;
    }

    public ObjectNode sqlmapFinding(SqlmapFinding f) {
        ObjectNode n = om.createObjectNode();
        n.put("level", f.level());
        n.put("message", f.message());
        if (f.detail() != null) n.put("detail", f.detail());
        if (f.line() != null) n.put("line", f.line());
        n.put("severity", f.severity().name());
        n.put("actionable", f.actionable());
        return n;
    }
}
