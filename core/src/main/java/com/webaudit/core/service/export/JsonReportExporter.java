package com.webaudit.core.service.export;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.webaudit.core.model.ScanJob;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;

/**
 * 잡 리포트 JSON 파일 출력.
 * {scan_id, target, generated, status, results:{ports, crawl, headers, xss, sqli, sqlmap}}
 * Phase 2 재실행 시 새 파일(새 타임스탬프)로 다시 쓴다.
 */
public class JsonReportExporter {

    private final Path baseDir;
    private final ReportJsonMapper mapper;

    public JsonReportExporter(Path baseDir) {
        this(baseDir, new ReportJsonMapper());
    }

    public JsonReportExporter(Path baseDir, ReportJsonMapper mapper) {
        this.baseDir = Objects.requireNonNull(baseDir, "baseDir");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public Path export(ScanJob job) throws IOException {
        Instant generated = Instant.now();
        Path out = ReportNaming.jsonPath(baseDir, job.getTarget(), job.getId(), generated);
        Files.createDirectories(out.getParent());
        mapper.mapper().writerWithDefaultPrettyPrinter().writeValue(out.toFile(), document(job, generated));
        return out;
    }

    /** 파일 본문 트리 */
    public ObjectNode document(ScanJob job, Instant generated) {
        ObjectNode root = mapper.mapper().createObjectNode();
        root.put("scan_id", job.getId());
        root.put("target", job.getTarget());
        root.putPOJO("generated", generated);
        root.put("status", job.getStatus().wireName());
        root.set("results", mapper.parts(job.getReport()));
        root.set("sqlmap_runs", mapper.sqlmapRuns(job.getReport()));
        return root;
    }
}
