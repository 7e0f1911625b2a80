package com.webaudit.core.model;

import java.time.Instant;
import java.util.List;

/** sqlmap 1회 실행 결과. Phase 2를 다시 부르면 새 run 이 뒤에 붙는다. */
public record SqlmapRun(
        Status status,
        int exitCode,
        Instant startedAt,
        Instant finishedAt,
        List<String> command,
        boolean outputTruncated,
        List<SqlmapFinding> findings
) {
    public enum Status { COMPLETED, FAILED, TIMEOUT }

    public SqlmapRun {
        command = (command == null) ? List.of() : List.copyOf(command);
        findings = (findings == null) ? List.of() : List.copyOf(findings);
    }

    public boolean succeeded() { return status == Status.COMPLETED; }
}
