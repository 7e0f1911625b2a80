package com.webaudit.core.scanner.sqlmap;

import com.webaudit.core.api.ScanBusyException;
import com.webaudit.core.model.FormSpec;
import com.webaudit.core.model.ScanConfig;
import com.webaudit.core.model.Severity;
import com.webaudit.core.model.SqlmapArgs;
import com.webaudit.core.model.SqlmapFinding;
import com.webaudit.core.model.SqlmapRun;
import com.webaudit.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * sqlmap 외부 프로세스 실행기.
 * - scan_id 당 동시에 1개만 실행(ScanBusyException)
 * - stdout+stderr 는 별도 리더 스레드가 maxOutputBytes 까지만 보관(나머지는 읽고 버림)
 * - 타임아웃 시 자식 프로세스까지 강제 종료, TIMEOUT run 반환
 */
public class SqlmapRunner {

    private static final Logger LOG = LoggerFactory.getLogger(SqlmapRunner.class);
    private static final StructuredLog SLOG = StructuredLog.get(SqlmapRunner.class);

    private static final long DRAIN_WAIT_MS = 2_000;
    private static final long CONTAINER_RM_WAIT_SEC = 15;

    private final ScanConfig.SqlmapCfg cfg;
    private final ProcessLauncher launcher;
    private final SqlmapOutputParser parser = new SqlmapOutputParser();
    private final Set<String> active = ConcurrentHashMap.newKeySet();

    public SqlmapRunner(ScanConfig.SqlmapCfg cfg) {
        this(cfg, ProcessLauncher.system());
    }

    public SqlmapRunner(ScanConfig.SqlmapCfg cfg, ProcessLauncher launcher) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.launcher = Objects.requireNonNull(launcher, "launcher");
    }

    /**
     * @param postForm 크롤에서 찾은 첫 POST form(없으면 null)
     * @throws ProcessLaunchException 프로세스를 띄우지 못한 경우
     */
    public SqlmapRun run(String scanId, String targetUrl, SqlmapArgs args, FormSpec postForm)
            throws ProcessLaunchException, InterruptedException {
        return run(scanId, command(scanId, targetUrl, args, postForm));
    }

    /** 인자 검증 + 커맨드 조립만(프로세스 시작 전 ScanArgumentException) */
    public SqlmapCommand command(String scanId, String targetUrl, SqlmapArgs args, FormSpec postForm) {
        return SqlmapCommand.build(cfg, scanId, targetUrl, args, postForm);
    }

    public SqlmapRun run(String scanId, SqlmapCommand cmd) throws ProcessLaunchException, InterruptedException {
        Objects.requireNonNull(scanId, "scanId");
        Objects.requireNonNull(cmd, "cmd");
        if (!active.add(scanId)) {
            throw new ScanBusyException("sqlmap already running for scan " + scanId);
        }
        try {
            return execute(scanId, cmd);
        } finally {
            active.remove(scanId);
        }
    }

    public boolean isRunning(String scanId) {
        return active.contains(scanId);
    }

    private SqlmapRun execute(String scanId, SqlmapCommand cmd) throws ProcessLaunchException, InterruptedException {
        StructuredLog slog = SLOG.with("scanId", scanId);
        Duration timeout = cfg.getTimeout();
        Instant started = Instant.now();
        slog.info("sqlmap-start", "target", cmd.target(), "mode", cfg.getMode(), "timeoutSec", timeout.toSeconds());
        LOG.info("sqlmap start: scanId={}, args={}", scanId, cmd.sqlmapArgv());

        Process process;
        try {
            process = launcher.start(cmd.argv());
        } catch (IOException e) {
            slog.error("sqlmap-launch-failed", e, "exe", cmd.argv().get(0));
            throw new ProcessLaunchException(cmd.argv().get(0), e);
        }

        OutputCollector collector = new OutputCollector(process.getInputStream(), cfg.getMaxOutputBytes());
        Thread reader = new Thread(collector, "sqlmap-out-" + scanId);
        reader.setDaemon(true);
        reader.start();

        boolean finished;
        try {
            finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            terminate(process, cmd, slog);
            throw e;
        }

        if (!finished) {
            terminate(process, cmd, slog);
            reader.join(DRAIN_WAIT_MS);
            LOG.warn("sqlmap timed out after {}s: scanId={}", timeout.toSeconds(), scanId);
            slog.warn("sqlmap-done", "status", SqlmapRun.Status.TIMEOUT);
            SqlmapFinding f = SqlmapFinding.failure("CRITICAL",
                    "sqlmap timed out after " + timeout.toSeconds() + "s", Severity.CRITICAL);
            return new SqlmapRun(SqlmapRun.Status.TIMEOUT, -1, started, Instant.now(),
                    cmd.sqlmapArgv(), collector.isTruncated(), List.of(f));
        }

        reader.join(DRAIN_WAIT_MS);
        int exit = process.exitValue();
        List<SqlmapFinding> findings = new ArrayList<>(parser.parse(collector.text()));
        SqlmapRun.Status status = SqlmapRun.Status.COMPLETED;
        if (exit != 0) {
            findings.add(SqlmapFinding.failure("ERROR", "sqlmap exited with code " + exit, Severity.HIGH));
            status = SqlmapRun.Status.FAILED;
        }
        Instant done = Instant.now();
        slog.info("sqlmap-done", "status", status, "exit", exit, "findings", findings.size(),
                "truncated", collector.isTruncated(), "ms", Duration.between(started, done).toMillis());
        return new SqlmapRun(status, exit, started, done, cmd.sqlmapArgv(), collector.isTruncated(), findings);
    }

    /** 로컬 프로세스 트리 종료 + docker 모드면 컨테이너 제거(CLI 만 죽이면 컨테이너는 계속 돈다) */
    private void terminate(Process p, SqlmapCommand cmd, StructuredLog slog) {
        kill(p);
        if (cmd.containerName() != null) removeContainer(cmd.containerName(), slog);
    }

    /** docker rm -f &lt;name&gt;. 실패는 로그만 남기고 run 결과(TIMEOUT)는 그대로 */
    void removeContainer(String name, StructuredLog slog) {
        boolean interrupted = Thread.interrupted();
        try {
            Process rm = launcher.start(List.of("docker", "rm", "-f", name));
            if (!rm.waitFor(CONTAINER_RM_WAIT_SEC, TimeUnit.SECONDS)) {
                rm.destroyForcibly();
                LOG.warn("docker rm -f {} did not finish in {}s", name, CONTAINER_RM_WAIT_SEC);
                slog.warn("sqlmap-container-rm", "container", name, "result", "timeout");
            } else if (rm.exitValue() != 0) {
                LOG.warn("docker rm -f {} exited with {}", name, rm.exitValue());
                slog.warn("sqlmap-container-rm", "container", name, "exit", rm.exitValue());
            } else {
                slog.info("sqlmap-container-rm", "container", name, "exit", 0);
            }
        } catch (IOException e) {
            LOG.warn("docker rm -f {} failed: {}", name, e.toString());
            slog.error("sqlmap-container-rm", e, "container", name);
        } catch (InterruptedException e) {
            interrupted = true;
            LOG.warn("docker rm -f {} interrupted", name);
        } finally {
            if (interrupted) Thread.currentThread().interrupt();
        }
    }

    private static void kill(Process p) {
        p.descendants().forEach(ProcessHandle::destroyForcibly);
        p.destroyForcibly();
        try {
            p.waitFor(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /** 출력 상한까지만 보관하고 나머지는 계속 읽어서 버린다(파이프 막힘 방지) */
    static final class OutputCollector implements Runnable {
        private final InputStream in;
        private final int maxBytes;
        private final ByteArrayOutputStream buf = new ByteArrayOutputStream();
        private volatile boolean truncated;

        OutputCollector(InputStream in, int maxBytes) {
            this.in = in;
            this.maxBytes = maxBytes;
        }

        @Override public void run() {
            byte[] chunk = new byte[8192];
            try (InputStream is = in) {
                int n;
                while ((n = is.read(chunk)) != -1) {
                    synchronized (buf) {
                        int room = maxBytes - buf.size();
                        if (room > 0) buf.write(chunk, 0, Math.min(room, n));
                        if (n > room) truncated = true;
                    }
                }
            } catch (IOException e) {
                // 강제 종료 시 스트림이 닫히는 경우
                LOG.debug("sqlmap output stream closed: {}", e.toString());
            }
        }

        String text() {
            synchronized (buf) {
                return buf.toString(StandardCharsets.UTF_8);
            }
        }

        boolean isTruncated() { return truncated; }
    }
}
