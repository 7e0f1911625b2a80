package com.webaudit.server;

import com.webaudit.core.model.ScanConfig;
import com.webaudit.core.service.ScanOrchestrator;
import com.webaudit.core.util.YamlConfigLoader;
import com.webaudit.server.api.ScanApiServer;
import com.webaudit.server.logging.LogSetup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 서버 진입점.
 *  -Dwa.config=path/to/webaudit.yml (없으면 ./webaudit.yml → classpath)
 *  -Dwa.log.dir=logs
 */
public final class App {
    private App() {}

    public static void main(String[] args) throws Exception {
        Path logDir = Paths.get(System.getProperty("wa.log.dir", "logs"));
        LogSetup.init(logDir);
        Logger log = LoggerFactory.getLogger(App.class);

        Thread.setDefaultUncaughtExceptionHandler((t, e) ->
                log.error("Uncaught exception on {}", t.getName(), e));

        ScanConfig config = YamlConfigLoader.loadDefault();
        ScanOrchestrator orchestrator = new ScanOrchestrator(config);
        ScanApiServer server = new ScanApiServer(orchestrator);
        server.start(config.server().getHost(), config.server().getPort());

        Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "shutdown"));
        log.info("WebAudit server started: output={}, sqlmap.mode={}",
                config.getOutputDir().toAbsolutePath(), config.sqlmap().getMode());
    }
}
