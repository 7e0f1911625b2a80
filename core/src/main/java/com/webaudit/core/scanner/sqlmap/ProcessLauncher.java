package com.webaudit.core.scanner.sqlmap;

import java.io.IOException;
import java.util.List;

/** 외부 프로세스 시작 훅(테스트에서 sh 스크립트로 대체) */
@FunctionalInterface
public interface ProcessLauncher {

    /** stderr 는 stdout 으로 합쳐진 상태여야 한다. */
    Process start(List<String> command) throws IOException;

    static ProcessLauncher system() {
        return command -> new ProcessBuilder(command)
                .redirectErrorStream(true)
                .start();
    }
}
