package com.webaudit.core.scanner.sqlmap;

import java.io.IOException;

/** sqlmap 프로세스(또는 docker) 자체를 띄우지 못함 */
public class ProcessLaunchException extends IOException {
    private final String executable;

    public ProcessLaunchException(String executable, Throwable cause) {
        super("failed to start " + executable + ": " + (cause != null ? cause.getMessage() : "unknown"), cause);
        this.executable = executable;
    }

    public String getExecutable() { return executable; }
}
