package com.webaudit.core.util;

import java.time.Duration;

/** 재시도 대기 추상화(테스트에서 실제 sleep 없이 기록만) */
@FunctionalInterface
public interface Sleeper {
    void sleep(Duration d) throws InterruptedException;
}
