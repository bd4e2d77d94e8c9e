package com.retrypolicy.core.spi;

import java.time.Duration;

/**
 * 重试前的等待，阻塞调用线程
 */
@FunctionalInterface
public interface RetrySleeper {

    void sleep(Duration duration) throws InterruptedException;
}
