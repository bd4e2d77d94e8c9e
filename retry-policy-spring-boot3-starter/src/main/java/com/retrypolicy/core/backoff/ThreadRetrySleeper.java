package com.retrypolicy.core.backoff;

import com.retrypolicy.core.spi.RetrySleeper;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * 阻塞当前线程等待
 */
public class ThreadRetrySleeper implements RetrySleeper {

    private static final Duration MAX_NANOS = Duration.ofNanos(Long.MAX_VALUE);

    @Override
    public void sleep(Duration duration) throws InterruptedException {
        if (duration.isZero() || duration.isNegative()) {
            return;
        }
        // 超过 long 纳秒范围时按上限等待
        long nanos = duration.compareTo(MAX_NANOS) > 0 ? Long.MAX_VALUE : duration.toNanos();
        TimeUnit.NANOSECONDS.sleep(nanos);
    }
}
