package com.retrypolicy.model.ctx;

import lombok.Getter;

import java.time.Duration;
import java.util.UUID;

/**
 * 一次重试调用的临时状态，调用返回或最终抛出后丢弃
 */
@Getter
public class RetryAttemptContext {

    /** 关联同一次调用的所有日志 */
    private final String retryId;

    /** 初始重试预算 */
    private final int retryCount;

    private final long startNanos;

    private int retriesRemaining;

    /** 当前基准间隔，指数模式下每次使用后翻倍 */
    private Duration currentSleepBase;

    private RetryAttemptContext(String retryId, int retryCount, Duration initialSleepBase, long startNanos) {
        this.retryId = retryId;
        this.retryCount = retryCount;
        this.retriesRemaining = retryCount;
        this.currentSleepBase = initialSleepBase;
        this.startNanos = startNanos;
    }

    public static RetryAttemptContext start(int retryCount, Duration initialSleepBase) {
        return new RetryAttemptContext(UUID.randomUUID().toString(), retryCount, initialSleepBase, System.nanoTime());
    }

    /** 已消耗的重试次数 */
    public int retriesAttempted() {
        return retryCount - retriesRemaining;
    }

    /** 是否已经发生过至少一次重试 */
    public boolean isRetrying() {
        return retriesRemaining < retryCount;
    }

    public boolean isExhausted() {
        return retriesRemaining <= 0;
    }

    public void consumeRetry() {
        retriesRemaining--;
    }

    public void setCurrentSleepBase(Duration currentSleepBase) {
        this.currentSleepBase = currentSleepBase;
    }

    public Duration elapsed() {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
