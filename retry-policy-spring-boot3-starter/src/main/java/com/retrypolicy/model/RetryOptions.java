package com.retrypolicy.model;

import lombok.Builder;
import lombok.Data;

import java.time.Duration;

/**
 * 单次调用的重试选项
 * 所有字段可为 null，表示沿用执行器的默认配置
 */
@Data
@Builder(toBuilder = true)
public class RetryOptions {

    /** 指数退避的起始基准间隔 */
    public static final Duration EXPONENTIAL_INITIAL_SLEEP = Duration.ofSeconds(1);

    /** 首次失败后最多再重试的次数 */
    private Integer retryCount;

    /** 每次重试前的基准等待时长，null 表示不等待 */
    private Duration retrySleep;

    /** 开启后忽略 retrySleep，基准从 1s 起每次翻倍 */
    private Boolean exponentialBackoff;

    /** 是否发布 attempt / success / failure 事件 */
    private Boolean logRetries;

    /** 附加到每次等待上的最大随机抖动（毫秒） */
    private Long jitterMillis;

    public static RetryOptions defaults() {
        return RetryOptions.builder()
                .retryCount(3)
                .exponentialBackoff(false)
                .logRetries(true)
                .jitterMillis(1000L)
                .build();
    }

    public static RetryOptions empty() {
        return RetryOptions.builder().build();
    }

    /**
     * 用 defaults 补齐未设置的字段并校验
     */
    public RetryOptions resolve(RetryOptions defaults) {
        RetryOptions resolved = RetryOptions.builder()
                .retryCount(retryCount != null ? retryCount : defaults.getRetryCount())
                .retrySleep(retrySleep != null ? retrySleep : defaults.getRetrySleep())
                .exponentialBackoff(exponentialBackoff != null ? exponentialBackoff : defaults.getExponentialBackoff())
                .logRetries(logRetries != null ? logRetries : defaults.getLogRetries())
                .jitterMillis(jitterMillis != null ? jitterMillis : defaults.getJitterMillis())
                .build();
        if (resolved.getRetryCount() == null || resolved.getRetryCount() < 0) {
            throw new IllegalArgumentException("retryCount must be >= 0, got " + resolved.getRetryCount());
        }
        if (resolved.getJitterMillis() == null || resolved.getJitterMillis() < 0) {
            throw new IllegalArgumentException("jitterMillis must be >= 0, got " + resolved.getJitterMillis());
        }
        if (resolved.getRetrySleep() != null && resolved.getRetrySleep().isNegative()) {
            throw new IllegalArgumentException("retrySleep must not be negative");
        }
        if (resolved.getExponentialBackoff() == null) {
            resolved.setExponentialBackoff(false);
        }
        if (resolved.getLogRetries() == null) {
            resolved.setLogRetries(true);
        }
        return resolved;
    }

    /** 第一次重试前使用的基准间隔（可能为 null） */
    public Duration initialSleepBase() {
        return Boolean.TRUE.equals(exponentialBackoff) ? EXPONENTIAL_INITIAL_SLEEP : retrySleep;
    }
}
