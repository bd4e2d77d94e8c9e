package com.retrypolicy.model.event;

import com.retrypolicy.model.ctx.RetryAttemptContext;
import com.retrypolicy.model.enums.RetryEventType;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * 重试事件快照，字段名即日志契约
 * - ATTEMPT: exceptionClass, exceptionMessage, retriesRemaining, retryId, sleepBeforeRetry, timeElapsed
 * - FAILURE: exceptionClass, exceptionMessage, retriesAttempted, retryId, timeElapsed
 * - SUCCESS: retriesRequired, retryId, timeElapsed
 */
@Getter
@Builder
@ToString
public class RetryEvent {

    private final RetryEventType type;
    private final String retryId;
    private final String exceptionClass;
    private final String exceptionMessage;
    private final Integer retriesRemaining;
    private final Integer retriesAttempted;
    private final Integer retriesRequired;
    /** 可为 null：未配置间隔或全局禁用等待 */
    private final Duration sleepBeforeRetry;
    private final Duration timeElapsed;

    public static RetryEvent attempt(RetryAttemptContext ctx, Throwable error, Duration sleepBeforeRetry) {
        return RetryEvent.builder()
                .type(RetryEventType.ATTEMPT)
                .retryId(ctx.getRetryId())
                .exceptionClass(error.getClass().getName())
                .exceptionMessage(error.getMessage())
                .retriesRemaining(ctx.getRetriesRemaining())
                .sleepBeforeRetry(sleepBeforeRetry)
                .timeElapsed(ctx.elapsed())
                .build();
    }

    public static RetryEvent failure(RetryAttemptContext ctx, Throwable error) {
        return RetryEvent.builder()
                .type(RetryEventType.FAILURE)
                .retryId(ctx.getRetryId())
                .exceptionClass(error.getClass().getName())
                .exceptionMessage(error.getMessage())
                .retriesAttempted(ctx.retriesAttempted())
                .timeElapsed(ctx.elapsed())
                .build();
    }

    public static RetryEvent success(RetryAttemptContext ctx) {
        return RetryEvent.builder()
                .type(RetryEventType.SUCCESS)
                .retryId(ctx.getRetryId())
                .retriesRequired(ctx.retriesAttempted())
                .timeElapsed(ctx.elapsed())
                .build();
    }

    /** 秒，保留小数 */
    public static Double seconds(Duration d) {
        return d == null ? null : d.getSeconds() + d.getNano() / 1_000_000_000d;
    }
}
