package com.retrypolicy.core.event.listener;

import com.retrypolicy.core.spi.RetryEventListener;
import com.retrypolicy.model.event.RetryEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

import static com.retrypolicy.model.event.RetryEvent.seconds;

/**
 * 结构化日志, 默认启用
 * 字段以 slf4j key/value 输出：attempt=WARN, failure=ERROR, success=INFO
 */
public class LoggingRetryListener implements RetryEventListener {

    public static final String EXCEPTION_CLASS = "exception_class";
    public static final String EXCEPTION_MESSAGE = "exception_message";
    public static final String RETRIES_REMAINING = "retries_remaining";
    public static final String RETRIES_ATTEMPTED = "retries_attempted";
    public static final String RETRIES_REQUIRED = "retries_required";
    public static final String RETRY_ID = "retry_id";
    public static final String SLEEP_BEFORE_RETRY = "sleep_before_retry";
    public static final String TIME_ELAPSED = "time_elapsed";

    private final Logger log;

    public LoggingRetryListener() {
        this(LoggerFactory.getLogger("com.retrypolicy.core.RetryExecutor"));
    }

    /**
     * @param log 应用自带的 logger，不覆盖调用方已有的日志配置
     */
    public LoggingRetryListener(Logger log) {
        this.log = Objects.requireNonNull(log, "log");
    }

    @Override
    public String name() {
        return "log";
    }

    @Override
    public void onEvent(RetryEvent e) {
        Double elapsed = seconds(e.getTimeElapsed());
        switch (e.getType()) {
            case ATTEMPT -> log.atWarn()
                    .addKeyValue(EXCEPTION_CLASS, e.getExceptionClass())
                    .addKeyValue(EXCEPTION_MESSAGE, e.getExceptionMessage())
                    .addKeyValue(RETRIES_REMAINING, e.getRetriesRemaining())
                    .addKeyValue(RETRY_ID, e.getRetryId())
                    .addKeyValue(SLEEP_BEFORE_RETRY, seconds(e.getSleepBeforeRetry()))
                    .addKeyValue(TIME_ELAPSED, elapsed)
                    .log("[Retry-Attempt] {}: {}, retries_remaining={}, sleep_before_retry={}, time_elapsed={}, retry_id={}",
                            e.getExceptionClass(), e.getExceptionMessage(), e.getRetriesRemaining(),
                            seconds(e.getSleepBeforeRetry()), elapsed, e.getRetryId());
            case FAILURE -> log.atError()
                    .addKeyValue(EXCEPTION_CLASS, e.getExceptionClass())
                    .addKeyValue(EXCEPTION_MESSAGE, e.getExceptionMessage())
                    .addKeyValue(RETRIES_ATTEMPTED, e.getRetriesAttempted())
                    .addKeyValue(RETRY_ID, e.getRetryId())
                    .addKeyValue(TIME_ELAPSED, elapsed)
                    .log("[Retry-Failure] {}: {}, retries_attempted={}, time_elapsed={}, retry_id={}",
                            e.getExceptionClass(), e.getExceptionMessage(), e.getRetriesAttempted(),
                            elapsed, e.getRetryId());
            case SUCCESS -> log.atInfo()
                    .addKeyValue(RETRIES_REQUIRED, e.getRetriesRequired())
                    .addKeyValue(RETRY_ID, e.getRetryId())
                    .addKeyValue(TIME_ELAPSED, elapsed)
                    .log("[Retry-Success] retries_required={}, time_elapsed={}, retry_id={}",
                            e.getRetriesRequired(), elapsed, e.getRetryId());
        }
    }
}
