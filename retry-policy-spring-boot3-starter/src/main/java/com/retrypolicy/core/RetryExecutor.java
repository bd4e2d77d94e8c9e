package com.retrypolicy.core;

import com.retrypolicy.core.backoff.JitteredBackoff;
import com.retrypolicy.core.backoff.ThreadLocalRandomJitterSource;
import com.retrypolicy.core.backoff.ThreadRetrySleeper;
import com.retrypolicy.core.event.RetryEventDispatcher;
import com.retrypolicy.core.event.listener.LoggingRetryListener;
import com.retrypolicy.core.spi.FailureDecider;
import com.retrypolicy.core.spi.JitterSource;
import com.retrypolicy.core.spi.RetryEventListener;
import com.retrypolicy.core.spi.RetrySleeper;
import com.retrypolicy.exception.RetryCancelledException;
import com.retrypolicy.model.RetryOptions;
import com.retrypolicy.model.ctx.RetryAttemptContext;
import com.retrypolicy.model.event.RetryEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.function.Predicate;

/**
 * 重试执行器
 * 在调用线程上执行操作，失败且判定可重试时按退避等待后重试；
 * 重试耗尽或不可重试时抛出原始异常，从不包装
 */
public class RetryExecutor {

    private final RetryOptions defaults;

    private final JitteredBackoff backoff;

    private final RetrySleeper sleeper;

    private final RetryEventDispatcher events;

    private RetryExecutor(Builder b) {
        this.defaults = b.defaults.resolve(RetryOptions.defaults());
        this.backoff = new JitteredBackoff(b.jitterSource, b.sleepDisabled);
        this.sleeper = b.sleeper;
        this.events = new RetryEventDispatcher(b.listeners != null
                ? b.listeners
                : List.of(new LoggingRetryListener(b.logger)));
    }

    public static Builder builder() {
        return new Builder();
    }

    // ----------------- 按异常类型重试 -----------------

    /**
     * 异常是 errorTypes 中任一类型（含子类）时重试
     */
    @SafeVarargs
    public final <T> T retryOnFailure(Callable<T> operation, Class<? extends Throwable>... errorTypes) throws Exception {
        return execute(operation, null, FailureDecider.anyOf(errorTypes));
    }

    @SafeVarargs
    public final <T> T retryOnFailure(Callable<T> operation, RetryOptions options,
                                      Class<? extends Throwable>... errorTypes) throws Exception {
        return execute(operation, options, FailureDecider.anyOf(errorTypes));
    }

    // ----------------- 排除异常类型重试 -----------------

    /**
     * 异常不是 errorTypes 中任一类型（含子类）时重试
     */
    @SafeVarargs
    public final <T> T retryOnFailureExcept(Callable<T> operation, Class<? extends Throwable>... errorTypes) throws Exception {
        return execute(operation, null, FailureDecider.noneOf(errorTypes));
    }

    @SafeVarargs
    public final <T> T retryOnFailureExcept(Callable<T> operation, RetryOptions options,
                                            Class<? extends Throwable>... errorTypes) throws Exception {
        return execute(operation, options, FailureDecider.noneOf(errorTypes));
    }

    // ----------------- 自定义条件重试 -----------------

    public <T> T retryOnFailureCondition(Callable<T> operation, Predicate<? super Throwable> condition) throws Exception {
        return execute(operation, null, FailureDecider.of(condition));
    }

    public <T> T retryOnFailureCondition(Callable<T> operation, RetryOptions options,
                                         Predicate<? super Throwable> condition) throws Exception {
        return execute(operation, options, FailureDecider.of(condition));
    }

    // ----------------- 包装 -----------------

    /**
     * 返回带重试的新 Callable，每次 call() 都是一次独立的重试调用
     */
    @SafeVarargs
    public final <T> Callable<T> wrapWithRetry(Callable<T> operation, RetryOptions options,
                                               Class<? extends Throwable>... errorTypes) {
        return wrapWithRetryCondition(operation, options, FailureDecider.anyOf(errorTypes));
    }

    public <T> Callable<T> wrapWithRetryCondition(Callable<T> operation, RetryOptions options, FailureDecider decider) {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(decider, "decider");
        return () -> execute(operation, options, decider);
    }

    /**
     * 核心流程
     */
    public <T> T execute(Callable<T> operation, RetryOptions options, FailureDecider decider) throws Exception {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(decider, "decider");
        RetryOptions opt = (options == null ? RetryOptions.empty() : options).resolve(defaults);
        boolean publish = opt.getLogRetries();
        RetryAttemptContext ctx = RetryAttemptContext.start(opt.getRetryCount(), opt.initialSleepBase());

        Throwable lastFailure = null;
        while (true) {
            if (lastFailure != null && Thread.currentThread().isInterrupted()) {
                throw new RetryCancelledException(ctx.getRetryId(), null, lastFailure);
            }
            T result;
            try {
                result = operation.call();
            } catch (Throwable e) {
                // 不可重试：原样抛出，不消耗预算也不记录
                if (!decider.isRetryable(e)) {
                    throw propagate(e);
                }
                if (ctx.isExhausted()) {
                    if (publish) {
                        events.publish(RetryEvent.failure(ctx, e));
                    }
                    throw propagate(e);
                }
                Duration sleep = backoff.nextSleep(ctx, opt);
                if (publish) {
                    events.publish(RetryEvent.attempt(ctx, e, sleep));
                }
                ctx.consumeRetry();
                pause(ctx, sleep, e);
                lastFailure = e;
                continue;
            }
            if (publish && ctx.isRetrying()) {
                events.publish(RetryEvent.success(ctx));
            }
            return result;
        }
    }

    /**
     * Error 直接抛出，Exception 交给调用方抛出；其余 Throwable 原样透传，不包装
     */
    private static Exception propagate(Throwable t) {
        if (t instanceof Error) {
            throw (Error) t;
        }
        if (t instanceof Exception) {
            return (Exception) t;
        }
        throw RetryExecutor.<RuntimeException>sneakyThrow(t);
    }

    @SuppressWarnings("unchecked")
    private static <E extends Throwable> E sneakyThrow(Throwable t) throws E {
        throw (E) t;
    }

    private void pause(RetryAttemptContext ctx, Duration sleep, Throwable lastFailure) {
        if (sleep == null) {
            return;
        }
        try {
            sleeper.sleep(sleep);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new RetryCancelledException(ctx.getRetryId(), ie, lastFailure);
        }
    }

    public RetryOptions getDefaults() { return defaults.toBuilder().build(); }

    public boolean isSleepDisabled() { return backoff.isSleepDisabled(); }

    public List<RetryEventListener> getListeners() { return events.getListeners(); }

    public static final class Builder {

        private RetryOptions defaults = RetryOptions.defaults();
        private RetrySleeper sleeper = new ThreadRetrySleeper();
        private JitterSource jitterSource = new ThreadLocalRandomJitterSource();
        private List<RetryEventListener> listeners;
        private Logger logger = LoggerFactory.getLogger(RetryExecutor.class);
        private boolean sleepDisabled = false;

        private Builder() {
        }

        /** 未设置的字段沿用 {@link RetryOptions#defaults()} */
        public Builder defaults(RetryOptions defaults) {
            this.defaults = Objects.requireNonNull(defaults, "defaults");
            return this;
        }

        public Builder sleeper(RetrySleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
            return this;
        }

        public Builder jitterSource(JitterSource jitterSource) {
            this.jitterSource = Objects.requireNonNull(jitterSource, "jitterSource");
            return this;
        }

        /** 默认日志监听器使用的 logger；调用 listeners() 后不再生效 */
        public Builder logger(Logger logger) {
            this.logger = Objects.requireNonNull(logger, "logger");
            return this;
        }

        /** 替换全部监听器（包括默认的日志监听器） */
        public Builder listeners(List<? extends RetryEventListener> listeners) {
            this.listeners = new ArrayList<>(listeners);
            return this;
        }

        /** 在当前监听器之后追加 */
        public Builder listener(RetryEventListener listener) {
            if (this.listeners == null) {
                this.listeners = new ArrayList<>();
                this.listeners.add(new LoggingRetryListener(logger));
            }
            this.listeners.add(Objects.requireNonNull(listener, "listener"));
            return this;
        }

        /** 全局禁用等待，测试/CI 环境使用 */
        public Builder sleepDisabled(boolean sleepDisabled) {
            this.sleepDisabled = sleepDisabled;
            return this;
        }

        public RetryExecutor build() {
            return new RetryExecutor(this);
        }
    }
}
