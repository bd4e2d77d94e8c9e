package com.retrypolicy.core.backoff;

import com.retrypolicy.core.spi.JitterSource;
import com.retrypolicy.model.RetryOptions;
import com.retrypolicy.model.ctx.RetryAttemptContext;

import java.time.Duration;
import java.util.Objects;

/**
 * 计算每次重试前的等待时长
 * sleep = base + [0, jitter) ms；指数模式下 base 在每次使用后翻倍
 */
public class JitteredBackoff {

    /** 指数基准上限，达到后不再翻倍，避免 Duration 溢出 */
    static final Duration MAX_SLEEP_BASE = Duration.ofSeconds(Long.MAX_VALUE / 4);

    private final JitterSource jitterSource;

    /** 全局禁用等待（测试/CI 环境） */
    private final boolean sleepDisabled;

    public JitteredBackoff(JitterSource jitterSource, boolean sleepDisabled) {
        this.jitterSource = Objects.requireNonNull(jitterSource, "jitterSource");
        this.sleepDisabled = sleepDisabled;
    }

    /**
     * @return 本次等待时长；未配置基准间隔或禁用等待时为 null
     */
    public Duration nextSleep(RetryAttemptContext ctx, RetryOptions opt) {
        Duration base = ctx.getCurrentSleepBase();
        if (base == null) {
            return null;
        }
        if (Boolean.TRUE.equals(opt.getExponentialBackoff()) && base.compareTo(MAX_SLEEP_BASE) < 0) {
            ctx.setCurrentSleepBase(base.multipliedBy(2));
        }
        if (sleepDisabled) {
            return null;
        }
        long jitter = jitterSource.nextJitterMillis(opt.getJitterMillis());
        return base.plusMillis(Math.max(0, jitter));
    }

    public boolean isSleepDisabled() {
        return sleepDisabled;
    }
}
