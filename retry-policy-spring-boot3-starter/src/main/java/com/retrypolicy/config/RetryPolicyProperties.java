package com.retrypolicy.config;

import com.retrypolicy.model.RetryOptions;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 重试默认配置（绑定前缀：retry）
 *
 * YAML 示例：
 * retry:
 *   retry-count: 3
 *   retry-sleep: 500ms
 *   exponential-backoff: false
 *   log-retries: true
 *   jitter: 1000ms
 *   sleep-disabled: false
 *   metrics:
 *     enabled: true
 *   policy:
 *     designate-startup-root: true
 *
 * sleep-disabled 只用于测试/CI，可通过环境变量 RETRY_SLEEP_DISABLED=true 打开
 */
@Data
@ConfigurationProperties(prefix = "retry")
public class RetryPolicyProperties {

    /** 首次失败后最多重试次数 */
    private int retryCount = 3;

    /** 每次重试前的基准间隔，不配置则不等待 */
    private Duration retrySleep;

    /** 指数退避：忽略 retry-sleep，从 1s 起每次翻倍 */
    private boolean exponentialBackoff = false;

    /** 是否输出 attempt / success / failure 事件 */
    private boolean logRetries = true;

    /** 最大随机抖动 */
    private Duration jitter = Duration.ofMillis(1000);

    /** 全局禁用等待 */
    private boolean sleepDisabled = false;

    private Metrics metrics = new Metrics();

    private PolicyRoot policy = new PolicyRoot();

    @Data
    public static class Metrics {
        /** 是否注册 micrometer 指标监听器 */
        private boolean enabled = true;
    }

    @Data
    public static class PolicyRoot {
        /** 启动时把刷新容器的线程指定为策略注册表的根线程 */
        private boolean designateStartupRoot = true;
    }

    public RetryOptions toDefaultOptions() {
        return RetryOptions.builder()
                .retryCount(retryCount)
                .retrySleep(retrySleep)
                .exponentialBackoff(exponentialBackoff)
                .logRetries(logRetries)
                .jitterMillis(jitter == null ? 0L : jitter.toMillis())
                .build();
    }
}
