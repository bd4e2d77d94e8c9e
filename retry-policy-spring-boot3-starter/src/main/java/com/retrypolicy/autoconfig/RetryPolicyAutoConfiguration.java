package com.retrypolicy.autoconfig;

import com.retrypolicy.config.RetryPolicyProperties;
import com.retrypolicy.core.RetryExecutor;
import com.retrypolicy.core.backoff.ThreadLocalRandomJitterSource;
import com.retrypolicy.core.backoff.ThreadRetrySleeper;
import com.retrypolicy.core.event.listener.LoggingRetryListener;
import com.retrypolicy.core.spi.JitterSource;
import com.retrypolicy.core.spi.RetryEventListener;
import com.retrypolicy.core.spi.RetrySleeper;
import com.retrypolicy.policy.PolicyRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * 重试执行器及其可替换组件
 */
@AutoConfiguration
@EnableConfigurationProperties(RetryPolicyProperties.class)
public class RetryPolicyAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicyAutoConfiguration.class);

    /**
     * 容器在启动线程上刷新，之后的工作线程都从它复制策略
     */
    public RetryPolicyAutoConfiguration(RetryPolicyProperties props) {
        if (props.getPolicy().isDesignateStartupRoot()) {
            Thread startup = Thread.currentThread();
            PolicyRegistry.designateRootContext(startup);
            log.info("[Retry-Policy] root context designated: thread={}", startup.getName());
        }
    }

    /**
     * 等待实现
     */
    @Bean
    @ConditionalOnMissingBean(RetrySleeper.class)
    public RetrySleeper retrySleeper() {
        return new ThreadRetrySleeper();
    }

    /**
     * 抖动随机源
     */
    @Bean
    @ConditionalOnMissingBean(JitterSource.class)
    public JitterSource jitterSource() {
        return new ThreadLocalRandomJitterSource();
    }

    /**
     * 结构化日志监听器, 默认启用
     */
    @Bean
    @ConditionalOnMissingBean(name = "loggingRetryListener")
    public RetryEventListener loggingRetryListener() {
        return new LoggingRetryListener();
    }

    /**
     * 重试执行器
     */
    @Bean
    @ConditionalOnMissingBean(RetryExecutor.class)
    public RetryExecutor retryExecutor(RetryPolicyProperties props,
                                       RetrySleeper sleeper,
                                       JitterSource jitterSource,
                                       ObjectProvider<RetryEventListener> listeners) {
        if (props.isSleepDisabled()) {
            log.warn("[Retry-Executor] retry.sleep-disabled=true, all retry sleeps are skipped");
        }
        RetryExecutor executor = RetryExecutor.builder()
                .defaults(props.toDefaultOptions())
                .sleeper(sleeper)
                .jitterSource(jitterSource)
                .sleepDisabled(props.isSleepDisabled())
                .listeners(listeners.orderedStream().toList())
                .build();
        log.info("[Retry-Executor] created: retryCount={}, retrySleep={}, exponentialBackoff={}, jitter={}ms, listeners={}",
                props.getRetryCount(), props.getRetrySleep(), props.isExponentialBackoff(),
                props.getJitter() == null ? 0 : props.getJitter().toMillis(),
                executor.getListeners().stream().map(RetryEventListener::name).toList());
        return executor;
    }
}
