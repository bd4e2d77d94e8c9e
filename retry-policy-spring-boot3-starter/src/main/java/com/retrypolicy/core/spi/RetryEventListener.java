package com.retrypolicy.core.spi;

import com.retrypolicy.model.enums.RetryEventType;
import com.retrypolicy.model.event.RetryEvent;

/**
 * 重试事件监听器（日志、指标等）
 */
public interface RetryEventListener {

    /**
     * 监听器名称, 用于日志纬度
     */
    String name();

    /**
     * 能否处理此事件, 粗粒度过滤
     */
    default boolean supports(RetryEventType type) {
        return true;
    }

    /**
     * 同步回调，在调用线程上按发生顺序执行
     */
    void onEvent(RetryEvent event);
}
