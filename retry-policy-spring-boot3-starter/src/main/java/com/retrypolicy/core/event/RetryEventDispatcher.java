package com.retrypolicy.core.event;

import com.retrypolicy.core.spi.RetryEventListener;
import com.retrypolicy.model.event.RetryEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 同步派发重试事件
 * 监听器异常只记录日志，不影响被重试操作的结果或异常
 */
public class RetryEventDispatcher {

    private final Logger log = LoggerFactory.getLogger(RetryEventDispatcher.class);

    private final List<RetryEventListener> listeners;

    public RetryEventDispatcher(List<RetryEventListener> listeners) {
        this.listeners = listeners == null ? List.of() : List.copyOf(listeners);
    }

    public void publish(RetryEvent event) {
        for (RetryEventListener l : listeners) {
            if (!l.supports(event.getType())) {
                continue;
            }
            try {
                l.onEvent(event);
            } catch (RuntimeException e) {
                log.error("[RetryEvent] listener={} event={} retryId={} failed",
                        l.name(), event.getType(), event.getRetryId(), e);
            }
        }
    }

    public List<RetryEventListener> getListeners() {
        return listeners;
    }
}
