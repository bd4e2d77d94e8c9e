package com.retrypolicy.core;

import com.retrypolicy.core.spi.RetryEventListener;
import com.retrypolicy.model.enums.RetryEventType;
import com.retrypolicy.model.event.RetryEvent;

import java.util.ArrayList;
import java.util.List;

public class RecordingRetryListener implements RetryEventListener {

    private final List<RetryEvent> events = new ArrayList<>();

    @Override
    public String name() {
        return "recording";
    }

    @Override
    public void onEvent(RetryEvent event) {
        events.add(event);
    }

    public List<RetryEvent> events() {
        return events;
    }

    public List<RetryEvent> events(RetryEventType type) {
        return events.stream().filter(e -> e.getType() == type).toList();
    }
}
