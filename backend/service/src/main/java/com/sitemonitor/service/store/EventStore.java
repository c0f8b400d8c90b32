package com.sitemonitor.service.store;

import com.sitemonitor.core.events.Event;

public interface EventStore {
    void append(Event event);
}
