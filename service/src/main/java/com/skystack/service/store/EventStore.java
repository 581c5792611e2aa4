package com.skystack.service.store;

import com.skystack.core.events.Event;

public interface EventStore {
    void append(Event event);
}
