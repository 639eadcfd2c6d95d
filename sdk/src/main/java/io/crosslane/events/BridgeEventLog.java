package io.crosslane.events;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

// Append-only in-memory event log.
public class BridgeEventLog implements BridgeEventSink {
    private static final Logger logger = LogManager.getLogger();

    private final List<BridgeEvent> events = new ArrayList<>();

    @Override
    public void deposit(BridgeEvent event) {
        logger.trace("Event deposited: {}", event);
        events.add(event);
    }

    public List<BridgeEvent> events() {
        return Collections.unmodifiableList(events);
    }

    public <T extends BridgeEvent> List<T> eventsOfType(Class<T> type) {
        return events.stream().filter(type::isInstance).map(type::cast).collect(Collectors.toList());
    }
}
