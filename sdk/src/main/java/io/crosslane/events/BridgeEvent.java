package io.crosslane.events;

import com.fasterxml.jackson.annotation.JsonView;
import io.crosslane.json.Views;

/**
 * Record appended to the event log. Events are never modified or removed once deposited.
 */
@JsonView(Views.Default.class)
public abstract class BridgeEvent {

    public String getType() {
        return getClass().getSimpleName();
    }
}
