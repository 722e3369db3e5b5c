package io.obscur.retry;

import io.obscur.model.NostrEvent;
import io.obscur.model.RelayResult;

import java.util.List;

/** Transport seam: publishes one signed event to the given relays. */
@FunctionalInterface
public interface RelayPublisher {

    /** One result per relay; a relay that cannot be reached reports a failed result. */
    List<RelayResult> publish(NostrEvent event, List<String> relayUrls);
}
