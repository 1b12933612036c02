package com.kmesh.router.events;

/**
 * Fire-and-forget sink for query feedback. Implementations must never throw into the caller.
 */
public interface QueryEventPublisher {
    void publish(QueryCompletedEvent event);
}
