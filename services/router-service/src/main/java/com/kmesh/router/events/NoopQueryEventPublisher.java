package com.kmesh.router.events;

public class NoopQueryEventPublisher implements QueryEventPublisher {
    @Override
    public void publish(QueryCompletedEvent event) {
    }
}
