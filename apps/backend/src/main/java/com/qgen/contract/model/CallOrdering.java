package com.qgen.contract.model;

import java.util.List;
import java.util.Set;

/**
 * State writes and external effects of one branch in source order.
 */
public record CallOrdering(List<Event> events) {

    public CallOrdering {
        events = List.copyOf(events);
    }

    public enum EventType { STATE_WRITE, FUND_TRANSFER, EXTERNAL_CALL }

    /**
     * @param domain for writes the written key; for external effects the state keys feeding their arguments
     */
    public record Event(EventType type, String call, Set<String> domain, int line) {
        public Event {
            domain = Set.copyOf(domain);
        }

        public boolean isExternalEffect() {
            return type != EventType.STATE_WRITE;
        }
    }
}
