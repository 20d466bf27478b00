package com.myorg.evreg.delivery.reprocess;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

// original topic -> handler
public class RecoveryHandlerRegistry {
    private final Map<String, RecoveryHandler> handlers = new ConcurrentHashMap<>();

    public void register(String topic, RecoveryHandler handler) {
        RecoveryHandler previous = handlers.putIfAbsent(topic, handler);
        if (previous != null && previous != handler) {
            // first registration wins
            throw new IllegalStateException("Recovery handler for topic '" + topic + "' registered twice");
        }
    }

    public RecoveryHandler get(String topic) {
        return handlers.get(topic);
    }

    public Set<String> topics() {
        return Set.copyOf(handlers.keySet());
    }
}
