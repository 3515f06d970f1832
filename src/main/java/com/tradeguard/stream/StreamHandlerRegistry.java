package com.tradeguard.stream;

import com.tradeguard.exception.ConfigurationException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** Handlers keyed by service name, fixed at construction. */
public class StreamHandlerRegistry {

    private final Map<String, StreamEventHandler> handlers = new LinkedHashMap<>();

    public StreamHandlerRegistry(List<StreamEventHandler> handlers) {
        for (StreamEventHandler handler : handlers) {
            String service = handler.serviceName();
            if (EventStreamCatalog.service(service).isEmpty()) {
                throw new ConfigurationException("Handler " + handler.getClass().getSimpleName()
                        + " is registered for unknown service " + service);
            }
            StreamEventHandler previous = this.handlers.putIfAbsent(service, handler);
            if (previous != null) {
                throw new ConfigurationException("Service " + service + " has two handlers: "
                        + previous.getClass().getSimpleName() + " and " + handler.getClass().getSimpleName());
            }
        }
    }

    public Optional<StreamEventHandler> find(String serviceName) {
        return Optional.ofNullable(handlers.get(serviceName));
    }

    public Set<String> serviceNames() {
        return handlers.keySet();
    }
}
