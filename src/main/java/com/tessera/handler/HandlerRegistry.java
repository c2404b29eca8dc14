package com.tessera.handler;

import com.tessera.error.PlanningException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Registry of data handlers by integration name.
 *
 * Lookups are case-insensitive and lock-free against an immutable snapshot;
 * writes are serialized and publish a new snapshot, so an in-flight query never
 * observes a half-updated registry.
 */
@Component
public class HandlerRegistry {

    private static final Logger log = LoggerFactory.getLogger(HandlerRegistry.class);

    private volatile Map<String, DataHandler> handlers = Collections.emptyMap();
    private final List<Consumer<String>> unregisterListeners = new CopyOnWriteArrayList<>();

    /**
     * Registers a handler under its descriptor name
     *
     * @throws IllegalArgumentException if the name is already taken
     */
    public synchronized void register(DataHandler handler) {
        String key = key(handler.getName());
        if (handlers.containsKey(key)) {
            throw new IllegalArgumentException("Integration '" + handler.getName() + "' is already registered");
        }
        Map<String, DataHandler> next = new LinkedHashMap<>(handlers);
        next.put(key, handler);
        handlers = Collections.unmodifiableMap(next);
        log.info("Registered integration {} ({})", handler.getName(), handler.getDescriptor().getKind());
    }

    /**
     * Removes a handler, disconnects it and notifies listeners
     *
     * @return the removed handler, if one was registered
     */
    public Optional<DataHandler> unregister(String name) {
        DataHandler removed;
        synchronized (this) {
            String key = key(name);
            removed = handlers.get(key);
            if (removed == null) {
                return Optional.empty();
            }
            Map<String, DataHandler> next = new LinkedHashMap<>(handlers);
            next.remove(key);
            handlers = Collections.unmodifiableMap(next);
        }
        removed.disconnect();
        unregisterListeners.forEach(listener -> listener.accept(removed.getName()));
        log.info("Unregistered integration {}", removed.getName());
        return Optional.of(removed);
    }

    public Optional<DataHandler> get(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(handlers.get(key(name)));
    }

    /**
     * @throws PlanningException if no integration has that name
     */
    public DataHandler require(String name) {
        return get(name).orElseThrow(() -> new PlanningException("Unknown integration '" + name + "'"));
    }

    public boolean contains(String name) {
        return get(name).isPresent();
    }

    public List<DataHandler> getAll() {
        return new ArrayList<>(handlers.values());
    }

    /**
     * Called with the handler name after each unregistration
     */
    public void addUnregisterListener(Consumer<String> listener) {
        unregisterListeners.add(listener);
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
