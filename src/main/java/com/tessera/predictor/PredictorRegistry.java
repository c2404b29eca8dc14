package com.tessera.predictor;

import com.tessera.error.PlanningException;
import com.tessera.query.ast.CreatePredictorStatement;
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

/**
 * Registry of predictors by name, with the statement each was created from.
 *
 * Same publication rules as the handler registry: case-insensitive lookups
 * against an immutable snapshot, serialized copy-on-write updates.
 */
@Component
public class PredictorRegistry {

    private static final Logger log = LoggerFactory.getLogger(PredictorRegistry.class);

    private volatile Map<String, Entry> predictors = Collections.emptyMap();

    /**
     * Register a predictor that has no stored definition (it cannot be retrained)
     */
    public void register(Predictor predictor) {
        register(predictor, null);
    }

    /**
     * @throws IllegalArgumentException if the name is already taken
     */
    public synchronized void register(Predictor predictor, CreatePredictorStatement definition) {
        String key = key(predictor.getName());
        if (predictors.containsKey(key)) {
            throw new IllegalArgumentException("Predictor '" + predictor.getName() + "' already exists");
        }
        publish(key, new Entry(predictor, definition));
        log.info("Registered predictor {} (timeseries={})", predictor.getName(), predictor.getDescriptor().isTimeseries());
    }

    /**
     * Swap in a retrained predictor, keeping its definition
     *
     * @throws PlanningException if the predictor is unknown
     */
    public synchronized void replace(Predictor predictor) {
        String key = key(predictor.getName());
        Entry current = predictors.get(key);
        if (current == null) {
            throw new PlanningException("Unknown predictor '" + predictor.getName() + "'");
        }
        publish(key, new Entry(predictor, current.definition));
        log.info("Replaced predictor {}", predictor.getName());
    }

    public synchronized Optional<Predictor> unregister(String name) {
        String key = key(name);
        Entry removed = predictors.get(key);
        if (removed == null) {
            return Optional.empty();
        }
        Map<String, Entry> next = new LinkedHashMap<>(predictors);
        next.remove(key);
        predictors = Collections.unmodifiableMap(next);
        log.info("Unregistered predictor {}", removed.predictor.getName());
        return Optional.of(removed.predictor);
    }

    public Optional<Predictor> get(String name) {
        if (name == null) {
            return Optional.empty();
        }
        Entry entry = predictors.get(key(name));
        return entry != null ? Optional.of(entry.predictor) : Optional.empty();
    }

    /**
     * @throws PlanningException if no predictor has that name
     */
    public Predictor require(String name) {
        return get(name).orElseThrow(() -> new PlanningException("Unknown predictor '" + name + "'"));
    }

    public boolean contains(String name) {
        return get(name).isPresent();
    }

    public Optional<CreatePredictorStatement> getDefinition(String name) {
        Entry entry = name != null ? predictors.get(key(name)) : null;
        return entry != null ? Optional.ofNullable(entry.definition) : Optional.empty();
    }

    public List<Predictor> getAll() {
        List<Predictor> all = new ArrayList<>();
        predictors.values().forEach(entry -> all.add(entry.predictor));
        return all;
    }

    private void publish(String key, Entry entry) {
        Map<String, Entry> next = new LinkedHashMap<>(predictors);
        next.put(key, entry);
        predictors = Collections.unmodifiableMap(next);
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    private static final class Entry {
        private final Predictor predictor;
        private final CreatePredictorStatement definition;

        private Entry(Predictor predictor, CreatePredictorStatement definition) {
            this.predictor = predictor;
            this.definition = definition;
        }
    }
}
