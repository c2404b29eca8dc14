package com.tessera.predictor;

import com.tessera.error.PlanningException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Model engines by name. Every {@link ModelEngine} bean is registered at startup.
 */
@Component
public class ModelEngineRegistry {

    private static final Logger log = LoggerFactory.getLogger(ModelEngineRegistry.class);

    private volatile Map<String, ModelEngine> engines = Collections.emptyMap();
    private final String defaultEngine;

    public ModelEngineRegistry(List<ModelEngine> engines,
                               @Value("${tessera.models.default-engine:process}") String defaultEngine) {
        this.defaultEngine = defaultEngine;
        engines.forEach(this::register);
    }

    public synchronized void register(ModelEngine engine) {
        Map<String, ModelEngine> next = new LinkedHashMap<>(engines);
        next.put(engine.name().toLowerCase(Locale.ROOT), engine);
        engines = Collections.unmodifiableMap(next);
        log.info("Registered model engine {}", engine.name());
    }

    /**
     * @param name engine name, or null for the configured default
     * @throws PlanningException if no engine has that name
     */
    public ModelEngine require(String name) {
        String key = (name != null ? name : defaultEngine).toLowerCase(Locale.ROOT);
        ModelEngine engine = engines.get(key);
        if (engine == null) {
            throw new PlanningException("Unknown model engine '" + (name != null ? name : defaultEngine) + "'");
        }
        return engine;
    }
}
