package com.inventorysense.api.services;

import com.inventorysense.engine.errors.InsufficientDataException;
import com.inventorysense.engine.model.FeatureImportance;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the feature importances most recently published by the model-training subsystem.
 * Each publication replaces the previous one atomically.
 */
@ApplicationScoped
public class FeatureImportanceStore {

    private static final Logger LOG = Logger.getLogger(FeatureImportanceStore.class);

    /**
     * One published set of importances.
     */
    public record Published(String model, List<FeatureImportance> importances, long publishedAt) {}

    private final AtomicReference<Published> published = new AtomicReference<>();

    public Published publish(String model, List<FeatureImportance> importances) {
        if (importances == null || importances.isEmpty()) {
            throw new IllegalArgumentException("At least one feature importance is required");
        }
        Published next = new Published(model, List.copyOf(importances), System.currentTimeMillis());
        published.set(next);
        LOG.infof("Published %d feature importances from model %s", importances.size(), model);
        return next;
    }

    /**
     * @throws InsufficientDataException if nothing has been published yet
     */
    public Published current() {
        Published current = published.get();
        if (current == null) {
            throw new InsufficientDataException("Model not trained yet");
        }
        return current;
    }
}
