package com.enterprise.bulkload.load.domain;

import com.enterprise.bulkload.load.domain.exception.LoadConfigurationException;
import com.enterprise.bulkload.sql.core.ConflictStrategy;
import com.enterprise.bulkload.sql.validation.IdentifierValidator;

import java.util.List;
import java.util.Objects;

/**
 * Conflict handling for the run.
 *
 * @param keys          conflict-target columns, required for {@link ConflictStrategy#UPSERT}
 * @param updateColumns columns refreshed from the attempted row on conflict; may be empty
 */
public record ConflictPolicy(ConflictStrategy strategy, List<String> keys, List<String> updateColumns) {

    public ConflictPolicy {
        Objects.requireNonNull(strategy, "strategy");
        keys = keys == null ? List.of() : List.copyOf(keys);
        updateColumns = updateColumns == null ? List.of() : List.copyOf(updateColumns);
        if (strategy == ConflictStrategy.UPSERT && keys.isEmpty()) {
            throw new LoadConfigurationException("Upsert requires at least one conflict key");
        }
        IdentifierValidator.requireIdentifiers(keys);
        IdentifierValidator.requireIdentifiers(updateColumns);
    }

    public static ConflictPolicy none() {
        return new ConflictPolicy(ConflictStrategy.NONE, List.of(), List.of());
    }

    public static ConflictPolicy ignore() {
        return new ConflictPolicy(ConflictStrategy.IGNORE, List.of(), List.of());
    }

    public static ConflictPolicy replace() {
        return new ConflictPolicy(ConflictStrategy.REPLACE, List.of(), List.of());
    }

    public static ConflictPolicy upsert(List<String> keys, List<String> updateColumns) {
        return new ConflictPolicy(ConflictStrategy.UPSERT, keys, updateColumns);
    }

    public boolean isUpsert() {
        return strategy == ConflictStrategy.UPSERT;
    }
}
