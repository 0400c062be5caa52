package com.questrail.designer.config;

import com.questrail.designer.internal.ids.IdGenerator;
import com.questrail.designer.internal.ids.RandomIdGenerator;
import com.questrail.designer.internal.time.SystemWallClock;
import com.questrail.designer.internal.time.WallClock;
import com.questrail.designer.observability.DiagramObservabilitySink;
import com.questrail.designer.observability.NullObservabilitySink;
import com.questrail.designer.validation.ConnectionValidator;

import java.util.Objects;

/**
 * Aggregated configuration for a diagram store.
 *
 * @param historyCapacity        maximum undo steps, at least 1
 * @param enforceFieldValidation when true, node additions and payload edits that
 *                               fail field validation are rejected
 */
public record DiagramStoreConfig(
    int historyCapacity,
    boolean enforceFieldValidation,
    GeneratorSettings generatorSettings,
    ConnectionValidator connectionValidator,
    DiagramObservabilitySink observabilitySink,
    IdGenerator idGenerator,
    WallClock wallClock
) {
    public static final int DEFAULT_HISTORY_CAPACITY = 50;

    public DiagramStoreConfig {
        Objects.requireNonNull(generatorSettings, "generatorSettings");
        Objects.requireNonNull(connectionValidator, "connectionValidator");
        Objects.requireNonNull(observabilitySink, "observabilitySink");
        Objects.requireNonNull(idGenerator, "idGenerator");
        Objects.requireNonNull(wallClock, "wallClock");
        if (historyCapacity < 1) {
            throw new IllegalArgumentException("historyCapacity must be at least 1");
        }
    }

    public static DiagramStoreConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int historyCapacity = DEFAULT_HISTORY_CAPACITY;
        private boolean enforceFieldValidation = false;
        private GeneratorSettings generatorSettings = GeneratorSettings.defaults();
        private ConnectionValidator connectionValidator = new ConnectionValidator();
        private DiagramObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private IdGenerator idGenerator = RandomIdGenerator.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;

        public Builder withHistoryCapacity(int historyCapacity) {
            this.historyCapacity = historyCapacity;
            return this;
        }

        public Builder withEnforceFieldValidation(boolean enforceFieldValidation) {
            this.enforceFieldValidation = enforceFieldValidation;
            return this;
        }

        public Builder withGeneratorSettings(GeneratorSettings generatorSettings) {
            this.generatorSettings = generatorSettings;
            return this;
        }

        public Builder withConnectionValidator(ConnectionValidator connectionValidator) {
            this.connectionValidator = connectionValidator;
            return this;
        }

        public Builder withObservabilitySink(DiagramObservabilitySink observabilitySink) {
            this.observabilitySink = observabilitySink;
            return this;
        }

        public Builder withIdGenerator(IdGenerator idGenerator) {
            this.idGenerator = idGenerator;
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        public DiagramStoreConfig build() {
            return new DiagramStoreConfig(historyCapacity, enforceFieldValidation, generatorSettings,
                    connectionValidator, observabilitySink, idGenerator, wallClock);
        }
    }
}
