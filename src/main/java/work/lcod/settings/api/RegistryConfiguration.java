package work.lcod.settings.api;

import java.util.Objects;
import work.lcod.settings.runtime.EnvironmentSource;
import work.lcod.settings.validation.BuiltinValidationEngine;
import work.lcod.settings.validation.ValidationEngine;

/**
 * Immutable construction-time choices for a {@link SettingsRegistry}.
 */
public record RegistryConfiguration(EnvironmentSource environment, ValidationEngine validationEngine) {
    public RegistryConfiguration {
        Objects.requireNonNull(environment, "environment");
        Objects.requireNonNull(validationEngine, "validationEngine");
    }

    public static RegistryConfiguration defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private EnvironmentSource environment = EnvironmentSource.system();
        private ValidationEngine validationEngine;

        public Builder environment(EnvironmentSource environment) {
            this.environment = environment;
            return this;
        }

        public Builder validationEngine(ValidationEngine validationEngine) {
            this.validationEngine = validationEngine;
            return this;
        }

        public RegistryConfiguration build() {
            return new RegistryConfiguration(
                environment,
                validationEngine == null ? new BuiltinValidationEngine() : validationEngine
            );
        }
    }
}
