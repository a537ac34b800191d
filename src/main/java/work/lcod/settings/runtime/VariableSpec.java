package work.lcod.settings.runtime;

import java.util.Objects;
import java.util.Optional;
import work.lcod.settings.shared.Names;
import work.lcod.settings.validation.ValidationRules;

/**
 * One declared variable: its type, default, validation rules and optional storage callbacks.
 */
public record VariableSpec(
    String name,
    String storageKey,
    VariableType type,
    Object defaultValue,
    ValidationRules rules,
    Optional<SettingsReader> reader,
    Optional<SettingsWriter> writer
) {
    public VariableSpec {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(storageKey, "storageKey");
        Objects.requireNonNull(type, "type");
        rules = rules == null ? ValidationRules.none() : rules;
        reader = reader == null ? Optional.empty() : reader;
        writer = writer == null ? Optional.empty() : writer;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public boolean hasRules() {
        return !rules.isEmpty();
    }

    public static final class Builder {
        private final String name;
        private VariableType type = VariableType.STRING;
        private Object defaultValue;
        private ValidationRules rules = ValidationRules.none();
        private SettingsReader reader;
        private SettingsWriter writer;

        private Builder(String name) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("variable name is required");
            }
            this.name = name;
        }

        public Builder type(VariableType type) {
            this.type = Objects.requireNonNull(type, "type");
            return this;
        }

        public Builder defaultValue(Object defaultValue) {
            this.defaultValue = defaultValue;
            return this;
        }

        public Builder rules(ValidationRules rules) {
            this.rules = rules == null ? ValidationRules.none() : rules;
            return this;
        }

        public Builder reader(SettingsReader reader) {
            this.reader = reader;
            return this;
        }

        public Builder writer(SettingsWriter writer) {
            this.writer = writer;
            return this;
        }

        public VariableSpec build() {
            return new VariableSpec(
                name,
                Names.storageKey(name),
                type,
                defaultValue,
                rules,
                Optional.ofNullable(reader),
                Optional.ofNullable(writer)
            );
        }
    }
}
