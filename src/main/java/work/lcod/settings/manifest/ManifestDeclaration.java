package work.lcod.settings.manifest;

import java.util.Objects;
import work.lcod.settings.runtime.VariableSpec;
import work.lcod.settings.runtime.VariableType;
import work.lcod.settings.validation.ValidationRules;

/**
 * One variable read from a manifest. Manifests cannot carry reader/writer callbacks.
 */
public record ManifestDeclaration(String name, VariableType type, Object defaultValue, ValidationRules rules) {
    public ManifestDeclaration {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        rules = rules == null ? ValidationRules.none() : rules;
    }

    public VariableSpec toSpec() {
        return VariableSpec.builder(name).type(type).defaultValue(defaultValue).rules(rules).build();
    }
}
