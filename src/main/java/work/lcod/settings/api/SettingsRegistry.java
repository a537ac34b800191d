package work.lcod.settings.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.settings.core.Symbol;
import work.lcod.settings.core.TypeCoercer;
import work.lcod.settings.runtime.SettingsException;
import work.lcod.settings.runtime.SettingsReader;
import work.lcod.settings.runtime.SettingsWriter;
import work.lcod.settings.runtime.StorageResolver;
import work.lcod.settings.runtime.UnknownVariableException;
import work.lcod.settings.runtime.VariableSpec;
import work.lcod.settings.runtime.VariableType;
import work.lcod.settings.shared.Values;
import work.lcod.settings.validation.FieldLookup;
import work.lcod.settings.validation.ValidationEngine;
import work.lcod.settings.validation.ValidationException;
import work.lcod.settings.validation.ValidationRules;

/**
 * Catalog of declared variables. Declare once at startup, then read, write and validate from any thread.
 * <p>
 * Nothing is cached: every {@link #get(String)} goes back to the backend.
 */
public final class SettingsRegistry {
    private static final Logger LOG = LoggerFactory.getLogger(SettingsRegistry.class);
    private static final ObjectWriter JSON_WRITER = new ObjectMapper()
        .registerModule(new SimpleModule().addSerializer(Symbol.class, ToStringSerializer.instance))
        .writerWithDefaultPrettyPrinter();

    private final StorageResolver storage;
    private final ValidationEngine validation;
    private final FieldLookup fields = new RegistryFields();
    private volatile Map<String, VariableSpec> specs = Map.of();

    public SettingsRegistry() {
        this(RegistryConfiguration.defaults());
    }

    public SettingsRegistry(RegistryConfiguration configuration) {
        this.storage = new StorageResolver(configuration.environment());
        this.validation = configuration.validationEngine();
    }

    public VariableSpec declare(String name, VariableType type, Object defaultValue) {
        return declare(VariableSpec.builder(name).type(type).defaultValue(defaultValue).build());
    }

    public VariableSpec declare(String name, VariableType type, Object defaultValue, ValidationRules rules) {
        return declare(VariableSpec.builder(name).type(type).defaultValue(defaultValue).rules(rules).build());
    }

    public VariableSpec declare(
        String name,
        VariableType type,
        Object defaultValue,
        ValidationRules rules,
        SettingsReader reader,
        SettingsWriter writer
    ) {
        return declare(VariableSpec.builder(name)
            .type(type)
            .defaultValue(defaultValue)
            .rules(rules)
            .reader(reader)
            .writer(writer)
            .build());
    }

    /**
     * Registers or replaces a variable; a later declaration with the same name wins.
     *
     * @throws IllegalArgumentException when the rules name something the validation engine does not support
     */
    public synchronized VariableSpec declare(VariableSpec spec) {
        if (spec.hasRules()) {
            validation.verify(spec.name(), spec.rules());
        }
        Map<String, VariableSpec> next = new LinkedHashMap<>(specs);
        if (next.put(spec.name(), spec) != null) {
            LOG.debug("Variable {} re-declared; the latest declaration replaces the previous one", spec.name());
        }
        specs = Collections.unmodifiableMap(next);
        return spec;
    }

    public SettingsRegistry defaultReader(SettingsReader reader) {
        storage.setDefaultReader(reader);
        return this;
    }

    public SettingsRegistry defaultWriter(SettingsWriter writer) {
        storage.setDefaultWriter(writer);
        return this;
    }

    public Optional<VariableSpec> spec(String name) {
        return Optional.ofNullable(specs.get(name));
    }

    public List<String> variables() {
        return List.copyOf(specs.keySet());
    }

    public boolean isDeclared(String name) {
        return specs.containsKey(name);
    }

    /**
     * Resolves the current value: raw value from the chosen reader coerced to the declared type,
     * or the declared default when the reader has nothing.
     */
    public Object get(String name) {
        VariableSpec spec = require(name);
        Object raw = storage.read(spec);
        if (raw == null) {
            return spec.defaultValue();
        }
        return TypeCoercer.coerce(raw, spec.type());
    }

    public <T> T get(String name, Class<T> type) {
        return type.cast(get(name));
    }

    /**
     * Validates {@code value} against the variable's rules, then hands it to the resolved writer.
     *
     * @throws ValidationException when a rule fails; no writer is called
     * @throws work.lcod.settings.runtime.ReadOnlyException when no writer is configured
     */
    public void set(String name, Object value) {
        VariableSpec spec = require(name);
        if (spec.hasRules()) {
            List<String> violations = validation.validate(name, value, spec.rules(), fields);
            if (!violations.isEmpty()) {
                throw new ValidationException(violations);
            }
        }
        storage.write(spec, value);
    }

    public boolean isWritable(String name) {
        return storage.isWritable(require(name));
    }

    /**
     * Violations for one variable's current value; empty when valid or when it has no rules.
     */
    public List<String> validate(String name) {
        VariableSpec spec = require(name);
        if (!spec.hasRules()) {
            return List.of();
        }
        return validation.validate(name, get(name), spec.rules(), fields);
    }

    /**
     * Validates every variable that has rules and reports all violations together.
     */
    public void validateAll() {
        List<String> violations = new ArrayList<>();
        for (VariableSpec spec : specs.values()) {
            if (spec.hasRules()) {
                violations.addAll(validation.validate(spec.name(), get(spec.name()), spec.rules(), fields));
            }
        }
        if (!violations.isEmpty()) {
            throw new ValidationException(violations);
        }
    }

    /**
     * Snapshot of every declared variable in declaration order. Each entry is resolved independently.
     */
    public Map<String, Object> enumerate() {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        for (String name : specs.keySet()) {
            snapshot.put(name, get(name));
        }
        return Collections.unmodifiableMap(snapshot);
    }

    public String toJson() {
        return writeJson(enumerate());
    }

    /**
     * Pretty JSON of the named variables only, in the order given.
     */
    public String toJson(Collection<String> names) {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        for (String name : names) {
            snapshot.put(name, get(name));
        }
        return writeJson(snapshot);
    }

    private static String writeJson(Map<String, Object> snapshot) {
        try {
            return JSON_WRITER.writeValueAsString(snapshot);
        } catch (JsonProcessingException ex) {
            throw new SettingsException("Unable to serialize settings snapshot: " + ex.getOriginalMessage(), ex);
        }
    }

    public boolean isPresent(String name) {
        return !Values.isBlank(get(name));
    }

    public boolean isTrue(String name) {
        return Boolean.TRUE.equals(get(name));
    }

    private VariableSpec require(String name) {
        VariableSpec spec = specs.get(name);
        if (spec == null) {
            throw new UnknownVariableException(name);
        }
        return spec;
    }

    private final class RegistryFields implements FieldLookup {
        @Override
        public boolean isDeclared(String name) {
            return SettingsRegistry.this.isDeclared(name);
        }

        @Override
        public Object valueOf(String name) {
            return get(name);
        }
    }
}
