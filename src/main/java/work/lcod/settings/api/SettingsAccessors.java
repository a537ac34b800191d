package work.lcod.settings.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import work.lcod.settings.runtime.UnknownVariableException;
import work.lcod.settings.runtime.VariableType;

/**
 * Name-keyed dispatch table of per-variable accessors built on top of a {@link SettingsRegistry}.
 * Build it after declarations are done; variables declared later are not picked up.
 */
public final class SettingsAccessors {
    private final Map<String, Accessor> accessors;

    private SettingsAccessors(Map<String, Accessor> accessors) {
        this.accessors = accessors;
    }

    public static SettingsAccessors of(SettingsRegistry registry) {
        Objects.requireNonNull(registry, "registry");
        Map<String, Accessor> table = new LinkedHashMap<>();
        for (String name : registry.variables()) {
            boolean flag = registry.spec(name).map(spec -> spec.type() == VariableType.BOOLEAN).orElse(false);
            table.put(name, new Accessor(registry, name, flag));
        }
        return new SettingsAccessors(Collections.unmodifiableMap(table));
    }

    public Accessor accessor(String name) {
        Accessor accessor = accessors.get(name);
        if (accessor == null) {
            throw new UnknownVariableException(name);
        }
        return accessor;
    }

    public Set<String> names() {
        return accessors.keySet();
    }

    /**
     * Getter, setter, presence check and (boolean variables only) truthiness check for one variable.
     */
    public static final class Accessor {
        private final SettingsRegistry registry;
        private final String name;
        private final boolean flag;

        private Accessor(SettingsRegistry registry, String name, boolean flag) {
            this.registry = registry;
            this.name = name;
            this.flag = flag;
        }

        public String name() {
            return name;
        }

        public Object get() {
            return registry.get(name);
        }

        public void set(Object value) {
            registry.set(name, value);
        }

        public boolean isPresent() {
            return registry.isPresent(name);
        }

        public boolean hasTruthCheck() {
            return flag;
        }

        public boolean isTrue() {
            if (!flag) {
                throw new UnsupportedOperationException("'" + name + "' is not a boolean variable");
            }
            return registry.isTrue(name);
        }
    }
}
