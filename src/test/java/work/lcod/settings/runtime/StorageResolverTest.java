package work.lcod.settings.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class StorageResolverTest {
    private final EnvironmentSource environment = EnvironmentSource.of(Map.of("API_KEY", "from_env"));

    @Test
    void readsEnvironmentByStorageKey() {
        var resolver = new StorageResolver(environment);
        assertEquals("from_env", resolver.read(VariableSpec.builder("api_key").build()));
        assertNull(resolver.read(VariableSpec.builder("missing").build()));
    }

    @Test
    void defaultReaderReplacesEnvironment() {
        var resolver = new StorageResolver(environment);
        resolver.setDefaultReader((key, spec) -> "default:" + key);
        assertEquals("default:API_KEY", resolver.read(VariableSpec.builder("api_key").build()));
    }

    @Test
    void variableReaderWinsAndDoesNotChain() {
        var resolver = new StorageResolver(environment);
        List<String> consulted = new ArrayList<>();
        resolver.setDefaultReader((key, spec) -> {
            consulted.add("default");
            return "from_default";
        });
        var spec = VariableSpec.builder("api_key")
            .reader((key, s) -> {
                consulted.add("own");
                return null;
            })
            .build();

        assertNull(resolver.read(spec));
        assertEquals(List.of("own"), consulted);
    }

    @Test
    void readerReceivesKeyAndSpec() {
        var resolver = new StorageResolver(environment);
        List<VariableSpec> captured = new ArrayList<>();
        var spec = VariableSpec.builder("api_key")
            .type(VariableType.STRING)
            .defaultValue("default_key")
            .reader((key, s) -> {
                captured.add(s);
                return key;
            })
            .build();

        assertEquals("API_KEY", resolver.read(spec));
        assertEquals(spec, captured.get(0));
        assertEquals("default_key", captured.get(0).defaultValue());
    }

    @Test
    void writeWithoutAnyWriterIsReadOnly() {
        var resolver = new StorageResolver(environment);
        var spec = VariableSpec.builder("database_url").build();
        assertFalse(resolver.isWritable(spec));
        var ex = assertThrows(ReadOnlyException.class, () -> resolver.write(spec, "postgres://"));
        assertTrue(ex.getMessage().contains("Cannot write to 'database_url': variable is read-only"));
        assertEquals("database_url", ex.name());
    }

    @Test
    void variableWriterWinsOverDefaultWriter() {
        var resolver = new StorageResolver(environment);
        Map<String, Object> storage = new HashMap<>();
        resolver.setDefaultWriter((key, value, spec) -> storage.put(key, value));
        var special = VariableSpec.builder("special_key")
            .writer((key, value, spec) -> storage.put("CUSTOM_" + key, value))
            .build();

        resolver.write(special, "special_value");
        resolver.write(VariableSpec.builder("api_key").build(), "new_value");

        assertEquals("special_value", storage.get("CUSTOM_SPECIAL_KEY"));
        assertFalse(storage.containsKey("SPECIAL_KEY"));
        assertEquals("new_value", storage.get("API_KEY"));
    }

    @Test
    void defaultCallbacksCannotBeCleared() {
        var resolver = new StorageResolver(environment);
        assertThrows(NullPointerException.class, () -> resolver.setDefaultReader(null));
        assertThrows(NullPointerException.class, () -> resolver.setDefaultWriter(null));
    }

    @Test
    void environmentOverlayWins() {
        var layered = environment.overlay(Map.of("API_KEY", "override"));
        assertEquals("override", layered.lookup("API_KEY"));
        assertNull(layered.lookup("OTHER"));
    }
}
