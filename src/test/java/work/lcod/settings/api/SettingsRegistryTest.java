package work.lcod.settings.api;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
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
import work.lcod.settings.core.Symbol;
import work.lcod.settings.runtime.EnvironmentSource;
import work.lcod.settings.runtime.ReadOnlyException;
import work.lcod.settings.runtime.SettingsWriter;
import work.lcod.settings.runtime.UnknownVariableException;
import work.lcod.settings.runtime.VariableSpec;
import work.lcod.settings.runtime.VariableType;
import work.lcod.settings.validation.ExtendedValidationEngine;
import work.lcod.settings.validation.ValidationException;
import work.lcod.settings.validation.ValidationRules;

class SettingsRegistryTest {
    @Test
    void integerFromEnvironmentOrDefault() {
        var withValue = registry(Map.of("PORT", "5000"));
        withValue.declare("port", VariableType.INTEGER, 3000L);
        assertEquals(5000L, withValue.get("port"));

        var withoutValue = registry(Map.of());
        withoutValue.declare("port", VariableType.INTEGER, 3000L);
        assertEquals(3000L, withoutValue.get("port"));
    }

    @Test
    void arrayFromCommaSeparatedText() {
        var registry = registry(Map.of("ALLOWED_HOSTS", "host1, host2 , host3"));
        registry.declare("allowed_hosts", VariableType.ARRAY, List.of());
        assertEquals(List.of("host1", "host2", "host3"), registry.get("allowed_hosts"));
    }

    @Test
    void absentArrayReturnsDeclaredDefault() {
        var registry = registry(Map.of());
        var fallback = List.of("localhost");
        registry.declare("allowed_hosts", VariableType.ARRAY, fallback);
        assertEquals(fallback, registry.get("allowed_hosts"));
    }

    @Test
    void defaultIsReturnedUntouched() {
        var registry = registry(Map.of());
        registry.declare("port", VariableType.INTEGER, "not-a-number");
        assertEquals("not-a-number", registry.get("port"));
    }

    @Test
    void emptyStringIsPresentForCoercion() {
        var registry = registry(Map.of("TAGS", "", "NAME", ""));
        registry.declare("tags", VariableType.ARRAY, List.of("default"));
        registry.declare("name", VariableType.STRING, "fallback");
        assertEquals(List.of(), registry.get("tags"));
        assertEquals("", registry.get("name"));
        assertFalse(registry.isPresent("name"));
    }

    @Test
    void unknownVariableFails() {
        var registry = registry(Map.of());
        var ex = assertThrows(UnknownVariableException.class, () -> registry.get("prot"));
        assertEquals("prot", ex.name());
        assertThrows(UnknownVariableException.class, () -> registry.set("prot", 1));
        assertThrows(UnknownVariableException.class, () -> registry.isPresent("prot"));
    }

    @Test
    void writeWithoutWriterIsReadOnly() {
        var registry = registry(Map.of());
        registry.declare("app_name", VariableType.STRING, "TestApp");
        assertFalse(registry.isWritable("app_name"));
        var ex = assertThrows(ReadOnlyException.class, () -> registry.set("app_name", "NewApp"));
        assertTrue(ex.getMessage().contains("Provide a writer callback"));
    }

    @Test
    void customReaderAndWriterRoundTrip() {
        Map<String, Object> storage = new HashMap<>();
        var registry = registry(Map.of("API_KEY", "from_env"));
        registry.declare(
            "api_key",
            VariableType.STRING,
            "default_key",
            ValidationRules.none(),
            (key, spec) -> storage.get(key),
            (key, value, spec) -> storage.put(key, value)
        );

        assertEquals("default_key", registry.get("api_key"));
        registry.set("api_key", "new_value");
        assertEquals("new_value", storage.get("API_KEY"));
        assertEquals("new_value", registry.get("api_key"));
    }

    @Test
    void writerReceivesValueBeforeCoercion() {
        Map<String, Object> storage = new HashMap<>();
        var registry = registry(Map.of());
        registry.defaultReader((key, spec) -> storage.get(key));
        registry.defaultWriter((key, value, spec) -> storage.put(key, value));
        registry.declare("feature_flag", VariableType.BOOLEAN, false);

        registry.set("feature_flag", true);
        assertEquals(true, storage.get("FEATURE_FLAG"));
        assertEquals(true, registry.get("feature_flag"));
        assertTrue(registry.isTrue("feature_flag"));
    }

    @Test
    void defaultReaderAppliesCoercion() {
        Map<String, Object> storage = new HashMap<>();
        storage.put("TIMEOUT", "60");
        var registry = registry(Map.of("TIMEOUT", "5"));
        registry.defaultReader((key, spec) -> storage.get(key));
        registry.declare("timeout", VariableType.INTEGER, 30L);
        assertEquals(60L, registry.get("timeout"));
    }

    @Test
    void perVariableReaderTakesTotalPrecedence() {
        var registry = registry(Map.of());
        registry.defaultReader((key, spec) -> "from_default");
        registry.declare(VariableSpec.builder("special_key")
            .defaultValue("fallback")
            .reader((key, spec) -> null)
            .build());
        assertEquals("fallback", registry.get("special_key"));
    }

    @Test
    void validationFailureNeverReachesWriter() {
        List<Object> written = new ArrayList<>();
        SettingsWriter writer = (key, value, spec) -> written.add(value);
        var registry = registry(Map.of());
        registry.declare(
            "username",
            VariableType.STRING,
            null,
            ValidationRules.builder().presence().length(3, 20).build(),
            null,
            writer
        );

        var blank = assertThrows(ValidationException.class, () -> registry.set("username", ""));
        assertTrue(blank.getMessage().contains("Username can't be blank"));
        var shortName = assertThrows(ValidationException.class, () -> registry.set("username", "ab"));
        assertTrue(shortName.getMessage().contains("too short"));
        var missing = assertThrows(ValidationException.class, () -> registry.set("username", null));
        assertTrue(missing.getMessage().contains("can't be blank"));
        assertTrue(written.isEmpty());

        assertDoesNotThrow(() -> registry.set("username", "john"));
        assertEquals(List.of("john"), written);
    }

    @Test
    void setThenGetThroughSharedStorage() {
        Map<String, Object> storage = new HashMap<>();
        var registry = registry(Map.of());
        registry.defaultReader((key, spec) -> storage.get(key));
        registry.defaultWriter((key, value, spec) -> storage.put(key, value));
        registry.declare("username", VariableType.STRING, null,
            ValidationRules.builder().presence().length(3, 20).build());

        registry.set("username", "john");
        assertEquals("john", registry.get("username"));
    }

    @Test
    void validateAllReportsEveryInvalidVariable() {
        var registry = registry(Map.of("USERNAME", "ab", "ENVIRONMENT", "staging"));
        registry.declare("database_url", VariableType.STRING, null, ValidationRules.builder().presence().build());
        registry.declare("username", VariableType.STRING, null, ValidationRules.builder().minimumLength(3).build());
        registry.declare("environment", VariableType.STRING, null,
            ValidationRules.builder().inclusion(List.of("development", "test", "production")).build());
        registry.declare("free_text", VariableType.STRING, null);

        var ex = assertThrows(ValidationException.class, registry::validateAll);
        assertEquals(List.of(
            "Database url can't be blank",
            "Username is too short (minimum is 3 characters)",
            "Environment is not included in the list"
        ), ex.violations());
        assertTrue(ex.getMessage().contains("Database url can't be blank, Username is too short"));
    }

    @Test
    void validateAllPassesWhenEverythingIsValid() {
        var registry = registry(Map.of("DATABASE_URL", "postgresql://localhost/db"));
        registry.declare("database_url", VariableType.STRING, null, ValidationRules.builder().presence().build());
        assertDoesNotThrow(registry::validateAll);
        assertEquals(List.of(), registry.validate("database_url"));
    }

    @Test
    void unknownRuleIsRejectedByBuiltinEngine() {
        var registry = registry(Map.of());
        var rules = ValidationRules.builder().numericality(Map.of("greater_than", 0)).build();
        var ex = assertThrows(IllegalArgumentException.class,
            () -> registry.declare("age", VariableType.INTEGER, 0L, rules));
        assertTrue(ex.getMessage().contains("numericality"));
        assertFalse(registry.isDeclared("age"));
    }

    @Test
    void extendedEngineIsChosenByConfiguration() {
        var registry = new SettingsRegistry(RegistryConfiguration.builder()
            .environment(EnvironmentSource.of(Map.of("MIN_VALUE", "50", "MAX_VALUE", "30")))
            .validationEngine(new ExtendedValidationEngine())
            .build());
        registry.declare("min_value", VariableType.INTEGER, 0L);
        registry.declare("max_value", VariableType.INTEGER, 100L,
            ValidationRules.builder().comparison(Map.of("greater_than", "min_value")).build());

        var ex = assertThrows(ValidationException.class, registry::validateAll);
        assertEquals(List.of("Max value must be greater than 50"), ex.violations());
    }

    @Test
    void redeclarationReplacesPreviousSpec() {
        var registry = registry(Map.of("PORT", "8080"));
        registry.declare("port", VariableType.STRING, "x");
        registry.declare("host", VariableType.STRING, "localhost");
        registry.declare("port", VariableType.INTEGER, 3000L);

        assertEquals(8080L, registry.get("port"));
        assertEquals(List.of("port", "host"), registry.variables());
    }

    @Test
    void enumerateResolvesEveryVariableInOrder() {
        var registry = registry(Map.of("APP_NAME", "MyApp", "PORT", "5000", "MODE", "production"));
        registry.declare("app_name", VariableType.STRING, "TestApp");
        registry.declare("port", VariableType.INTEGER, 3000L);
        registry.declare("debug", VariableType.BOOLEAN, false);
        registry.declare("mode", VariableType.SYMBOL, null);
        registry.declare("missing", VariableType.STRING, null);

        Map<String, Object> snapshot = registry.enumerate();
        assertEquals(List.of("app_name", "port", "debug", "mode", "missing"), new ArrayList<>(snapshot.keySet()));
        assertEquals("MyApp", snapshot.get("app_name"));
        assertEquals(5000L, snapshot.get("port"));
        assertEquals(false, snapshot.get("debug"));
        assertEquals(Symbol.of("production"), snapshot.get("mode"));
        assertNull(snapshot.get("missing"));
    }

    @Test
    void jsonSnapshotWritesSymbolsAsText() {
        var registry = registry(Map.of("MODE", "production", "PORT", "5000"));
        registry.declare("mode", VariableType.SYMBOL, null);
        registry.declare("port", VariableType.INTEGER, 3000L);

        String json = registry.toJson();
        assertTrue(json.contains("\"mode\" : \"production\""), json);
        assertTrue(json.contains("\"port\" : 5000"), json);
        assertFalse(registry.toJson(List.of("port")).contains("mode"));
    }

    @Test
    void presenceCheck() {
        var registry = registry(Map.of("DATABASE_URL", "postgresql://localhost/db", "EMPTY", ""));
        registry.declare("database_url", VariableType.STRING, null);
        registry.declare("empty", VariableType.STRING, null);
        registry.declare("unset", VariableType.STRING, null);

        assertTrue(registry.isPresent("database_url"));
        assertFalse(registry.isPresent("empty"));
        assertFalse(registry.isPresent("unset"));
    }

    @Test
    void typedGetterCasts() {
        var registry = registry(Map.of("PORT", "5000"));
        registry.declare("port", VariableType.INTEGER, 3000L);
        assertEquals(5000L, registry.get("port", Long.class));
        assertThrows(ClassCastException.class, () -> registry.get("port", String.class));
    }

    private SettingsRegistry registry(Map<String, String> environment) {
        return new SettingsRegistry(RegistryConfiguration.builder()
            .environment(EnvironmentSource.of(environment))
            .build());
    }
}
