package work.lcod.settings.manifest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlPosition;
import org.tomlj.TomlTable;
import work.lcod.settings.api.SettingsRegistry;
import work.lcod.settings.core.Symbol;
import work.lcod.settings.runtime.VariableType;
import work.lcod.settings.validation.ValidationRules;

/**
 * Reads variable declarations from TOML or JSON manifests.
 * <pre>
 * [variables.port]
 * type = "integer"
 * default = 3000
 * </pre>
 */
public final class ManifestLoader {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_REF = new TypeReference<>() {};
    private static final Comparator<TomlPosition> POSITION_ORDER = Comparator
        .comparingInt(TomlPosition::line)
        .thenComparingInt(TomlPosition::column);

    private static final Set<String> SET_RULES = Set.of("inclusion", "exclusion");
    private static final List<String> SET_KEYS = List.of("in", "set", "within");

    private ManifestLoader() {}

    public static List<ManifestDeclaration> load(Path path) {
        String text;
        try {
            text = Files.readString(path);
        } catch (IOException ex) {
            throw new ManifestException("Unable to read manifest " + path + ": " + ex.getMessage(), ex);
        }
        String fileName = path.getFileName() == null ? "" : path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (fileName.endsWith(".json")) {
            return parseJson(text);
        }
        if (fileName.endsWith(".toml")) {
            return parseToml(text);
        }
        throw new ManifestException("Unsupported manifest format (expected .toml or .json): " + path);
    }

    public static SettingsRegistry apply(List<ManifestDeclaration> declarations, SettingsRegistry registry) {
        for (ManifestDeclaration declaration : declarations) {
            registry.declare(declaration.toSpec());
        }
        return registry;
    }

    public static List<ManifestDeclaration> parseToml(String text) {
        TomlParseResult result = Toml.parse(text);
        if (result.hasErrors()) {
            throw new ManifestException("toml parse error: " + result.errors().get(0).toString());
        }
        return declarations(convertTomlTable(result));
    }

    public static List<ManifestDeclaration> parseJson(String text) {
        try {
            return declarations(JSON.readValue(text, MAP_REF));
        } catch (JsonProcessingException ex) {
            throw new ManifestException("json parse error: " + ex.getOriginalMessage(), ex);
        }
    }

    private static List<ManifestDeclaration> declarations(Map<String, Object> document) {
        Object variables = document.get("variables");
        if (variables == null) {
            return List.of();
        }
        if (!(variables instanceof Map<?, ?> table)) {
            throw new ManifestException("'variables' must be a table");
        }
        List<ManifestDeclaration> result = new ArrayList<>();
        for (var entry : table.entrySet()) {
            String name = String.valueOf(entry.getKey());
            if (!(entry.getValue() instanceof Map<?, ?> body)) {
                throw new ManifestException("variables." + name + " must be a table");
            }
            result.add(declaration(name, body));
        }
        return result;
    }

    private static ManifestDeclaration declaration(String name, Map<?, ?> body) {
        VariableType type = typeOf(name, body);
        Object rawRules = body.get("validates");
        ValidationRules rules;
        if (rawRules == null) {
            rules = ValidationRules.none();
        } else if (rawRules instanceof Map<?, ?> ruleTable) {
            Map<String, Object> copy = new LinkedHashMap<>();
            ruleTable.forEach((rule, params) -> copy.put(String.valueOf(rule), ruleParams(type, rule, params)));
            rules = ValidationRules.of(copy);
        } else {
            throw new ManifestException("variables." + name + ".validates must be a table");
        }
        return new ManifestDeclaration(name, type, convertDefault(name, type, body.get("default")), rules);
    }

    private static VariableType typeOf(String name, Map<?, ?> body) {
        try {
            return VariableType.from(body.get("type") == null ? null : String.valueOf(body.get("type")));
        } catch (IllegalArgumentException ex) {
            throw new ManifestException("variables." + name + ": " + ex.getMessage(), ex);
        }
    }

    /**
     * Manifests only carry strings, so the member lists of {@code inclusion}/{@code exclusion}
     * on a symbol variable are turned into symbols to compare equal to its values.
     */
    private static Object ruleParams(VariableType type, Object rule, Object params) {
        if (type != VariableType.SYMBOL || !SET_RULES.contains(String.valueOf(rule))) {
            return params;
        }
        if (params instanceof List<?> members) {
            return symbols(members);
        }
        if (params instanceof Map<?, ?> options) {
            Map<Object, Object> copy = new LinkedHashMap<>(options);
            for (String key : SET_KEYS) {
                if (copy.get(key) instanceof List<?> members) {
                    copy.put(key, symbols(members));
                }
            }
            return copy;
        }
        return params;
    }

    private static List<Object> symbols(List<?> members) {
        List<Object> result = new ArrayList<>(members.size());
        for (Object member : members) {
            result.add(member instanceof String name ? Symbol.of(name) : member);
        }
        return result;
    }

    /**
     * Maps the manifest's literal to the declared type's Java shape. Text is not parsed here:
     * a default of the wrong kind is an error, since defaults are never coerced at read time.
     */
    private static Object convertDefault(String name, VariableType type, Object value) {
        if (value == null) {
            return null;
        }
        boolean ok = switch (type) {
            case STRING, SYMBOL -> value instanceof String;
            case INTEGER -> value instanceof Number n && n.doubleValue() == Math.rint(n.doubleValue());
            case FLOAT -> value instanceof Number;
            case BOOLEAN -> value instanceof Boolean;
            case ARRAY -> value instanceof List<?>;
            case MAP -> value instanceof Map<?, ?>;
        };
        if (!ok) {
            throw new ManifestException(
                "variables." + name + ".default does not match type " + type.id() + ": " + value);
        }
        return switch (type) {
            case INTEGER -> ((Number) value).longValue();
            case FLOAT -> ((Number) value).doubleValue();
            case SYMBOL -> Symbol.of((String) value);
            default -> value;
        };
    }

    private static Map<String, Object> convertTomlTable(TomlTable table) {
        List<String> keys = new ArrayList<>(table.keySet());
        keys.sort(Comparator.<String, TomlPosition>comparing(
            key -> table.inputPositionOf(List.of(key)),
            Comparator.nullsLast(POSITION_ORDER)
        ));
        Map<String, Object> map = new LinkedHashMap<>();
        for (String key : keys) {
            map.put(key, convertTomlValue(table.get(List.of(key))));
        }
        return map;
    }

    private static Object convertTomlValue(Object value) {
        if (value instanceof TomlTable table) {
            return convertTomlTable(table);
        }
        if (value instanceof TomlArray array) {
            List<Object> list = new ArrayList<>();
            for (int i = 0; i < array.size(); i++) {
                list.add(convertTomlValue(array.get(i)));
            }
            return list;
        }
        return value;
    }
}
