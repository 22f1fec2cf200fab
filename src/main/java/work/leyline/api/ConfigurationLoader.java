package work.leyline.api;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;

/**
 * Reads {@code leyline.toml}:
 *
 * <pre>
 * default_context = "ctx"
 * target = "notes"
 * log_level = "info"
 *
 * [contexts.meta]
 * title = "Lecture 1"
 * </pre>
 *
 * Malformed files raise {@link IllegalArgumentException}.
 */
public final class ConfigurationLoader {
    private static final Set<String> KEYS = Set.of("default_context", "target", "log_level", "contexts");

    private ConfigurationLoader() {}

    public static LeylineConfiguration.Builder load(Path file) throws IOException {
        return parse(Files.readString(file, StandardCharsets.UTF_8), file.toString());
    }

    public static LeylineConfiguration.Builder parse(String toml, String origin) {
        TomlParseResult result = Toml.parse(toml);
        if (result.hasErrors()) {
            throw new IllegalArgumentException(origin + ": " + result.errors().get(0).toString());
        }
        for (String key : result.keySet()) {
            if (!KEYS.contains(key)) {
                throw new IllegalArgumentException(origin + ": unknown configuration key '" + key + "'");
            }
        }
        LeylineConfiguration.Builder builder = LeylineConfiguration.builder();
        String defaultContext = string(result, "default_context", origin);
        if (defaultContext != null) {
            builder.defaultContext(defaultContext);
        }
        String target = string(result, "target", origin);
        if (target != null) {
            builder.target(target);
        }
        String logLevel = string(result, "log_level", origin);
        if (logLevel != null) {
            builder.logLevel(LogLevel.from(logLevel));
        }
        Object contexts = result.get("contexts");
        if (contexts != null) {
            if (!(contexts instanceof TomlTable table)) {
                throw new IllegalArgumentException(origin + ": 'contexts' must be a table");
            }
            for (String name : table.keySet()) {
                if (!(table.get(List.of(name)) instanceof TomlTable values)) {
                    throw new IllegalArgumentException(origin + ": 'contexts." + name + "' must be a table");
                }
                builder.context(name, toMap(values));
            }
        }
        return builder;
    }

    private static String string(TomlTable table, String key, String origin) {
        Object value = table.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof String text)) {
            throw new IllegalArgumentException(origin + ": '" + key + "' must be a string");
        }
        return text;
    }

    private static Map<String, Object> toMap(TomlTable table) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (String key : table.keySet()) {
            map.put(key, toJava(table.get(List.of(key))));
        }
        return map;
    }

    private static Object toJava(Object value) {
        if (value instanceof TomlTable table) {
            return toMap(table);
        }
        if (value instanceof TomlArray array) {
            List<Object> list = new ArrayList<>(array.size());
            for (int i = 0; i < array.size(); i++) {
                list.add(toJava(array.get(i)));
            }
            return list;
        }
        return value;
    }
}
