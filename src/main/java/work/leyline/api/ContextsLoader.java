package work.leyline.api;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

/** Loads an initial environment from a JSON or YAML object. */
public final class ContextsLoader {
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private ContextsLoader() {}

    /** Picks YAML for {@code .yaml}/{@code .yml} files and JSON otherwise. */
    public static Map<String, Object> load(Path file) throws IOException {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        ObjectMapper mapper = name.endsWith(".yaml") || name.endsWith(".yml") ? YAML_MAPPER : JSON_MAPPER;
        Object value = mapper.readValue(Files.readAllBytes(file), Object.class);
        if (!(value instanceof Map<?, ?>)) {
            throw new IllegalArgumentException(file + ": environment file must contain an object");
        }
        return mapper.convertValue(value, MAP_TYPE);
    }
}
