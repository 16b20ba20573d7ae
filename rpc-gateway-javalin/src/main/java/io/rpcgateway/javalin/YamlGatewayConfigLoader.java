package io.rpcgateway.javalin;

import io.rpcgateway.server.core.GatewayConfig;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Reads {@link GatewayConfig} from the {@code rpc} section of a YAML file.
 *
 * <pre>
 * rpc:
 *   user: rpcuser
 *   password: ...
 *   bind: 127.0.0.1
 *   port: 8332
 *   auth-failure-delay-ms: 250
 *   worker-threads: 4
 *   require-password: true
 * </pre>
 *
 * A missing file or section yields the defaults.
 */
public final class YamlGatewayConfigLoader {
    static final String SECTION = "rpc";

    private YamlGatewayConfigLoader() {
    }

    /**
     * @throws IOException when the file exists but cannot be read
     * @throws IllegalArgumentException when the YAML is malformed or holds unknown keys or bad values
     */
    public static GatewayConfig load(Path path) throws IOException {
        Objects.requireNonNull(path, "path");
        GatewayConfig.Builder builder = GatewayConfig.builder();
        if (!Files.exists(path)) {
            return builder.build();
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            Object document = new Yaml().load(reader);
            if (document == null) {
                return builder.build();
            }
            Object section = asMap(document, "root").get(SECTION);
            if (section == null) {
                return builder.build();
            }
            for (Map.Entry<String, String> e : flatten(asMap(section, SECTION)).entrySet()) {
                apply(builder, e.getKey(), e.getValue());
            }
            return builder.build();
        } catch (YAMLException ex) {
            throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
        }
    }

    private static void apply(GatewayConfig.Builder builder, String key, String value) {
        switch (key.toLowerCase(Locale.ROOT)) {
            case "user" -> builder.rpcUser(value);
            case "password" -> builder.rpcPassword(value);
            case "bind" -> builder.bindAddress(value);
            case "port" -> builder.port(parseInt(key, value));
            case "auth-failure-delay-ms" -> builder.authFailureDelay(Duration.ofMillis(parseInt(key, value)));
            case "worker-threads" -> builder.workerThreads(parseInt(key, value));
            case "require-password" -> builder.requirePassword(parseBoolean(key, value));
            default -> throw new IllegalArgumentException("Unknown rpc setting: " + key);
        }
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer: " + value, e);
        }
    }

    private static boolean parseBoolean(String key, String value) {
        String v = value.trim().toLowerCase(Locale.ROOT);
        if (v.equals("true") || v.equals("1")) return true;
        if (v.equals("false") || v.equals("0")) return false;
        throw new IllegalArgumentException(key + " must be true or false: " + value);
    }

    private static Map<String, Object> asMap(Object node, String context) {
        if (!(node instanceof Map<?, ?> raw)) {
            throw new IllegalArgumentException(context + " section must be a mapping");
        }
        Map<String, Object> map = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : raw.entrySet()) {
            if (!(entry.getKey() instanceof String key)) {
                throw new IllegalArgumentException(context + " section contains non-string key");
            }
            map.put(key, entry.getValue());
        }
        return map;
    }

    private static Map<String, String> flatten(Map<String, Object> source) {
        Map<String, String> target = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : source.entrySet()) {
            Object value = entry.getValue();
            if (value instanceof Map<?, ?> || value instanceof Iterable<?>) {
                throw new IllegalArgumentException("rpc." + entry.getKey() + " must be a scalar");
            }
            target.put(entry.getKey(), value == null ? "" : value.toString());
        }
        return target;
    }
}
