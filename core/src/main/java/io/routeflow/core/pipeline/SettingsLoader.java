package io.routeflow.core.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.routeflow.core.error.SettingsLoadException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Function;

/**
 * Loads {@link PipelineSettings} from a YAML file with an environment variable overlay.
 *
 * <pre>
 * server-id: node-1
 * script:
 *   timeout-ms: 30000
 * workers:
 *   threads: 4
 * </pre>
 *
 * <p>Every key can be overridden by an environment variable ({@code ROUTEFLOW_SERVER_ID},
 * {@code ROUTEFLOW_SCRIPT_TIMEOUT_MS}, {@code ROUTEFLOW_WORKER_THREADS}). Env vars take precedence over YAML values.
 * An env var is considered "set" if and only if it is defined AND its trimmed value is non-empty.
 */
public final class SettingsLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    static final String ENV_SERVER_ID = "ROUTEFLOW_SERVER_ID";
    static final String ENV_SCRIPT_TIMEOUT_MS = "ROUTEFLOW_SCRIPT_TIMEOUT_MS";
    static final String ENV_WORKER_THREADS = "ROUTEFLOW_WORKER_THREADS";

    private SettingsLoader() {
        // utility class
    }

    /**
     * Loads settings from the given file, applying overrides from {@link System#getenv}.
     *
     * @throws SettingsLoadException if the file is missing, unreadable or holds invalid values
     */
    public static PipelineSettings load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads settings from the given file, applying overrides from the supplied lookup function. Returning
     * {@code null} from {@code envLookup} means the variable is not defined.
     *
     * @throws SettingsLoadException if the file is missing, unreadable or holds invalid values
     */
    public static PipelineSettings load(Path configPath, Function<String, String> envLookup) {
        String source = configPath.toString();
        if (!Files.exists(configPath)) {
            throw new SettingsLoadException("Settings file not found: " + configPath, source);
        }
        JsonNode root;
        try (InputStream in = Files.newInputStream(configPath)) {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new SettingsLoadException("Failed to parse YAML settings: " + configPath, e, source);
        }
        return toSettings(root, envLookup, source);
    }

    /** Defaults overlaid with environment variables only, for deployments without a settings file. */
    public static PipelineSettings fromEnvironment(Function<String, String> envLookup) {
        return toSettings(null, envLookup, "environment");
    }

    private static PipelineSettings toSettings(JsonNode root, Function<String, String> envLookup, String source) {
        JsonNode node = root != null ? root : YAML_MAPPER.createObjectNode();
        String serverId = textOrDefault(node, "server-id", PipelineSettings.DEFAULT_SERVER_ID);
        long timeoutMs = node.path("script").path("timeout-ms").asLong(PipelineSettings.DEFAULT_SCRIPT_TIMEOUT_MS);
        int threads = node.path("workers").path("threads").asInt(PipelineSettings.DEFAULT_WORKER_THREADS);

        try {
            serverId = isSet(envLookup, ENV_SERVER_ID) ? envLookup.apply(ENV_SERVER_ID).trim() : serverId;
            if (isSet(envLookup, ENV_SCRIPT_TIMEOUT_MS)) {
                timeoutMs = Long.parseLong(envLookup.apply(ENV_SCRIPT_TIMEOUT_MS).trim());
            }
            if (isSet(envLookup, ENV_WORKER_THREADS)) {
                threads = Integer.parseInt(envLookup.apply(ENV_WORKER_THREADS).trim());
            }
            return new PipelineSettings(timeoutMs, threads, serverId);
        } catch (IllegalArgumentException e) {
            // NumberFormatException is an IllegalArgumentException
            throw new SettingsLoadException("Invalid settings: " + e.getMessage(), e, source);
        }
    }

    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static String textOrDefault(JsonNode node, String field, String defaultValue) {
        return node.has(field) ? node.get(field).asText() : defaultValue;
    }
}
