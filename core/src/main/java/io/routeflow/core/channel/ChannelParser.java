package io.routeflow.core.channel;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.routeflow.core.batch.BatchOptions;
import io.routeflow.core.batch.SplitType;
import io.routeflow.core.error.ChannelParseException;
import io.routeflow.core.executor.FilterTransformer;
import io.routeflow.core.model.RuleOperator;
import io.routeflow.core.model.ScriptRule;
import io.routeflow.core.model.ScriptStep;
import io.routeflow.core.model.StepType;
import io.routeflow.core.response.ResponseMode;
import io.routeflow.core.sandbox.EngineRegistry;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

/**
 * Parses YAML channel definitions into {@link ChannelDefinition} instances.
 *
 * <p>A document is first validated against the bundled JSON Schema ({@code schema/channel.schema.json}), then every
 * block is checked for unrecognized keys, so typos fail at load time instead of being ignored. Script languages are
 * resolved against the {@link EngineRegistry}; scripts themselves are compiled on first use.
 *
 * <pre>
 * id: adt-router
 * batch:
 *   split-type: record
 * source:
 *   inbound-data-type: HL7V2
 *   filter:
 *     - name: only ADT
 *       script: "#msg.contains('ADT')"
 * destinations:
 *   - name: archive
 *     queue-enabled: true
 *     response-transformer:
 *       transformer:
 *         - name: ack code
 *           type: mapper
 *           script: "#msg.substring(0, 2)"
 * postprocessor:
 *   script: "#statuses['archive'].name()"
 * response:
 *   mode: destinations-completed
 * </pre>
 *
 * <p>Thread-safe.
 */
public final class ChannelParser {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final JsonSchemaFactory SCHEMA_FACTORY =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);
    private static final String SCHEMA_RESOURCE = "/schema/channel.schema.json";

    // ── Strict unknown-key detection ──

    private static final Set<String> KNOWN_ROOT_KEYS =
            Set.of("id", "name", "batch", "source", "destinations", "response", "postprocessor");

    private static final Set<String> KNOWN_BATCH_KEYS = Set.of(
            "split-type",
            "record-delimiter",
            "column-delimiter",
            "quote-token",
            "message-delimiter",
            "include-message-delimiter",
            "grouping-column",
            "column-names",
            "include-column-names",
            "skip-records",
            "script",
            "lang");

    private static final Set<String> KNOWN_CONNECTOR_KEYS =
            Set.of("name", "inbound-data-type", "outbound-data-type", "preprocessor", "filter", "transformer");

    private static final Set<String> KNOWN_DESTINATION_KEYS = Set.of(
            "name",
            "inbound-data-type",
            "outbound-data-type",
            "preprocessor",
            "filter",
            "transformer",
            "response-transformer",
            "queue-enabled");

    private static final Set<String> KNOWN_RESPONSE_TRANSFORMER_KEYS =
            Set.of("inbound-data-type", "outbound-data-type", "transformer");

    private static final Set<String> KNOWN_SCRIPT_BLOCK_KEYS = Set.of("lang", "script", "enabled");

    private static final Set<String> KNOWN_RULE_KEYS =
            Set.of("name", "sequence", "enabled", "operator", "lang", "script");

    private static final Set<String> KNOWN_STEP_KEYS = Set.of("name", "sequence", "enabled", "type", "lang", "script");

    private static final Set<String> KNOWN_RESPONSE_KEYS = Set.of("mode", "respond-from");

    private final EngineRegistry engineRegistry;
    private final JsonSchema channelSchema;

    /**
     * @param engineRegistry registry used to check every {@code lang} reference
     */
    public ChannelParser(EngineRegistry engineRegistry) {
        this.engineRegistry = Objects.requireNonNull(engineRegistry, "engineRegistry must not be null");
        this.channelSchema = loadSchema();
    }

    /**
     * Parses the YAML file at the given path.
     *
     * @throws ChannelParseException if the file cannot be read or the definition is invalid
     */
    public ChannelDefinition parse(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        String source = path.toString();
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(path.toFile());
        } catch (IOException e) {
            throw new ChannelParseException("Failed to read or parse YAML: " + e.getMessage(), e, null, source);
        }
        return parse(root, source);
    }

    /**
     * Parses a YAML document held in memory.
     *
     * @param yaml   the document
     * @param source name used in error messages
     * @throws ChannelParseException if the definition is invalid
     */
    public ChannelDefinition parse(String yaml, String source) {
        Objects.requireNonNull(yaml, "yaml must not be null");
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(yaml);
        } catch (IOException e) {
            throw new ChannelParseException("Failed to parse YAML: " + e.getMessage(), e, null, source);
        }
        return parse(root, source);
    }

    private ChannelDefinition parse(JsonNode root, String source) {
        if (root == null || !root.isObject()) {
            throw new ChannelParseException("Channel definition must be a YAML mapping", null, source);
        }
        String channelId = extractIdSafe(root);
        validateAgainstSchema(root, channelId, source);
        rejectUnknownKeys(root, KNOWN_ROOT_KEYS, "channel root", channelId, source);

        String id = requireString(root, "id", channelId, source);
        String name = optionalString(root, "name");
        BatchOptions batch = parseBatch(root.get("batch"), id, source);
        FilterTransformer sourceConnector =
                parseConnector(root.get("source"), KNOWN_CONNECTOR_KEYS, "source", id, source);

        List<DestinationDefinition> destinations = new ArrayList<>();
        JsonNode destinationsNode = root.get("destinations");
        if (destinationsNode != null && destinationsNode.isArray()) {
            int metaDataId = 1;
            for (JsonNode destinationNode : destinationsNode) {
                String destinationName = requireString(destinationNode, "name", id, source);
                String block = "destinations[" + destinationName + "]";
                FilterTransformer filterTransformer =
                        parseConnector(destinationNode, KNOWN_DESTINATION_KEYS, block, id, source);
                FilterTransformer responseTransformer = parseResponseTransformer(
                        destinationNode.get("response-transformer"), block + ".response-transformer", id, source);
                destinations.add(new DestinationDefinition(
                        metaDataId++,
                        destinationName,
                        filterTransformer,
                        responseTransformer,
                        destinationNode.path("queue-enabled").asBoolean(false)));
            }
        }

        ResponseSettings response = parseResponse(root.get("response"), id, source);
        ScriptStep postprocessor =
                parseScriptBlock(root.get("postprocessor"), "postprocessor", "postprocessor", id, source);
        return new ChannelDefinition(id, name, batch, sourceConnector, destinations, response, postprocessor);
    }

    private BatchOptions parseBatch(JsonNode node, String channelId, String source) {
        if (node == null || node.isNull()) {
            return null;
        }
        rejectUnknownKeys(node, KNOWN_BATCH_KEYS, "batch", channelId, source);
        SplitType splitType = enumValue(SplitType.class, requireString(node, "split-type", channelId, source),
                "batch.split-type", channelId, source);
        String lang = optionalString(node, "lang");
        if (lang != null) {
            requireEngine(lang, "batch", channelId, source);
        }
        return BatchOptions.builder(splitType)
                .recordDelimiter(optionalString(node, "record-delimiter"))
                .columnDelimiter(optionalString(node, "column-delimiter"))
                .quoteToken(optionalString(node, "quote-token"))
                .messageDelimiter(optionalString(node, "message-delimiter"))
                .includeMessageDelimiter(node.path("include-message-delimiter").asBoolean(false))
                .groupingColumn(optionalString(node, "grouping-column"))
                .columnNames(optionalString(node, "column-names"))
                .includeColumnNames(node.path("include-column-names").asBoolean(false))
                .skipRecords(node.path("skip-records").asInt(0))
                .script(optionalString(node, "script"))
                .lang(lang)
                .build();
    }

    private FilterTransformer parseConnector(
            JsonNode node, Set<String> knownKeys, String blockName, String channelId, String source) {
        if (node == null || node.isNull()) {
            return FilterTransformer.passthrough();
        }
        rejectUnknownKeys(node, knownKeys, blockName, channelId, source);

        ScriptStep preprocessor = parseScriptBlock(
                node.get("preprocessor"), "preprocessor", blockName + ".preprocessor", channelId, source);

        List<ScriptRule> rules = new ArrayList<>();
        JsonNode filterNode = node.get("filter");
        if (filterNode != null && filterNode.isArray()) {
            int index = 0;
            for (JsonNode ruleNode : filterNode) {
                String block = blockName + ".filter[" + index + "]";
                rejectUnknownKeys(ruleNode, KNOWN_RULE_KEYS, block, channelId, source);
                String operator = optionalString(ruleNode, "operator");
                rules.add(new ScriptRule(
                        ruleNode.path("sequence").asInt(index),
                        requireString(ruleNode, "name", channelId, source),
                        operator != null
                                ? enumValue(RuleOperator.class, operator, block + ".operator", channelId, source)
                                : null,
                        lang(ruleNode, block, channelId, source),
                        requireString(ruleNode, "script", channelId, source),
                        ruleNode.path("enabled").asBoolean(true)));
                index++;
            }
        }

        List<ScriptStep> steps = parseSteps(node.get("transformer"), blockName, channelId, source);

        return new FilterTransformer(
                preprocessor,
                rules,
                steps,
                optionalString(node, "inbound-data-type"),
                optionalString(node, "outbound-data-type"));
    }

    private List<ScriptStep> parseSteps(JsonNode transformerNode, String blockName, String channelId, String source) {
        List<ScriptStep> steps = new ArrayList<>();
        if (transformerNode != null && transformerNode.isArray()) {
            int index = 0;
            for (JsonNode stepNode : transformerNode) {
                String block = blockName + ".transformer[" + index + "]";
                rejectUnknownKeys(stepNode, KNOWN_STEP_KEYS, block, channelId, source);
                String type = optionalString(stepNode, "type");
                steps.add(new ScriptStep(
                        stepNode.path("sequence").asInt(index),
                        requireString(stepNode, "name", channelId, source),
                        type != null ? enumValue(StepType.class, type, block + ".type", channelId, source) : null,
                        lang(stepNode, block, channelId, source),
                        requireString(stepNode, "script", channelId, source),
                        stepNode.path("enabled").asBoolean(true)));
                index++;
            }
        }
        return steps;
    }

    private FilterTransformer parseResponseTransformer(
            JsonNode node, String blockName, String channelId, String source) {
        if (node == null || node.isNull()) {
            return null;
        }
        rejectUnknownKeys(node, KNOWN_RESPONSE_TRANSFORMER_KEYS, blockName, channelId, source);
        return new FilterTransformer(
                null,
                List.of(),
                parseSteps(node.get("transformer"), blockName, channelId, source),
                optionalString(node, "inbound-data-type"),
                optionalString(node, "outbound-data-type"));
    }

    /** A single script block: a connector preprocessor or the channel postprocessor. */
    private ScriptStep parseScriptBlock(
            JsonNode node, String stepName, String blockName, String channelId, String source) {
        if (node == null || node.isNull()) {
            return null;
        }
        rejectUnknownKeys(node, KNOWN_SCRIPT_BLOCK_KEYS, blockName, channelId, source);
        return new ScriptStep(
                0,
                stepName,
                StepType.SCRIPT,
                lang(node, blockName, channelId, source),
                requireString(node, "script", channelId, source),
                node.path("enabled").asBoolean(true));
    }

    private ResponseSettings parseResponse(JsonNode node, String channelId, String source) {
        if (node == null || node.isNull()) {
            return ResponseSettings.NONE;
        }
        rejectUnknownKeys(node, KNOWN_RESPONSE_KEYS, "response", channelId, source);
        String mode = optionalString(node, "mode");
        ResponseMode responseMode =
                mode != null ? enumValue(ResponseMode.class, mode, "response.mode", channelId, source) : null;
        String respondFrom = optionalString(node, "respond-from");
        if (responseMode == ResponseMode.NAMED && respondFrom == null) {
            throw new ChannelParseException(
                    "Response mode 'named' requires 'respond-from'", channelId, source);
        }
        return new ResponseSettings(responseMode, respondFrom);
    }

    // --- Private helpers ---

    private String lang(JsonNode node, String block, String channelId, String source) {
        String lang = optionalString(node, "lang");
        if (lang == null) {
            lang = ScriptStep.DEFAULT_LANG;
        }
        requireEngine(lang, block, channelId, source);
        return lang;
    }

    private void requireEngine(String lang, String block, String channelId, String source) {
        if (!engineRegistry.supports(lang)) {
            throw new ChannelParseException(
                    "Unknown script engine '" + lang + "' in '" + block + "'; available: "
                            + engineRegistry.languages(),
                    channelId,
                    source);
        }
    }

    private void validateAgainstSchema(JsonNode root, String channelId, String source) {
        Set<ValidationMessage> errors = channelSchema.validate(root);
        if (!errors.isEmpty()) {
            String details = errors.stream()
                    .map(ValidationMessage::getMessage)
                    .sorted()
                    .collect(Collectors.joining("; "));
            throw new ChannelParseException("Channel definition violates schema: " + details, channelId, source);
        }
    }

    private static <E extends Enum<E>> E enumValue(
            Class<E> type, String value, String field, String channelId, String source) {
        try {
            return Enum.valueOf(type, value.trim().replace('-', '_').toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ChannelParseException(
                    "Invalid value '" + value + "' for '" + field + "'", e, channelId, source);
        }
    }

    private static String requireString(JsonNode node, String field, String channelId, String source) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || !value.isTextual()) {
            throw new ChannelParseException("Missing or invalid required field: '" + field + "'", channelId, source);
        }
        return value.asText();
    }

    private static String optionalString(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return value.asText();
    }

    private static String extractIdSafe(JsonNode root) {
        JsonNode idNode = root.get("id");
        return idNode != null && idNode.isTextual() ? idNode.asText() : null;
    }

    private static void rejectUnknownKeys(
            JsonNode node, Set<String> knownKeys, String blockName, String channelId, String source) {
        if (node == null || !node.isObject()) {
            return;
        }
        List<String> unknown = StreamSupport.stream(((Iterable<String>) node::fieldNames).spliterator(), false)
                .filter(key -> !knownKeys.contains(key))
                .collect(Collectors.toList());
        if (!unknown.isEmpty()) {
            throw new ChannelParseException(
                    "Unknown key" + (unknown.size() > 1 ? "s" : "") + " in '" + blockName + "': " + unknown
                            + "; recognized keys are: " + knownKeys.stream().sorted().toList(),
                    channelId,
                    source);
        }
    }

    private static JsonSchema loadSchema() {
        try (InputStream in = ChannelParser.class.getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Channel schema not found on classpath: " + SCHEMA_RESOURCE);
            }
            return SCHEMA_FACTORY.getSchema(JSON_MAPPER.readTree(in));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load channel schema: " + e.getMessage(), e);
        }
    }
}
