package io.routeflow.core.pipeline;

import io.routeflow.core.batch.BatchProcessor;
import io.routeflow.core.batch.BatchSplitter;
import io.routeflow.core.batch.BatchSplitters;
import io.routeflow.core.channel.ChannelDefinition;
import io.routeflow.core.channel.DestinationDefinition;
import io.routeflow.core.error.ConfigurationException;
import io.routeflow.core.executor.DestinationSet;
import io.routeflow.core.executor.ExecutionResult;
import io.routeflow.core.executor.FilterTransformerExecutor;
import io.routeflow.core.executor.PostprocessorExecutor;
import io.routeflow.core.executor.ResponseTransformerExecutor;
import io.routeflow.core.executor.SerializerRegistry;
import io.routeflow.core.model.ConnectorMessage;
import io.routeflow.core.model.ContentType;
import io.routeflow.core.model.Message;
import io.routeflow.core.model.Response;
import io.routeflow.core.model.Status;
import io.routeflow.core.response.ResponseSelector;
import io.routeflow.core.sandbox.ScriptSandbox;
import io.routeflow.core.spi.AutoResponder;
import io.routeflow.core.spi.TelemetryListener;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Per-message processing pipeline of one channel: batch splitting, the source filter/transformer, the
 * filter/transformer of every destination, response transformers, the postprocessor and response selection.
 *
 * <p>A message goes through three calls:
 *
 * <ol>
 *   <li>{@link #processMessage} (or {@link #processBatch}) runs the source and, for accepted messages, every
 *       destination still in the message's {@link DestinationSet}; destinations a source script removed are recorded
 *       as {@code FILTERED}. Each destination starts from the source's encoded content and map copies; one that
 *       passes its transformer stays {@code TRANSFORMED} until its dispatch outcome is recorded.
 *   <li>{@link #completeDestination} records what a destination's dispatcher got back and runs its response
 *       transformer.
 *   <li>{@link #finish} runs the postprocessor and selects the reply for the source.
 * </ol>
 *
 * <p>Thread-safe: concurrent payloads share only the sandbox and its script cache. MDC keys {@code channelId} and
 * {@code messageId} are set while a message is processed.
 */
public final class MessagePipeline {

    private static final Logger LOG = LoggerFactory.getLogger(MessagePipeline.class);

    static final String MDC_CHANNEL_ID = "channelId";
    static final String MDC_MESSAGE_ID = "messageId";

    /** Connector name of the source connector message. */
    public static final String SOURCE_CONNECTOR_NAME = "Source";

    private final ChannelDefinition channel;
    private final ScriptSandbox sandbox;
    private final FilterTransformerExecutor executor;
    private final ResponseTransformerExecutor responseTransformerExecutor;
    private final PostprocessorExecutor postprocessorExecutor;
    private final ResponseSelector responseSelector;
    private final BatchProcessor batchProcessor = new BatchProcessor();
    private final String serverId;
    private final AtomicLong lastMessageId = new AtomicLong();

    /**
     * @param channel           the channel definition
     * @param sandbox           sandbox for every script of the channel
     * @param serializers       serializers by data type
     * @param autoResponder     builds auto-responses, may be null for the default responder
     * @param telemetryListener optional listener, may be null
     * @param serverId          identifier stamped on connector messages
     */
    public MessagePipeline(
            ChannelDefinition channel,
            ScriptSandbox sandbox,
            SerializerRegistry serializers,
            AutoResponder autoResponder,
            TelemetryListener telemetryListener,
            String serverId) {
        this.channel = Objects.requireNonNull(channel, "channel must not be null");
        this.sandbox = Objects.requireNonNull(sandbox, "sandbox must not be null");
        this.executor = new FilterTransformerExecutor(sandbox, serializers, telemetryListener);
        this.responseTransformerExecutor = new ResponseTransformerExecutor(sandbox, serializers, telemetryListener);
        this.postprocessorExecutor = new PostprocessorExecutor(sandbox, telemetryListener);
        this.responseSelector = new ResponseSelector(
                channel.response().mode(),
                channel.response().respondFrom(),
                channel.destinationCount(),
                autoResponder);
        this.serverId = serverId;
    }

    /**
     * Pipeline with pass-through serializers, the default auto-responder and no telemetry.
     *
     * @param sandbox  sandbox opened with {@link PipelineSettings#openSandbox}
     * @throws ConfigurationException if the sandbox's budget differs from the configured script timeout
     */
    public static MessagePipeline create(ChannelDefinition channel, ScriptSandbox sandbox, PipelineSettings settings) {
        if (sandbox.budget().timeoutMs() != settings.scriptTimeoutMs()) {
            throw new ConfigurationException("Sandbox budget of " + sandbox.budget().timeoutMs()
                    + " ms does not match the configured script timeout of " + settings.scriptTimeoutMs() + " ms");
        }
        return new MessagePipeline(channel, sandbox, new SerializerRegistry(), null, null, settings.serverId());
    }

    public ChannelDefinition channel() {
        return channel;
    }

    /**
     * Splits a raw payload (when the channel batches) and processes every unit.
     *
     * @param raw       the raw payload
     * @param sourceMap connector-supplied source map values, copied into every message
     * @return the processed messages in sequence order
     * @throws io.routeflow.core.error.ConfigurationException if the channel's batch options are incomplete
     */
    public BatchResult processBatch(String raw, Map<String, Object> sourceMap) {
        Map<String, Object> base = sourceMap != null ? sourceMap : Map.of();
        if (!channel.isBatch()) {
            return new BatchResult(List.of(processMessage(raw, base)), null);
        }
        BatchSplitter splitter = BatchSplitters.create(raw, channel.batch(), sandbox, base);
        List<Message> messages = new ArrayList<>();
        BatchProcessor.Outcome outcome =
                batchProcessor.process(splitter, base, (unit, unitSourceMap) ->
                        messages.add(processMessage(unit.content(), unitSourceMap)));
        LOG.info(
                "batch.processed channelId={} units={} failed={} complete={}",
                channel.id(),
                outcome.units(),
                outcome.failed(),
                outcome.completed());
        return new BatchResult(messages, outcome.error());
    }

    /** Processes one message through the source and every destination. */
    public Message processMessage(String raw, Map<String, Object> sourceMap) {
        long messageId = lastMessageId.incrementAndGet();
        putMdc(messageId);
        try {
            ConnectorMessage source = new ConnectorMessage(
                    messageId,
                    0,
                    channel.id(),
                    channel.name(),
                    SOURCE_CONNECTOR_NAME,
                    serverId,
                    Instant.now(),
                    Status.RECEIVED);
            source.setContent(ContentType.RAW, raw != null ? raw : "", channel.source().inboundDataType());
            source.sourceMap().putAll(sourceMap != null ? sourceMap : Map.of());
            Message message = Message.ofSource(source);

            DestinationSet destinationSet = new DestinationSet(destinationIds());
            ExecutionResult sourceResult = executor.execute(channel.source(), source, destinationSet);
            if (sourceResult.status() == Status.TRANSFORMED) {
                for (DestinationDefinition destination : channel.destinations()) {
                    ConnectorMessage destinationMessage =
                            source.forDestination(destination.metaDataId(), destination.name());
                    message.put(destinationMessage);
                    if (destinationSet.contains(destination.metaDataId())) {
                        executor.execute(destination.filterTransformer(), destinationMessage);
                    } else {
                        destinationMessage.setStatus(Status.FILTERED);
                        LOG.debug("destination.removed name={}", destination.name());
                    }
                }
            }
            LOG.info(
                    "message.processed status={} destinations={}", source.status(), message.destinationCount());
            return message;
        } finally {
            clearMdc();
        }
    }

    /**
     * Records a destination's dispatch outcome and runs its response transformer.
     *
     * @param response what the destination's dispatcher got back
     * @return the response recorded on the destination
     * @throws IllegalArgumentException if the channel has no such destination or the message does not hold it
     * @throws IllegalStateException    if the destination did not reach {@code TRANSFORMED}
     */
    public Response completeDestination(Message message, int metaDataId, Response response) {
        if (metaDataId < 1 || metaDataId > channel.destinationCount()) {
            throw new IllegalArgumentException("Channel " + channel.id() + " has no destination " + metaDataId);
        }
        DestinationDefinition definition = channel.destinations().get(metaDataId - 1);
        ConnectorMessage destination = message.get(metaDataId).orElseThrow(() -> new IllegalArgumentException(
                "Message " + message.messageId() + " holds no destination " + metaDataId));
        if (destination.status() != Status.TRANSFORMED) {
            throw new IllegalStateException("Destination '" + definition.name() + "' of message " + message.messageId()
                    + " is " + destination.status() + "; only transformed destinations are dispatched");
        }
        putMdc(message.messageId());
        try {
            return responseTransformerExecutor.execute(
                    definition.responseTransformer(), destination, response, definition.queueEnabled());
        } finally {
            clearMdc();
        }
    }

    /**
     * Runs the channel's postprocessor and selects the reply for the source, once destination outcomes are recorded.
     */
    public Optional<Response> finish(Message message) {
        ConnectorMessage source = message.requireSource();
        putMdc(message.messageId());
        try {
            if (channel.hasPostprocessor()) {
                Map<String, Status> statuses = new LinkedHashMap<>();
                message.connectorMessages().forEach((metaDataId, connectorMessage) -> {
                    if (metaDataId > 0) {
                        statuses.put(connectorMessage.connectorName(), connectorMessage.status());
                    }
                });
                postprocessorExecutor.execute(
                        channel.postprocessor(), source, responseSelector.mergedMessage(message), statuses);
            }
            return responseSelector.select(message);
        } finally {
            clearMdc();
        }
    }

    /** Selects the reply for a processed message without running the postprocessor. */
    public Optional<Response> selectResponse(Message message) {
        return responseSelector.select(message);
    }

    private Map<String, Integer> destinationIds() {
        Map<String, Integer> ids = new LinkedHashMap<>();
        channel.destinations().forEach(destination -> ids.put(destination.name(), destination.metaDataId()));
        return ids;
    }

    private void putMdc(long messageId) {
        MDC.put(MDC_CHANNEL_ID, channel.id());
        MDC.put(MDC_MESSAGE_ID, String.valueOf(messageId));
    }

    private static void clearMdc() {
        MDC.remove(MDC_CHANNEL_ID);
        MDC.remove(MDC_MESSAGE_ID);
    }

    public ResponseSelector responseSelector() {
        return responseSelector;
    }
}
