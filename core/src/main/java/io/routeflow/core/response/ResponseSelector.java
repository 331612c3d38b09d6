package io.routeflow.core.response;

import io.routeflow.core.error.ConfigurationException;
import io.routeflow.core.model.ConnectorMessage;
import io.routeflow.core.model.Message;
import io.routeflow.core.model.Response;
import io.routeflow.core.model.Status;
import io.routeflow.core.spi.AutoResponder;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes the single reply for the source connector once destination dispatch has finished.
 *
 * <p>For {@link ResponseMode#DESTINATIONS_COMPLETED} the status is {@code ERROR} when fewer destination messages are
 * recorded than configured; otherwise it is the highest-ranked destination status in the order
 * {@code FILTERED < QUEUED < SENT < ERROR}, the first destination (by metaDataId) winning ties, and {@code SENT} when
 * no destination has a ranked status. The auto-responder then receives a merged message: a copy of the source with
 * every destination's channel map and response map folded in, in metaDataId order. The recorded messages are never
 * modified.
 *
 * <p>{@link ResponseMode#NAMED} looks the respond-from key up in the merged response map, so it can name a destination
 * (whose reply is stored under its connector name), the postprocessor ({@code d_postprocessor}) or any key a script
 * wrote.
 *
 * <p>Immutable and thread-safe.
 */
public final class ResponseSelector {

    private static final Logger LOG = LoggerFactory.getLogger(ResponseSelector.class);

    private final ResponseMode mode;
    private final String respondFrom;
    private final int configuredDestinationCount;
    private final AutoResponder autoResponder;

    /**
     * @param mode                       response mode
     * @param respondFrom                response map key for {@link ResponseMode#NAMED}, ignored otherwise
     * @param configuredDestinationCount number of destinations defined on the channel
     * @param autoResponder              builds replies from a status
     * @throws ConfigurationException if {@code NAMED} has no key or the destination count is negative
     */
    public ResponseSelector(
            ResponseMode mode, String respondFrom, int configuredDestinationCount, AutoResponder autoResponder) {
        this.mode = Objects.requireNonNull(mode, "mode must not be null");
        if (mode == ResponseMode.NAMED && (respondFrom == null || respondFrom.isBlank())) {
            throw new ConfigurationException("Response mode NAMED requires a respond-from name");
        }
        if (configuredDestinationCount < 0) {
            throw new ConfigurationException(
                    "Configured destination count must be >= 0, got: " + configuredDestinationCount);
        }
        this.respondFrom = respondFrom;
        this.configuredDestinationCount = configuredDestinationCount;
        this.autoResponder = autoResponder != null ? autoResponder : new DefaultAutoResponder();
    }

    public ResponseMode mode() {
        return mode;
    }

    /**
     * Selects the reply for a message.
     *
     * @return the reply, or empty when the mode produces none
     * @throws IllegalStateException if the message has no source connector message
     */
    public Optional<Response> select(Message message) {
        ConnectorMessage source = message.requireSource();
        return switch (mode) {
            case NONE -> Optional.empty();
            case BEFORE_PROCESSING -> Optional.of(autoRespond(Status.RECEIVED, source));
            case AFTER_SOURCE_TRANSFORM -> Optional.of(autoRespond(source.status(), source));
            case DESTINATIONS_COMPLETED -> Optional.of(afterDestinations(message, source));
            case NAMED -> named(message);
        };
    }

    /** The status {@link ResponseMode#DESTINATIONS_COMPLETED} reports for a message. */
    public Status overallStatus(Message message) {
        int present = message.destinationCount();
        if (present < configuredDestinationCount) {
            LOG.warn(
                    "response.incomplete_destinations messageId={} present={} configured={}",
                    message.messageId(),
                    present,
                    configuredDestinationCount);
            return Status.ERROR;
        }
        Status best = null;
        for (Map.Entry<Integer, ConnectorMessage> entry : message.connectorMessages().entrySet()) {
            if (entry.getKey() == 0) {
                continue;
            }
            Status status = entry.getValue().status();
            if (rank(status) > 0 && (best == null || rank(status) > rank(best))) {
                best = status;
            }
        }
        return best != null ? best : Status.SENT;
    }

    /**
     * Builds the merged connector message handed to the auto-responder: a copy of the source with each destination's
     * channel map and response map folded in, later destinations winning key collisions.
     */
    public ConnectorMessage mergedMessage(Message message) {
        ConnectorMessage merged = message.requireSource().toMergeBase();
        message.connectorMessages().forEach((metaDataId, connectorMessage) -> {
            if (metaDataId > 0) {
                merged.mergeMapsFrom(connectorMessage);
            }
        });
        return merged;
    }

    private Response afterDestinations(Message message, ConnectorMessage source) {
        Status status = overallStatus(message);
        ConnectorMessage merged = mergedMessage(message);
        merged.setStatus(status);
        return autoResponder.getResponse(status, source.rawData(), merged);
    }

    private Optional<Response> named(Message message) {
        Object value = mergedMessage(message).responseMap().get(respondFrom);
        if (value == null) {
            LOG.debug("response.named_missing key={}", respondFrom);
            return Optional.empty();
        }
        if (value instanceof Response response) {
            return Optional.of(response);
        }
        return Optional.of(new Response(Status.SENT, String.valueOf(value)));
    }

    private Response autoRespond(Status status, ConnectorMessage source) {
        return autoResponder.getResponse(status, source.rawData(), source);
    }

    private static int rank(Status status) {
        return switch (status) {
            case FILTERED -> 1;
            case QUEUED -> 2;
            case SENT -> 3;
            case ERROR -> 4;
            default -> 0;
        };
    }
}
