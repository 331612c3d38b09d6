package io.routeflow.core.executor;

import io.routeflow.core.error.ScriptException;
import io.routeflow.core.model.ConnectorMessage;
import io.routeflow.core.model.ContentType;
import io.routeflow.core.model.Response;
import io.routeflow.core.model.ScriptStep;
import io.routeflow.core.model.Status;
import io.routeflow.core.sandbox.ScriptSandbox;
import io.routeflow.core.spi.TelemetryListener;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a channel's postprocessor once every destination has an outcome.
 *
 * <p>The script runs against the merged connector message (source maps with every destination's channel and response
 * map folded in) and additionally sees {@code statuses}, destination connector name to {@link Status}. Channel map
 * writes are copied back to the source. A non-null result becomes a {@link Response} ({@code Response} values as they
 * are, anything else as a {@code SENT} reply carrying the value) stored in the source response map under
 * {@link #RESPONSE_KEY}, where a {@code NAMED} response selector can pick it up.
 *
 * <p>A failing postprocessor never changes a status: its failure is logged and stored in the source's
 * {@code POSTPROCESSOR_ERROR} slot.
 */
public final class PostprocessorExecutor {

    private static final Logger LOG = LoggerFactory.getLogger(PostprocessorExecutor.class);

    /** Response map key of the postprocessor's reply. */
    public static final String RESPONSE_KEY = "d_postprocessor";

    private final ScriptInvoker scripts;

    public PostprocessorExecutor(ScriptSandbox sandbox, TelemetryListener telemetryListener) {
        this.scripts = new ScriptInvoker(sandbox, telemetryListener);
    }

    /**
     * @param postprocessor the channel's postprocessor, may be null
     * @param source        the source connector message, receives channel map writes and the reply
     * @param merged        detached merged connector message the script runs against
     * @param statuses      destination connector name to status
     * @return the reply, or empty when there is no postprocessor, it returned null, or it failed
     */
    public Optional<Response> execute(
            ScriptStep postprocessor, ConnectorMessage source, ConnectorMessage merged, Map<String, Status> statuses) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(merged, "merged must not be null");
        if (postprocessor == null || !postprocessor.enabled()) {
            return Optional.empty();
        }
        Map<String, Object> extras = new LinkedHashMap<>();
        extras.put("statuses", Collections.unmodifiableMap(new LinkedHashMap<>(statuses)));
        Response response;
        try {
            Object value = scripts.call(
                    postprocessor.name(),
                    postprocessor.lang(),
                    postprocessor.script(),
                    null,
                    merged.rawData(),
                    merged,
                    extras);
            response = toResponse(value, postprocessor.name());
        } catch (ScriptException e) {
            scripts.recordFailure(source, ContentType.POSTPROCESSOR_ERROR, e.kind(), e.scriptName(), e);
            return Optional.empty();
        }
        source.channelMap().putAll(merged.channelMap());
        if (response == null) {
            return Optional.empty();
        }
        source.responseMap().put(RESPONSE_KEY, response);
        LOG.debug("postprocessor.completed channelId={} status={}", source.channelId(), response.status());
        return Optional.of(response);
    }

    private static Response toResponse(Object value, String scriptName) {
        if (value == null) {
            return null;
        }
        if (value instanceof Response reply) {
            return reply;
        }
        return new Response(Status.SENT, FilterTransformerExecutor.asContent(value, scriptName));
    }
}
