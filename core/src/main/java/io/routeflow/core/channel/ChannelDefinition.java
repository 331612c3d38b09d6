package io.routeflow.core.channel;

import io.routeflow.core.batch.BatchOptions;
import io.routeflow.core.executor.FilterTransformer;
import io.routeflow.core.model.ScriptStep;
import java.util.List;
import java.util.Objects;

/**
 * A parsed channel: one source connector, its destinations, how raw input is batched and how the source is
 * answered.
 *
 * @param id           channel identifier
 * @param name         display name (defaults to the id)
 * @param batch        batch splitting, or {@code null} to treat every payload as a single message
 * @param source       the source connector's filter and transformer
 * @param destinations destinations in metaDataId order
 * @param response     response selection
 * @param postprocessor script run once every destination has an outcome, may be null
 */
public record ChannelDefinition(
        String id,
        String name,
        BatchOptions batch,
        FilterTransformer source,
        List<DestinationDefinition> destinations,
        ResponseSettings response,
        ScriptStep postprocessor) {

    public ChannelDefinition {
        Objects.requireNonNull(id, "id must not be null");
        name = name != null ? name : id;
        source = source != null ? source : FilterTransformer.passthrough();
        destinations = destinations != null ? List.copyOf(destinations) : List.of();
        response = response != null ? response : ResponseSettings.NONE;
    }

    /** Number of destinations the response selector expects to find. */
    public int destinationCount() {
        return destinations.size();
    }

    public boolean hasPostprocessor() {
        return postprocessor != null && postprocessor.enabled();
    }

    public boolean isBatch() {
        return batch != null;
    }
}
