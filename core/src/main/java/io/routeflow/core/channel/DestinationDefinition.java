package io.routeflow.core.channel;

import io.routeflow.core.executor.FilterTransformer;
import java.util.Objects;

/**
 * One destination connector of a channel.
 *
 * @param metaDataId          1-based position among the channel's destinations
 * @param name                connector name
 * @param filterTransformer   the destination's filter and transformer
 * @param responseTransformer steps applied to the reply the destination's dispatcher received
 * @param queueEnabled        whether failed sends are queued, turning {@code ERROR} replies into {@code QUEUED}
 */
public record DestinationDefinition(
        int metaDataId,
        String name,
        FilterTransformer filterTransformer,
        FilterTransformer responseTransformer,
        boolean queueEnabled) {

    public DestinationDefinition {
        if (metaDataId < 1) {
            throw new IllegalArgumentException("destination metaDataId must be >= 1, got: " + metaDataId);
        }
        Objects.requireNonNull(name, "name must not be null");
        filterTransformer = filterTransformer != null ? filterTransformer : FilterTransformer.passthrough();
        responseTransformer = responseTransformer != null ? responseTransformer : FilterTransformer.passthrough();
    }

}
