package io.routeflow.core.channel;

import io.routeflow.core.response.ResponseMode;

/**
 * Response selection of a channel.
 *
 * @param mode        response mode (default {@link ResponseMode#NONE})
 * @param respondFrom response map key for {@link ResponseMode#NAMED}
 */
public record ResponseSettings(ResponseMode mode, String respondFrom) {

    public static final ResponseSettings NONE = new ResponseSettings(ResponseMode.NONE, null);

    public ResponseSettings {
        mode = mode != null ? mode : ResponseMode.NONE;
    }
}
