package io.routeflow.core.error;

/** Thrown when a channel YAML document has invalid syntax, unknown keys or missing required fields. */
public final class ChannelParseException extends ConfigurationException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:routeflow:error:channel-parse";

    private final String channelId;

    public ChannelParseException(String message, String channelId, String source) {
        super(message, source);
        this.channelId = channelId;
    }

    public ChannelParseException(String message, Throwable cause, String channelId, String source) {
        super(message, cause, source);
        this.channelId = channelId;
    }

    /** The channel id, or {@code null} if it could not be read. */
    public String channelId() {
        return channelId;
    }

    @Override
    public String urn() {
        return URN;
    }
}
