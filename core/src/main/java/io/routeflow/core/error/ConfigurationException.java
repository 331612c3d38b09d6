package io.routeflow.core.error;

/**
 * Thrown when a channel, splitter, selector or settings configuration is missing a required parameter or is
 * malformed. Always raised before any message is processed and never retried. URN:
 * {@code urn:routeflow:error:configuration}
 */
public class ConfigurationException extends PipelineException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:routeflow:error:configuration";

    private final String source;

    public ConfigurationException(String message) {
        this(message, (String) null);
    }

    public ConfigurationException(String message, String source) {
        super(message, Phase.CONFIGURATION);
        this.source = source;
    }

    public ConfigurationException(String message, Throwable cause, String source) {
        super(message, cause, Phase.CONFIGURATION);
        this.source = source;
    }

    /** The file or resource that caused the error, or {@code null} for programmatic configuration. */
    public String source() {
        return source;
    }

    @Override
    public String urn() {
        return URN;
    }
}
