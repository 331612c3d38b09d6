package io.routeflow.core.error;

/**
 * Thrown by a {@link io.routeflow.core.spi.Serializer} when content cannot be converted to or from the navigable
 * XML form. URN: {@code urn:routeflow:error:serialization}
 */
public final class SerializationException extends PipelineException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:routeflow:error:serialization";

    private final String dataType;

    public SerializationException(String message, String dataType) {
        super(message, Phase.EXECUTION);
        this.dataType = dataType;
    }

    public SerializationException(String message, Throwable cause, String dataType) {
        super(message, cause, Phase.EXECUTION);
        this.dataType = dataType;
    }

    /** The data type whose serializer failed. */
    public String dataType() {
        return dataType;
    }

    @Override
    public String urn() {
        return URN;
    }
}
