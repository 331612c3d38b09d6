package io.routeflow.core.error;

/** Thrown when the pipeline settings file is missing, unparseable, or holds out-of-range values. */
public final class SettingsLoadException extends ConfigurationException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:routeflow:error:settings-load";

    public SettingsLoadException(String message, String source) {
        super(message, source);
    }

    public SettingsLoadException(String message, Throwable cause, String source) {
        super(message, cause, source);
    }

    @Override
    public String urn() {
        return URN;
    }
}
