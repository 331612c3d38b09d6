package io.routeflow.core.executor;

import io.routeflow.core.spi.Serializer;
import java.util.Map;

/** Serializer for content that is already in the form scripts work on. Never converts anything. */
public final class PassthroughSerializer implements Serializer {

    public static final PassthroughSerializer INSTANCE = new PassthroughSerializer();

    private PassthroughSerializer() {}

    @Override
    public String toXml(String raw) {
        return raw;
    }

    @Override
    public String fromXml(String xml) {
        return xml;
    }

    @Override
    public boolean isSerializationRequired(boolean toXml) {
        return false;
    }

    @Override
    public void populateMetaData(String raw, Map<String, Object> map) {
        // no metadata to extract
    }
}
