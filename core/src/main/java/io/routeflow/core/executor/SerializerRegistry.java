package io.routeflow.core.executor;

import io.routeflow.core.spi.Serializer;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Serializers by data-type name (case-insensitive). Data types without a registered serializer, {@code XML}
 * included, use {@link PassthroughSerializer}. Thread-safe.
 */
public final class SerializerRegistry {

    private final Map<String, Serializer> serializers = new ConcurrentHashMap<>();

    /**
     * Registers a serializer, replacing any earlier one for the same data type.
     *
     * @throws IllegalArgumentException if dataType is blank
     */
    public void register(String dataType, Serializer serializer) {
        Objects.requireNonNull(serializer, "serializer must not be null");
        if (dataType == null || dataType.isBlank()) {
            throw new IllegalArgumentException("dataType must not be null or blank");
        }
        serializers.put(key(dataType), serializer);
    }

    public Serializer forDataType(String dataType) {
        if (dataType == null) {
            return PassthroughSerializer.INSTANCE;
        }
        return serializers.getOrDefault(key(dataType), PassthroughSerializer.INSTANCE);
    }

    public boolean hasSerializer(String dataType) {
        return dataType != null && serializers.containsKey(key(dataType));
    }

    private static String key(String dataType) {
        return dataType.trim().toUpperCase(Locale.ROOT);
    }
}
