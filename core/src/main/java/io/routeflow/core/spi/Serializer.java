package io.routeflow.core.spi;

import java.util.Map;

/**
 * Wire-format serializer contract. Implementations for HL7 v2, EDI, NCPDP, DICOM and friends live outside the core;
 * the pipeline only calls these four operations.
 */
public interface Serializer {

    /**
     * Converts wire-format content into the XML form scripts navigate.
     *
     * @throws io.routeflow.core.error.SerializationException if the content cannot be parsed
     */
    String toXml(String raw);

    /**
     * Converts XML back into the wire format.
     *
     * @throws io.routeflow.core.error.SerializationException if the XML cannot be rendered
     */
    String fromXml(String xml);

    /**
     * Whether conversion is needed in the given direction.
     *
     * @param toXml {@code true} for wire → XML, {@code false} for XML → wire
     */
    boolean isSerializationRequired(boolean toXml);

    /** Extracts well-known metadata (message type, version, source) from raw content into {@code map}. */
    void populateMetaData(String raw, Map<String, Object> map);
}
