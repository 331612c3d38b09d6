package io.routeflow.core.executor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.routeflow.core.spi.Serializer;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SerializerRegistryTest {

    private final SerializerRegistry registry = new SerializerRegistry();

    @Test
    void unknownDataTypeIsPassthrough() {
        assertThat(registry.forDataType("XML")).isSameAs(PassthroughSerializer.INSTANCE);
        assertThat(registry.forDataType(null)).isSameAs(PassthroughSerializer.INSTANCE);
        assertThat(registry.hasSerializer("XML")).isFalse();
    }

    @Test
    void lookupIsCaseInsensitive() {
        Serializer hl7 = new StubSerializer();
        registry.register("hl7v2", hl7);

        assertThat(registry.forDataType("HL7V2")).isSameAs(hl7);
        assertThat(registry.forDataType(" Hl7v2 ")).isSameAs(hl7);
        assertThat(registry.hasSerializer("HL7V2")).isTrue();
    }

    @Test
    void rejectsBlankDataType() {
        assertThatThrownBy(() -> registry.register(" ", new StubSerializer()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void passthroughNeverConverts() {
        PassthroughSerializer passthrough = PassthroughSerializer.INSTANCE;

        assertThat(passthrough.isSerializationRequired(true)).isFalse();
        assertThat(passthrough.isSerializationRequired(false)).isFalse();
        assertThat(passthrough.toXml("a|b")).isEqualTo("a|b");
    }

    private static final class StubSerializer implements Serializer {

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
        public void populateMetaData(String raw, Map<String, Object> map) {}
    }
}
