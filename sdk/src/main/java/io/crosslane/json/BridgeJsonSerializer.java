package io.crosslane.json;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;

/**
 * JSON rendering of bridge events and lane records for relayer tooling.
 * Byte arrays are written as plain hex, absent optionals are omitted, and only members tagged
 * with the active view are written.
 */
public final class BridgeJsonSerializer {
    private static BridgeJsonSerializer shared;

    private final ObjectMapper objectMapper = createMapper();
    private Class<?> defaultView = Views.Default.class;

    private BridgeJsonSerializer() {}

    public static synchronized BridgeJsonSerializer getInstance() {
        if (shared == null)
            shared = new BridgeJsonSerializer();
        return shared;
    }

    // Independent instance, so the view can be changed without affecting the shared one
    public static BridgeJsonSerializer newInstance() {
        return new BridgeJsonSerializer();
    }

    private static ObjectMapper createMapper() {
        SimpleModule bytesModule = new SimpleModule("BridgeBytes");
        bytesModule.addSerializer(byte[].class, new HexBytesSerializer());

        return new ObjectMapper()
                .registerModule(new Jdk8Module())
                .registerModule(bytesModule)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(MapperFeature.DEFAULT_VIEW_INCLUSION)
                .enable(SerializationFeature.INDENT_OUTPUT)
                .setSerializationInclusion(JsonInclude.Include.NON_ABSENT);
    }

    public Class<?> getDefaultView() {
        return defaultView;
    }

    public void setDefaultView(Class<?> defaultView) {
        this.defaultView = defaultView;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    public String serialize(Object value) throws JsonProcessingException {
        return objectMapper.writerWithView(defaultView).writeValueAsString(value);
    }
}
