package io.routeflow.core.model;

import java.util.Objects;

/**
 * One content slot of a connector message.
 *
 * @param contentType the slot tag
 * @param content     the content text, never null
 * @param dataType    the data type name (e.g. {@code HL7V2}, {@code XML}, {@code JSON})
 * @param encrypted   whether {@code content} is stored encrypted
 */
public record MessageContent(ContentType contentType, String content, String dataType, boolean encrypted) {

    public MessageContent {
        Objects.requireNonNull(contentType, "contentType must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }

    /** Creates an unencrypted content slot. */
    public static MessageContent of(ContentType contentType, String content, String dataType) {
        return new MessageContent(contentType, content, dataType, false);
    }
}
