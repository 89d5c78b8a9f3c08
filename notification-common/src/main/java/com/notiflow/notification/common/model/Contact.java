package com.notiflow.notification.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Recipient address. Serialized as {@code {"type": "email", "value": "..."}} or
 * {@code {"type": "bitrix", "value": 42}}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = EmailContact.class, name = "email"),
    @JsonSubTypes.Type(value = BitrixContact.class, name = "bitrix")
})
public interface Contact {

    @JsonIgnore
    ChannelType getType();

    default boolean isOfType(ChannelType type) {
        return getType() == type;
    }
}
