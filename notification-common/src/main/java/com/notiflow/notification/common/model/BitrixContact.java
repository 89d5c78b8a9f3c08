package com.notiflow.notification.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Bitrix24 user addressed by numeric user id.
 */
public record BitrixContact(long value) implements Contact {

    @Override
    @JsonIgnore
    public ChannelType getType() {
        return ChannelType.BITRIX;
    }
}
