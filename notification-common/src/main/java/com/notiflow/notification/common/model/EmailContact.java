package com.notiflow.notification.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

public record EmailContact(String value) implements Contact {

    @Override
    @JsonIgnore
    public ChannelType getType() {
        return ChannelType.EMAIL;
    }
}
