package com.notiflow.notification.common.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.notiflow.notification.common.exception.MessageDecodingException;

import java.io.IOException;

/**
 * JSON body codec for queue payloads.
 *
 * @param <T> payload type
 */
public class JsonMessageCodec<T> {

    private final ObjectMapper objectMapper;
    private final Class<T> type;

    public JsonMessageCodec(ObjectMapper objectMapper, Class<T> type) {
        this.objectMapper = objectMapper;
        this.type = type;
    }

    public byte[] encode(T item) {
        try {
            return objectMapper.writeValueAsBytes(item);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unable to serialize " + type.getSimpleName(), e);
        }
    }

    public T decode(byte[] body) {
        if (body == null || body.length == 0) {
            throw new MessageDecodingException("Message body is empty");
        }
        try {
            T value = objectMapper.readValue(body, type);
            if (value == null) {
                throw new MessageDecodingException("Message body decoded to null");
            }
            return value;
        } catch (IOException e) {
            throw new MessageDecodingException("Unable to deserialize " + type.getSimpleName(), e);
        }
    }
}
