package com.kickstack.realtime.common.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kickstack.realtime.common.exception.ErrorCode;
import com.kickstack.realtime.common.exception.RelayException;
import com.kickstack.realtime.common.protocol.RelayMessage;

/**
 * Encodes and decodes relay frames as JSON text.
 * Thread-safe once constructed.
 */
public class RelayMessageCodec {

    private final ObjectMapper objectMapper;

    public RelayMessageCodec() {
        this(new ObjectMapper());
    }

    public RelayMessageCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.READ_UNKNOWN_ENUM_VALUES_USING_DEFAULT_VALUE, true);
    }

    public String encode(RelayMessage message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new RelayException(ErrorCode.SERIALIZATION_FAILED,
                    "Failed to serialize " + message.getType() + " message", e);
        }
    }

    /**
     * @throws RelayException with {@link ErrorCode#MALFORMED_MESSAGE} if the text is
     *                        not a JSON object or carries no type
     */
    public RelayMessage decode(String text) {
        RelayMessage message;
        try {
            message = objectMapper.readValue(text, RelayMessage.class);
        } catch (JsonProcessingException e) {
            throw new RelayException(ErrorCode.MALFORMED_MESSAGE,
                    "Invalid JSON frame: " + e.getOriginalMessage(), e);
        }
        if (message == null || message.getType() == null) {
            throw new RelayException(ErrorCode.MALFORMED_MESSAGE, "Frame has no type");
        }
        return message;
    }
}
