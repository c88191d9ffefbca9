package com.quick.duel.duel;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * JSON-конверт сообщений. Разбор ошибочного текста превращается в {@link MessageUndecodableException}.
 */
@Component
public class MessageCodec {

    private static final Logger log = LoggerFactory.getLogger(MessageCodec.class);

    private final ObjectMapper objectMapper;

    public MessageCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public IncomingMessage decode(String payload) {
        if (payload == null || payload.isBlank()) {
            throw new MessageUndecodableException("Empty message", null);
        }
        IncomingMessage message;
        try {
            message = objectMapper.readValue(payload, IncomingMessage.class);
        } catch (JsonProcessingException e) {
            // подробности Jackson содержат имена внутренних классов, клиенту их не отдаём
            log.debug("decode-failed detail={}", e.getOriginalMessage());
            throw new MessageUndecodableException("Could not decode message", e);
        }
        if (message == null) {
            throw new MessageUndecodableException("Could not decode message", null);
        }
        return message;
    }

    public String encode(OutgoingMessage message) {
        try {
            return objectMapper.writerFor(OutgoingMessage.class).writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + message.getClass().getSimpleName(), e);
        }
    }
}
