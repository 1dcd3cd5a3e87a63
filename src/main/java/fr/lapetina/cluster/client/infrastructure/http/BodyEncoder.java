package fr.lapetina.cluster.client.infrastructure.http;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.cluster.client.exception.BodyEncodingException;

import java.nio.charset.StandardCharsets;

/**
 * Turns a request body into its wire payload.
 *
 * Strings and byte arrays are sent verbatim, anything else is written as JSON.
 */
public final class BodyEncoder {

    private final ObjectMapper objectMapper;

    public BodyEncoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public BodyEncoder() {
        this(new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS));
    }

    /**
     * @return the payload, or {@code null} when there is no body
     * @throws BodyEncodingException if the body cannot be serialized
     */
    public byte[] encode(Object body) {
        if (body == null) {
            return null;
        }
        if (body instanceof byte[]) {
            return (byte[]) body;
        }
        if (body instanceof String) {
            return ((String) body).getBytes(StandardCharsets.UTF_8);
        }
        try {
            return objectMapper.writeValueAsBytes(body);
        } catch (JsonProcessingException e) {
            throw new BodyEncodingException(body, e);
        }
    }
}
