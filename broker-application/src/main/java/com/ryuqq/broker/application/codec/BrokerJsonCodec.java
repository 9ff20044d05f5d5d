package com.ryuqq.broker.application.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.broker.application.router.BrokerRequest;
import com.ryuqq.broker.application.router.BrokerResponse;
import com.ryuqq.broker.application.router.MalformedRequestException;

/**
 * JSON request/response codec backed by Jackson.
 *
 * <p>A blank body (or the JSON literal {@code null}) decodes to {@link BrokerRequest#empty()}.
 * Anything Jackson cannot map onto {@link BrokerRequest} becomes a
 * {@link MalformedRequestException}.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class BrokerJsonCodec {

    private final ObjectMapper mapper;

    public BrokerJsonCodec() {
        this(new ObjectMapper());
    }

    /**
     * Creates a codec on a caller-supplied mapper.
     *
     * @param mapper Jackson mapper
     * @throws IllegalArgumentException if mapper is null
     */
    public BrokerJsonCodec(ObjectMapper mapper) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        this.mapper = mapper;
    }

    /**
     * Decodes a request body.
     *
     * @param body JSON text, may be null or blank
     * @return decoded request, never null
     * @throws MalformedRequestException if the body is not a JSON object of the request shape
     */
    public BrokerRequest decode(String body) {
        if (body == null || body.isBlank()) {
            return BrokerRequest.empty();
        }
        try {
            BrokerRequest request = mapper.readValue(body, BrokerRequest.class);
            return request != null ? request : BrokerRequest.empty();
        } catch (JsonProcessingException e) {
            throw new MalformedRequestException("Malformed request body: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Encodes a response.
     *
     * @param response response to encode
     * @return JSON text
     * @throws IllegalStateException if Jackson fails to write the response
     */
    public String encode(BrokerResponse response) {
        try {
            return mapper.writeValueAsString(response);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode response", e);
        }
    }
}
