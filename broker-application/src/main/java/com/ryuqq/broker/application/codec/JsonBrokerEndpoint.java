package com.ryuqq.broker.application.codec;

import com.ryuqq.broker.application.router.Broker;
import com.ryuqq.broker.application.router.BrokerRequest;
import com.ryuqq.broker.application.router.BrokerResponse;
import com.ryuqq.broker.application.router.MalformedRequestException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Text-in/text-out boundary: JSON request body in, JSON response body out.
 *
 * <p>Transport adapters (HTTP, sockets, ...) call {@link #handle(String, String)} with the
 * operation name, typically the request path, and the raw body.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class JsonBrokerEndpoint {

    private static final Logger log = LoggerFactory.getLogger(JsonBrokerEndpoint.class);

    private final Broker broker;
    private final BrokerJsonCodec codec;

    public JsonBrokerEndpoint(Broker broker) {
        this(broker, new BrokerJsonCodec());
    }

    /**
     * Creates an endpoint.
     *
     * @param broker broker handling decoded requests
     * @param codec JSON codec
     * @throws IllegalArgumentException if broker or codec is null
     */
    public JsonBrokerEndpoint(Broker broker, BrokerJsonCodec codec) {
        if (broker == null) {
            throw new IllegalArgumentException("broker cannot be null");
        }
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        this.broker = broker;
        this.codec = codec;
    }

    /**
     * Handles one request.
     *
     * @param operation operation name, e.g. {@code "/send"}
     * @param body JSON request body, may be null or blank
     * @return JSON response body with all four response fields
     */
    public String handle(String operation, String body) {
        BrokerResponse response;
        try {
            BrokerRequest request = codec.decode(body);
            response = broker.dispatch(operation, request);
        } catch (MalformedRequestException e) {
            log.warn("Rejected {} request: {}", operation, e.getMessage());
            response = BrokerResponse.ofError(e.getMessage());
        }
        return codec.encode(response);
    }
}
