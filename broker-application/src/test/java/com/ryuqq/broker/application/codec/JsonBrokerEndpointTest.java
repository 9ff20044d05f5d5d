package com.ryuqq.broker.application.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.broker.adapter.inmemory.registry.InMemoryChannelRegistry;
import com.ryuqq.broker.application.router.Broker;
import com.ryuqq.broker.application.router.BrokerRequest;
import com.ryuqq.broker.application.router.BrokerResponse;
import com.ryuqq.broker.application.router.RequestRouter;
import com.ryuqq.broker.core.config.BrokerConfig;
import com.ryuqq.broker.testkit.support.SequentialMessageIdGenerator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * JsonBrokerEndpoint tests.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class JsonBrokerEndpointTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Mock
    private Broker broker;

    private JsonNode call(JsonBrokerEndpoint endpoint, String operation, String body) throws Exception {
        return mapper.readTree(endpoint.handle(operation, body));
    }

    @Test
    void handle_shouldDecodeAndDelegateToBroker() throws Exception {
        // Given
        when(broker.dispatch("/register", BrokerRequest.ofChannel("orders")))
            .thenReturn(BrokerResponse.ofMessage("ok"));
        JsonBrokerEndpoint endpoint = new JsonBrokerEndpoint(broker);

        // When
        JsonNode json = call(endpoint, "/register", "{\"channel\":\"orders\"}");

        // Then
        assertThat(json.get("message").asText()).isEqualTo("ok");
    }

    @Test
    void handle_shouldPassEmptyRequestForBlankBody() throws Exception {
        // Given
        when(broker.dispatch("stats", BrokerRequest.empty())).thenReturn(BrokerResponse.ofData(null));
        JsonBrokerEndpoint endpoint = new JsonBrokerEndpoint(broker);

        // When
        call(endpoint, "stats", "");

        // Then
        verify(broker).dispatch("stats", BrokerRequest.empty());
    }

    @Test
    void handle_shouldAnswerMalformedBodyWithoutCallingBroker() throws Exception {
        // Given
        JsonBrokerEndpoint endpoint = new JsonBrokerEndpoint(broker);

        // When
        JsonNode json = call(endpoint, "send", "{oops");

        // Then
        assertThat(json.get("error").asText()).startsWith("Malformed request body");
        assertThat(json.get("message_id").asText()).isEmpty();
        verifyNoInteractions(broker);
    }

    @Test
    void constructor_shouldRejectNulls() {
        assertThatThrownBy(() -> new JsonBrokerEndpoint(null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new JsonBrokerEndpoint(broker, null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void ordersScenario_overJson() throws Exception {
        // Given
        JsonBrokerEndpoint endpoint = new JsonBrokerEndpoint(new RequestRouter(
            new InMemoryChannelRegistry(BrokerConfig.strict(), new SequentialMessageIdGenerator())));

        // When
        JsonNode registered = call(endpoint, "/register", "{\"channel\":\"orders\"}");
        JsonNode sent = call(endpoint, "/send", "{\"channel\":\"orders\",\"data\":{\"id\":1}}");
        call(endpoint, "/send", "{\"channel\":\"orders\",\"data\":{\"id\":2}}");
        JsonNode read = call(endpoint, "/read", "{\"channel\":\"orders\"}");
        JsonNode confirmed = call(endpoint, "/confirm", "{\"channel\":\"orders\",\"message_id\":\"m1\"}");
        JsonNode stats = call(endpoint, "/stats", "");
        JsonNode unknown = call(endpoint, "/delete", "{\"channel\":\"orders\"}");

        // Then
        assertThat(registered.get("message").asText()).isEqualTo("Channel orders successfully registered");
        assertThat(sent.get("message_id").asText()).isEqualTo("m1");
        assertThat(sent.get("data").get("id").asInt()).isEqualTo(1);
        assertThat(read.get("data").get("id").asInt()).isEqualTo(1);
        assertThat(read.get("message_id").asText()).isEqualTo("m1");
        assertThat(confirmed.get("message").asText()).isEqualTo("Message confirmed");
        assertThat(stats.get("data").get("orders").get("ready_messages").asInt()).isEqualTo(1);
        assertThat(stats.get("data").get("orders").get("unacked_messages").asInt()).isZero();
        assertThat(stats.get("data").get("orders").get("total").asInt()).isEqualTo(1);
        assertThat(unknown.get("error").asText()).isEqualTo("Unknown operation: /delete");
        assertThat(unknown.get("message").asText()).isEmpty();
        assertThat(unknown.get("data").size()).isZero();
    }
}
