package com.ryuqq.broker.application.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.broker.application.router.BrokerRequest;
import com.ryuqq.broker.application.router.BrokerResponse;
import com.ryuqq.broker.application.router.MalformedRequestException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * BrokerJsonCodec tests.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class BrokerJsonCodecTest {

    private final BrokerJsonCodec codec = new BrokerJsonCodec();
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void decode_shouldReadAllRequestFields() {
        // When
        BrokerRequest request = codec.decode(
            "{\"channel\":\"orders\",\"message_id\":\"m1\",\"data\":{\"id\":1,\"tags\":[\"a\",\"b\"],\"meta\":{\"ok\":true}}}");

        // Then
        assertThat(request.channel()).isEqualTo("orders");
        assertThat(request.messageId()).isEqualTo("m1");
        assertThat(request.data())
            .containsEntry("id", 1)
            .containsEntry("tags", List.of("a", "b"))
            .containsEntry("meta", Map.of("ok", true));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   ", "null"})
    void decode_shouldTreatBlankBodyAsEmptyRequest(String body) {
        assertThat(codec.decode(body)).isEqualTo(BrokerRequest.empty());
    }

    @Test
    void decode_shouldIgnoreUnknownFields() {
        assertThat(codec.decode("{\"channel\":\"orders\",\"extra\":42}"))
            .isEqualTo(BrokerRequest.ofChannel("orders"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"{", "not json", "[1,2]", "{\"channel\":\"orders\",\"data\":\"text\"}"})
    void decode_shouldRejectMalformedBody(String body) {
        assertThatThrownBy(() -> codec.decode(body))
            .isInstanceOf(MalformedRequestException.class)
            .hasMessageStartingWith("Malformed request body");
    }

    @Test
    void decode_shouldKeepParserFailureAsCause() {
        assertThatThrownBy(() -> codec.decode("{"))
            .isInstanceOf(MalformedRequestException.class)
            .hasCauseInstanceOf(JsonProcessingException.class)
            .extracting(e -> ((MalformedRequestException) e).getErrorCode())
            .isEqualTo("MALFORMED_REQUEST");
    }

    @Test
    void encode_shouldAlwaysWriteFourFields() throws Exception {
        // When
        JsonNode json = mapper.readTree(codec.encode(BrokerResponse.ofMessage("hello")));

        // Then
        assertThat(json.size()).isEqualTo(4);
        assertThat(json.get("data").isObject()).isTrue();
        assertThat(json.get("data").size()).isZero();
        assertThat(json.get("message").asText()).isEqualTo("hello");
        assertThat(json.get("error").asText()).isEmpty();
        assertThat(json.get("message_id").asText()).isEmpty();
    }

    @Test
    void encode_shouldWriteFieldsInFixedOrder() {
        assertThat(codec.encode(BrokerResponse.ofError("boom")))
            .isEqualTo("{\"data\":{},\"message\":\"\",\"error\":\"boom\",\"message_id\":\"\"}");
    }

    @Test
    void constructor_shouldRejectNullMapper() {
        assertThatThrownBy(() -> new BrokerJsonCodec(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
