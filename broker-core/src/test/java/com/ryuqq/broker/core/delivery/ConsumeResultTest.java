package com.ryuqq.broker.core.delivery;

import com.ryuqq.broker.core.model.ChannelName;
import com.ryuqq.broker.core.model.Message;
import com.ryuqq.broker.core.model.MessageId;
import com.ryuqq.broker.core.model.Payload;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ConsumeResult sealed interface 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ConsumeResultTest {

    private static final ChannelName ORDERS = ChannelName.of("orders");

    @Test
    void delivered_IsDeliveredAndNotEmpty() {
        // Given
        Message message = Message.now(MessageId.of("m1"), Payload.of(Map.of("id", 1)));

        // When
        ConsumeResult result = new Delivered(ORDERS, message);

        // Then
        assertTrue(result.isDelivered());
        assertFalse(result.isEmpty());
        assertEquals(ORDERS, result.channel());
    }

    @Test
    void noMessage_IsEmptyAndNotDelivered() {
        // When
        ConsumeResult result = new NoMessage(ORDERS);

        // Then
        assertTrue(result.isEmpty());
        assertFalse(result.isDelivered());
        assertEquals(ORDERS, result.channel());
    }

    @Test
    void delivered_NullMessage_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new Delivered(ORDERS, null));
    }

    @Test
    void delivered_NullChannel_ThrowsException() {
        Message message = Message.now(MessageId.of("m1"), Payload.empty());
        assertThrows(IllegalArgumentException.class, () -> new Delivered(null, message));
    }

    @Test
    void noMessage_NullChannel_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new NoMessage(null));
    }
}
