package com.ryuqq.broker.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ChannelName Value Object 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ChannelNameTest {

    @Test
    void of_ValidValue_CreatesChannelName() {
        // Given
        String value = "orders";

        // When
        ChannelName channel = ChannelName.of(value);

        // Then
        assertEquals(value, channel.getValue());
        assertEquals(value, channel.toString());
    }

    @Test
    void of_ValueWithDotsAndSlashes_CreatesChannelName() {
        // When
        ChannelName channel = ChannelName.of("billing.invoices/v2");

        // Then
        assertEquals("billing.invoices/v2", channel.getValue());
    }

    @Test
    void of_NullValue_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> ChannelName.of(null)
        );
        assertTrue(exception.getMessage().contains("cannot be null or blank"));
    }

    @Test
    void of_BlankValue_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> ChannelName.of("  "));
        assertThrows(IllegalArgumentException.class, () -> ChannelName.of(""));
    }

    @Test
    void of_ValueExceeds255Characters_ThrowsException() {
        // Given
        String value = "c".repeat(256);

        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> ChannelName.of(value)
        );
        assertTrue(exception.getMessage().contains("cannot exceed 255"));
    }

    @Test
    void of_ValueWith255Characters_CreatesChannelName() {
        // Given
        String value = "c".repeat(255);

        // When & Then
        assertDoesNotThrow(() -> ChannelName.of(value));
    }

    @Test
    void equals_SameValue_ReturnsTrue() {
        // Given
        ChannelName first = ChannelName.of("orders");
        ChannelName second = ChannelName.of("orders");

        // Then
        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
    }

    @Test
    void compareTo_OrdersByValue() {
        // Given
        ChannelName alpha = ChannelName.of("alpha");
        ChannelName beta = ChannelName.of("beta");

        // Then
        assertTrue(alpha.compareTo(beta) < 0);
        assertTrue(beta.compareTo(alpha) > 0);
        assertEquals(0, alpha.compareTo(ChannelName.of("alpha")));
    }
}
