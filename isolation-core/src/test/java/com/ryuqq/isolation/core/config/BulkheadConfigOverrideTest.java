package com.ryuqq.isolation.core.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * BulkheadConfigOverride 테스트.
 *
 * @author Isolation Team
 * @since 1.0.0
 */
class BulkheadConfigOverrideTest {

    @Test
    void empty_HasNoFields() {
        // When
        BulkheadConfigOverride override = BulkheadConfigOverride.empty();

        // Then
        assertNull(override.maxConcurrent().intValue());
        assertNull(override.maxQueueSize().intValue());
        assertNull(override.queueTimeout());
        assertFalse(override.isComplete());
    }

    @Test
    void merge_OtherFieldsWin_UnsetFieldsKept() {
        // Given
        BulkheadConfigOverride base = BulkheadConfigOverride.of(10, 50, Duration.ofSeconds(30));
        BulkheadConfigOverride partial = BulkheadConfigOverride.empty().withMaxConcurrent(50);

        // When
        BulkheadConfigOverride merged = base.merge(partial);

        // Then
        assertEquals(50, merged.maxConcurrent().intValue());
        assertEquals(50, merged.maxQueueSize().intValue());
        assertEquals(Duration.ofSeconds(30), merged.queueTimeout());
    }

    @Test
    void merge_Null_ReturnsSameInstance() {
        BulkheadConfigOverride base = BulkheadConfigOverride.of(1, 2, Duration.ofSeconds(3));

        assertSame(base, base.merge(null));
    }

    @Test
    void toConfig_Complete_CreatesConfig() {
        // When
        BulkheadConfig config = BulkheadConfigOverride.of(5, 20, Duration.ofSeconds(120)).toConfig("container.create");

        // Then
        assertEquals(new BulkheadConfig("container.create", 5, 20, Duration.ofSeconds(120)), config);
    }

    @Test
    void toConfig_Incomplete_ThrowsIllegalState() {
        BulkheadConfigOverride partial = BulkheadConfigOverride.empty().withMaxQueueSize(3);

        assertThrows(IllegalStateException.class, () -> partial.toConfig("svc"));
    }

    @Test
    void constructor_NegativeValue_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new BulkheadConfigOverride(-1, null, null));
        assertThrows(IllegalArgumentException.class, () -> new BulkheadConfigOverride(null, -1, null));
        assertThrows(IllegalArgumentException.class,
            () -> new BulkheadConfigOverride(null, null, Duration.ofSeconds(-1)));
    }
}
