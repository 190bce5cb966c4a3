package com.ryuqq.retry.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ActionResult 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ActionResultTest {

    @Test
    void skip_HasAttemptStatusAndNoData() {
        // When
        ActionResult<String> result = ActionResult.skip();

        // Then
        assertEquals(RetryStatus.ATTEMPT, result.status());
        assertNull(result.data());
        assertTrue(result.isSkipped());
        assertFalse(result.isSuccess());
    }

    @Test
    void fail_HasFailStatusAndNoData() {
        // When
        ActionResult<String> result = ActionResult.fail();

        // Then
        assertEquals(RetryStatus.FAIL, result.status());
        assertNull(result.data());
        assertTrue(result.isFailed());
        assertTrue(result.dataOptional().isEmpty());
    }

    @Test
    void canceled_HasCanceledStatusAndNoData() {
        // When
        ActionResult<String> result = ActionResult.canceled();

        // Then
        assertEquals(RetryStatus.CANCELED, result.status());
        assertNull(result.data());
        assertTrue(result.isCanceled());
    }

    @Test
    void success_CarriesData() {
        // When
        ActionResult<Boolean> result = ActionResult.success(true);

        // Then
        assertEquals(RetryStatus.SUCCESS, result.status());
        assertEquals(Boolean.TRUE, result.data());
        assertTrue(result.isSuccess());
        assertEquals(Boolean.TRUE, result.dataOptional().orElseThrow());
    }

    @Test
    void success_NullData_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> ActionResult.success(null)
        );
        assertTrue(exception.getMessage().contains("data cannot be null"));
    }

    @Test
    void equals_SameStatusAndData_ReturnsTrue() {
        // Given
        ActionResult<String> result1 = ActionResult.success("payload");
        ActionResult<String> result2 = ActionResult.success("payload");

        // When & Then
        assertEquals(result1, result2);
        assertEquals(result1.hashCode(), result2.hashCode());
        assertEquals(ActionResult.<String>fail(), ActionResult.<Integer>fail());
    }

    @Test
    void statusOnlyFactories_ReturnEqualValuesForAnyType() {
        // Given
        ActionResult<String> skipped = ActionResult.skip();
        ActionResult<Integer> alsoSkipped = ActionResult.skip();

        // When & Then
        assertEquals(skipped, alsoSkipped);
        assertEquals(skipped.hashCode(), alsoSkipped.hashCode());
        assertEquals(ActionResult.<String>canceled(), ActionResult.<Boolean>canceled());
        assertEquals(ActionResult.<Long>fail().hashCode(), ActionResult.<Double>fail().hashCode());
    }

    @Test
    void equals_DifferentData_ReturnsFalse() {
        assertNotEquals(ActionResult.success("a"), ActionResult.success("b"));
    }

    @Test
    void equals_DifferentStatus_ReturnsFalse() {
        assertNotEquals(ActionResult.skip(), ActionResult.fail());
        assertNotEquals(ActionResult.fail(), ActionResult.canceled());
    }

    @Test
    void toString_ContainsStatusAndData() {
        assertEquals("ActionResult{status=FAIL}", ActionResult.fail().toString());
        assertEquals("ActionResult{status=SUCCESS, data=42}", ActionResult.success(42).toString());
    }
}
