package com.microblog.domain.model;

import com.microblog.domain.error.ValidationError.UserIdError;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class UserIdTest {

    @Test
    void shouldParsePositiveInteger() {
        var result = UserId.parse("42");

        assertTrue(result.isSuccess());
        assertEquals(42L, result.getOrThrow().value());
        assertEquals("42", result.getOrThrow().toString());
    }

    @Test
    void shouldFailOnEmptyValue() {
        assertInstanceOf(UserIdError.Empty.class, UserId.parse(null).errorOrNull());
        assertInstanceOf(UserIdError.Empty.class, UserId.parse("  ").errorOrNull());
    }

    @Test
    void shouldFailOnNonNumericValue() {
        assertInstanceOf(UserIdError.InvalidFormat.class, UserId.parse("abc").errorOrNull());
        assertInstanceOf(UserIdError.InvalidFormat.class, UserId.parse("1.5").errorOrNull());
    }

    @Test
    void shouldFailOnZeroOrNegative() {
        assertInstanceOf(UserIdError.InvalidFormat.class, UserId.parse("0").errorOrNull());
        assertInstanceOf(UserIdError.InvalidFormat.class, UserId.parse("-3").errorOrNull());
    }

    @Test
    void shouldRejectNonPositiveTrustedValue() {
        assertThrows(IllegalStateException.class, () -> UserId.of(0));
    }

    @Test
    void shouldBeEqualByValue() {
        assertEquals(UserId.of(5), UserId.parse("5").getOrThrow());
    }
}
