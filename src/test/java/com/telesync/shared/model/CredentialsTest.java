package com.telesync.shared.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CredentialsTest {

    @Test
    void acceptsPlausibleCredentials() {
        assertNull(new Credentials("123456", "0123456789abcdef0123456789abcdef", "+1 (234) 567-8901").shapeProblem());
    }

    @Test
    void reportsFirstProblem() {
        assertEquals("apiId is required", new Credentials("", "abc", "+1234567").shapeProblem());
        assertEquals("apiId must be numeric", new Credentials("abc", "0123456789abcdef", "+12345678").shapeProblem());
        assertEquals("apiHash must be a hex string", new Credentials("123", "not-hex-at-all!!", "+12345678").shapeProblem());
        assertEquals("phone is not a valid number", new Credentials("123", "0123456789abcdef", "12").shapeProblem());
    }

    @Test
    void masksMiddleOfPhone() {
        assertEquals("+123****890", Credentials.mask("+1234567890"));
        assertNull(Credentials.mask(null));
    }
}
