package com.cgi.dataprofiler.detector.service;

import org.junit.Test;

import static org.junit.Assert.*;

public class LuhnValidatorTest {

    @Test
    public void testValidNumbers() {
        assertTrue(LuhnValidator.isValid("4532111111111112"));
        assertTrue(LuhnValidator.isValid("4111111111111111"));
        assertTrue(LuhnValidator.isValid("79927398713"));
    }

    @Test
    public void testInvalidNumbers() {
        assertFalse(LuhnValidator.isValid("1234567890123456"));
        assertFalse(LuhnValidator.isValid("4532111111111113"));
    }

    @Test
    public void testSeparatorsDoNotChangeValidity() {
        assertTrue(LuhnValidator.isValid("4532-1111-1111-1112"));
        assertTrue(LuhnValidator.isValid("4532 1111 1111 1112"));
        assertFalse(LuhnValidator.isValid("1234-5678-9012-3456"));
    }

    @Test
    public void testMalformedInput() {
        assertFalse(LuhnValidator.isValid(null));
        assertFalse(LuhnValidator.isValid(""));
        assertFalse(LuhnValidator.isValid("4532x11111111112"));
    }
}
