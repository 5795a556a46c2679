package io.tokenledger.core.protocol;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class AddressTest {

    @Test
    void zeroSentinelForms() {
        assertTrue(Address.isZero(null));
        assertTrue(Address.isZero(""));
        assertTrue(Address.isZero("  "));
        assertTrue(Address.isZero(Address.ZERO));
        assertTrue(Address.isZero(Address.ZERO.toUpperCase().replace("0X", "0x")));
        assertFalse(Address.isZero("alice"));
        assertEquals(Address.ZERO, Address.orZero(null));
        assertEquals("alice", Address.orZero("alice"));
    }

    @Test
    void validity() {
        assertTrue(Address.isValid("alice"));
        assertTrue(Address.isValid("0x52908400098527886E0F7030069857D2E4169EE7"));
        assertFalse(Address.isValid(Address.ZERO));
        assertFalse(Address.isValid("ab"));
        assertFalse(Address.isValid("has space"));
    }
}
