package io.chainindex.core.protocol;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HashesTest {

    @Test
    void hexAcceptsEitherCase() {
        assertArrayEquals(new byte[] {(byte) 0xab, 0x01, (byte) 0xcd}, Hashes.fromHex("AB01cd"));
        assertEquals("ab01cd", Hashes.toHex(Hashes.fromHex("AB01cd")));
    }

    @Test
    void hexRejectsNonAsciiDigits() {
        // fullwidth digits are Unicode digits but not hex
        assertThrows(IllegalArgumentException.class, () -> Hashes.fromHex("０１"));
        assertThrows(IllegalArgumentException.class, () -> Hashes.fromHex("0g"));
        assertThrows(IllegalArgumentException.class, () -> Hashes.fromHex("abc"));
        assertEquals(-1, Hashes.hexDigit('١'));
        assertEquals(15, Hashes.hexDigit('F'));
    }

    @Test
    void displayHexIsByteReversed() {
        byte[] hash = Hashes.hexToHash("0102");
        assertArrayEquals(new byte[] {2, 1}, hash);
        assertEquals("0102", Hashes.hashToHex(hash));
    }
}
