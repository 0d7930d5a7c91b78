package tether.core.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SecureHash")
class SecureHashTest {

    @Test
    @DisplayName("should produce the known SHA-256 digest")
    void knownDigest() {
        assertEquals(
                "2cf24dba5fb0a30e26e83b2ac5b9e29e1b161e5c1fa7425e73043362938b9824", SecureHash.sha256Hex("hello"));
    }

    @Test
    @DisplayName("should truncate to the requested length")
    void truncated() {
        assertEquals("2cf24dba5fb0", SecureHash.truncatedSha256("hello", 12));
    }

    @Test
    @DisplayName("should reject lengths outside 1..64")
    void invalidLength() {
        assertThrows(IllegalArgumentException.class, () -> SecureHash.truncatedSha256("hello", 0));
        assertThrows(IllegalArgumentException.class, () -> SecureHash.truncatedSha256("hello", 65));
    }
}
