package org.Aayush.navigation.core.path;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("UriDecoding Tests")
class UriDecodingTest {

    @Test
    @DisplayName("Component decoding handles multi-byte UTF-8")
    void testDecodeComponent() {
        assertEquals("café", UriDecoding.safelyDecodeUriComponent("caf%C3%A9", "name"));
        assertEquals("a/b c", UriDecoding.safelyDecodeUriComponent("a%2Fb%20c", "path"));
        assertEquals("plain", UriDecoding.safelyDecodeUriComponent("plain", "path"));
    }

    @Test
    @DisplayName("Whole-URI decoding keeps reserved escapes")
    void testDecodeUriKeepsReserved() {
        assertEquals("/a%2Fb c", UriDecoding.safelyDecodeUri("/a%2Fb%20c"));
        assertEquals("/q%3Fx/é", UriDecoding.safelyDecodeUri("/q%3Fx/%C3%A9"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"100%", "%zz", "%E0%A4%A", "%FF"})
    void testMalformedValuesAreReturnedRaw(String raw) {
        assertEquals(raw, UriDecoding.safelyDecodeUriComponent(raw, "p"));
        assertEquals(raw, UriDecoding.safelyDecodeUri(raw));
    }

    @Test
    @DisplayName("Strict decoder rejects truncated escapes")
    void testStrictDecoderRejectsTruncatedEscape() {
        assertThrows(IllegalArgumentException.class, () -> UriDecoding.decode("%4", false));
    }
}
