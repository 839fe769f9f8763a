package org.Aayush.navigation.core.path;

import lombok.experimental.UtilityClass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Percent-decoding that never fails the caller.
 *
 * <p>Malformed escapes or invalid UTF-8 sequences are logged and the raw value is
 * returned unchanged.</p>
 */
@UtilityClass
public final class UriDecoding {
    private static final Logger log = LoggerFactory.getLogger(UriDecoding.class);

    /** Characters that stay escaped when decoding a whole URI. */
    private static final String RESERVED = ";/?:@&=+$,#";

    /**
     * Decodes a whole pathname, keeping escaped reserved characters escaped.
     */
    public static String safelyDecodeUri(String value) {
        try {
            return decode(value, true);
        } catch (IllegalArgumentException e) {
            log.warn("The URL path \"{}\" could not be decoded because it is a malformed URL segment. "
                    + "This is probably due to a bad percent encoding ({}).", value, e.getMessage());
            return value;
        }
    }

    /**
     * Decodes a single captured parameter value.
     */
    public static String safelyDecodeUriComponent(String value, String paramName) {
        try {
            return decode(value, false);
        } catch (IllegalArgumentException e) {
            log.warn("The value for the URL param \"{}\" will not be decoded because the string \"{}\" "
                    + "is a malformed URL segment. This is probably due to a bad percent encoding ({}).",
                    paramName, value, e.getMessage());
            return value;
        }
    }

    /**
     * Strict percent-decoder.
     *
     * @param keepReserved leave escapes of reserved characters untouched.
     * @throws IllegalArgumentException on malformed escapes or invalid UTF-8.
     */
    static String decode(String value, boolean keepReserved) {
        if (value.indexOf('%') < 0) {
            return value;
        }
        StringBuilder out = new StringBuilder(value.length());
        int i = 0;
        int length = value.length();
        while (i < length) {
            char c = value.charAt(i);
            if (c != '%') {
                out.append(c);
                i++;
                continue;
            }
            int start = i;
            ByteArrayOutputStream bytes = new ByteArrayOutputStream();
            while (i < length && value.charAt(i) == '%') {
                if (i + 2 >= length) {
                    throw new IllegalArgumentException("truncated escape at index " + i);
                }
                int high = Character.digit(value.charAt(i + 1), 16);
                int low = Character.digit(value.charAt(i + 2), 16);
                if (high < 0 || low < 0) {
                    throw new IllegalArgumentException("invalid escape at index " + i);
                }
                bytes.write((high << 4) | low);
                i += 3;
            }
            String decoded = decodeUtf8(bytes.toByteArray());
            if (keepReserved) {
                appendKeepingReserved(out, decoded, value.substring(start, i));
            } else {
                out.append(decoded);
            }
        }
        return out.toString();
    }

    private static void appendKeepingReserved(StringBuilder out, String decoded, String raw) {
        // Each decoded ASCII char maps back to exactly one three-char escape in raw.
        int rawIndex = 0;
        for (int k = 0; k < decoded.length(); k++) {
            char ch = decoded.charAt(k);
            int width = utf8Width(decoded.codePointAt(k));
            if (RESERVED.indexOf(ch) >= 0) {
                out.append(raw, rawIndex, rawIndex + 3);
            } else if (Character.isHighSurrogate(ch)) {
                out.appendCodePoint(decoded.codePointAt(k));
                k++;
            } else {
                out.append(ch);
            }
            rawIndex += width * 3;
        }
    }

    private static int utf8Width(int codePoint) {
        if (codePoint < 0x80) {
            return 1;
        }
        if (codePoint < 0x800) {
            return 2;
        }
        if (codePoint < 0x10000) {
            return 3;
        }
        return 4;
    }

    private static String decodeUtf8(byte[] bytes) {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return decoder.decode(ByteBuffer.wrap(bytes)).toString();
        } catch (CharacterCodingException e) {
            throw new IllegalArgumentException("invalid UTF-8 sequence", e);
        }
    }
}
