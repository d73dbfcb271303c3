package alpha.nomagicrouter.util;

import alpha.nomagicrouter.message.DecodeException;

import java.net.URLDecoder;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Util for percent-decoding.<p>
 * 
 * Two flavors exist. {@link #decode(String)} is strict and used for path
 * parameters; a malformed escape sequence or malformed UTF-8 is an error, and
 * '+' is kept as-is. {@link #decodeLenient(String)} is used for query strings;
 * '+' is a space, and text that can not be decoded is returned unchanged.
 */
public final class PercentDecoder
{
    private PercentDecoder() {
        // Empty
    }
    
    /**
     * Percent-decode the given string.<p>
     * 
     * Escape sequences are decoded as UTF-8. The plus character is not
     * translated into a space.
     * 
     * @param str string to decode
     * @return a decoded string
     * 
     * @throws NullPointerException
     *             if {@code str} is {@code null}
     * @throws DecodeException
     *             if an escape sequence is malformed, or
     *             if the decoded bytes are not valid UTF-8
     */
    public static String decode(String str) {
        if (str.indexOf('%') == -1) {
            return str;
        }
        final int len = str.length();
        final var sb = new StringBuilder(len);
        ByteBuffer bytes = null;
        int i = 0;
        while (i < len) {
            char c = str.charAt(i);
            if (c != '%') {
                sb.append(c);
                ++i;
                continue;
            }
            if (bytes == null) {
                // Each escape is at least three chars
                bytes = ByteBuffer.allocate(len / 3);
            }
            bytes.clear();
            while (i < len && str.charAt(i) == '%') {
                if (i + 2 >= len) {
                    throw new DecodeException(str, null);
                }
                int hi = Character.digit(str.charAt(i + 1), 16),
                    lo = Character.digit(str.charAt(i + 2), 16);
                if (hi == -1 || lo == -1) {
                    throw new DecodeException(str, null);
                }
                bytes.put((byte) ((hi << 4) + lo));
                i += 3;
            }
            bytes.flip();
            try {
                sb.append(strictUtf8().decode(bytes));
            } catch (CharacterCodingException e) {
                throw new DecodeException(str, e);
            }
        }
        return sb.toString();
    }
    
    /**
     * Percent-decode the given string, leniently.<p>
     * 
     * The plus character is decoded into a space. If the string can not be
     * decoded, it is returned as-is.
     * 
     * @param str string to decode
     * @return a decoded string, or the given string if undecodable
     * @throws NullPointerException if {@code str} is {@code null}
     */
    public static String decodeLenient(String str) {
        try {
            return URLDecoder.decode(str, UTF_8);
        } catch (IllegalArgumentException e) {
            // Malformed escape; keep the text
            return str.replace('+', ' ');
        }
    }
    
    private static CharsetDecoder strictUtf8() {
        return UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT);
    }
}
