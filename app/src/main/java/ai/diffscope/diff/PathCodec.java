package ai.diffscope.diff;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Decodes the path tokens git prints in diff headers.
 *
 * <p>Git wraps a path in double quotes and C-style escapes it whenever it contains control characters, quotes,
 * backslashes or (with the default {@code core.quotePath}) non-ASCII bytes. Non-ASCII bytes appear as octal escapes
 * of their UTF-8 encoding, so decoding has to work on bytes and only assemble characters at the end.
 */
public final class PathCodec {
    private static final List<String> DIFF_PREFIXES = List.of("a/", "b/", "c/", "i/", "w/");
    private static final String DEV_NULL = "/dev/null";

    private PathCodec() {}

    /**
     * Decodes one path token.
     *
     * @return the repository-relative path, or {@code null} for {@code /dev/null}, an empty token or a null input
     */
    public static @Nullable String decode(@Nullable String raw) {
        if (raw == null) {
            return null;
        }
        String token = raw;
        int tab = token.indexOf('\t');
        if (tab >= 0) {
            token = token.substring(0, tab);
        }
        if (token.length() >= 2 && token.startsWith("\"") && token.endsWith("\"")) {
            token = token.substring(1, token.length() - 1);
        }
        token = stripPrefix(token);
        if (token.isEmpty() || token.equals(DEV_NULL)) {
            return null;
        }
        return unescape(token);
    }

    /** Decodes the path that follows {@code prefix} on a metadata line such as {@code +++ b/foo}. */
    public static @Nullable String pathAfter(@Nullable String line, String prefix) {
        if (line == null || !line.startsWith(prefix)) {
            return null;
        }
        return decode(line.substring(prefix.length()));
    }

    static String stripPrefix(String token) {
        for (String prefix : DIFF_PREFIXES) {
            if (token.startsWith(prefix)) {
                return token.substring(prefix.length());
            }
        }
        return token;
    }

    static String unescape(String token) {
        if (token.indexOf('\\') < 0) {
            return token;
        }
        var bytes = new ByteArrayOutputStream(token.length());
        int i = 0;
        while (i < token.length()) {
            char c = token.charAt(i);
            if (c != '\\' || i + 1 >= token.length()) {
                int codePoint = token.codePointAt(i);
                writeUtf8(bytes, codePoint);
                i += Character.charCount(codePoint);
                continue;
            }

            char next = token.charAt(i + 1);
            if (isOctalDigit(next)) {
                int value = 0;
                int digits = 0;
                while (digits < 3 && i + 1 + digits < token.length() && isOctalDigit(token.charAt(i + 1 + digits))) {
                    value = value * 8 + (token.charAt(i + 1 + digits) - '0');
                    digits++;
                }
                bytes.write(value & 0xFF);
                i += 1 + digits;
                continue;
            }

            int escaped = escapedByte(next);
            if (escaped >= 0) {
                bytes.write(escaped);
                i += 2;
            } else {
                // unknown escape: keep the escaped character itself
                int codePoint = token.codePointAt(i + 1);
                writeUtf8(bytes, codePoint);
                i += 1 + Character.charCount(codePoint);
            }
        }
        return bytes.toString(StandardCharsets.UTF_8);
    }

    private static int escapedByte(char c) {
        return switch (c) {
            case 't' -> '\t';
            case 'n' -> '\n';
            case 'r' -> '\r';
            case 'b' -> '\b';
            case 'f' -> '\f';
            case 'v' -> 0x0B;
            case 'a' -> 0x07;
            case '\\' -> '\\';
            case '"' -> '"';
            case ' ' -> ' ';
            default -> -1;
        };
    }

    private static boolean isOctalDigit(char c) {
        return c >= '0' && c <= '7';
    }

    private static void writeUtf8(ByteArrayOutputStream out, int codePoint) {
        out.writeBytes(new String(Character.toChars(codePoint)).getBytes(StandardCharsets.UTF_8));
    }
}
