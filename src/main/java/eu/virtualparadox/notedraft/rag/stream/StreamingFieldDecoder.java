package eu.virtualparadox.notedraft.rag.stream;

/**
 * Reads one string field out of a JSON object that is still being written.
 *
 * <p>The buffer is the concatenation of all deltas received so far and is normally
 * not valid JSON. The decoder looks for {@code "field"} (single quotes are tolerated),
 * the following colon and the opening quote of the value, then consumes characters
 * until an unescaped closing quote or the end of the buffer. Escape sequences are
 * resolved on the fly; an escape cut off by the end of the buffer is left for the
 * next call. Nothing in here throws on malformed input.</p>
 */
public final class StreamingFieldDecoder {

    private StreamingFieldDecoder() {
        // Prevent instantiation
    }

    /**
     * @return the value decoded so far, or {@code null} when the key or the opening
     * quote of its value has not arrived yet
     */
    public static String feed(final CharSequence buffer, final String fieldName) {
        final DecodedField field = decode(buffer, fieldName);
        return field == null ? null : field.value();
    }

    /**
     * Same as {@link #feed} but also tells whether the value is complete.
     */
    public static DecodedField decode(final CharSequence buffer, final String fieldName) {
        if (buffer == null || fieldName == null || fieldName.isEmpty()) {
            return null;
        }
        final String text = buffer.toString();
        final int valueStart = locateValue(text, fieldName);
        if (valueStart < 0) {
            return null;
        }

        final StringBuilder out = new StringBuilder();
        int i = valueStart;
        while (i < text.length()) {
            final char ch = text.charAt(i);
            if (ch == '"') {
                return new DecodedField(out.toString(), true);
            }
            if (ch != '\\') {
                out.append(ch);
                i++;
                continue;
            }
            if (i + 1 >= text.length()) {
                break;
            }
            final char esc = text.charAt(i + 1);
            switch (esc) {
                case 'n' -> out.append('\n');
                case 't' -> out.append('\t');
                case 'r' -> out.append('\r');
                case 'b' -> out.append('\b');
                case 'f' -> out.append('\f');
                case 'u' -> {
                    if (i + 6 > text.length()) {
                        return new DecodedField(out.toString(), false);
                    }
                    final String hex = text.substring(i + 2, i + 6);
                    try {
                        out.append((char) Integer.parseInt(hex, 16));
                    }
                    catch (NumberFormatException e) {
                        out.append(hex);
                    }
                    i += 6;
                    continue;
                }
                default -> out.append(esc); // covers \" \\ \/
            }
            i += 2;
        }
        return new DecodedField(out.toString(), false);
    }

    private static int locateValue(final String text, final String fieldName) {
        int keyEnd = keyEnd(text, '"' + fieldName + '"');
        if (keyEnd < 0) {
            keyEnd = keyEnd(text, '\'' + fieldName + '\'');
        }
        if (keyEnd < 0) {
            return -1;
        }
        final int colon = text.indexOf(':', keyEnd);
        if (colon < 0) {
            return -1;
        }
        final int quote = text.indexOf('"', colon + 1);
        return quote < 0 ? -1 : quote + 1;
    }

    private static int keyEnd(final String text, final String quotedKey) {
        final int idx = text.indexOf(quotedKey);
        return idx < 0 ? -1 : idx + quotedKey.length();
    }
}
