package eu.virtualparadox.notedraft.rag.stream;

/**
 * Accumulates streamed deltas and reports the decoded field only when it grew.
 * One instance per stream; not thread-safe.
 */
public class PartialTextTracker {

    private final String fieldName;
    private final StringBuilder buffer = new StringBuilder();
    private String lastEmitted = "";

    public PartialTextTracker(final String fieldName) {
        this.fieldName = fieldName;
    }

    /**
     * @return the new partial value, or {@code null} if nothing visible changed
     */
    public String accept(final String delta) {
        if (delta == null || delta.isEmpty()) {
            return null;
        }
        buffer.append(delta);
        final String partial = StreamingFieldDecoder.feed(buffer, fieldName);
        if (partial == null || partial.equals(lastEmitted)) {
            return null;
        }
        lastEmitted = partial;
        return partial;
    }

    public String content() {
        return buffer.toString();
    }
}
