package eu.virtualparadox.notedraft.rag.stream;

/**
 * @param value    unescaped content decoded so far
 * @param complete whether the closing quote has been seen
 */
public record DecodedField(String value, boolean complete) {
}
