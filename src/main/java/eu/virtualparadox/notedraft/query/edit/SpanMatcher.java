package eu.virtualparadox.notedraft.query.edit;

import java.util.Optional;

/**
 * One strategy for locating an excerpt inside a longer text.
 */
public interface SpanMatcher {

    String name();

    Optional<Span> find(String haystack, String needle);
}
