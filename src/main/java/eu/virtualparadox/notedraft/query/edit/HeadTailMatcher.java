package eu.virtualparadox.notedraft.query.edit;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Loose match for long excerpts that were partly rewritten: the first and last
 * {@value #EDGE_TOKENS} words must appear, in order, within a bounded distance.
 * Only used for needles of at least {@value #MIN_TOKENS} words.
 */
public class HeadTailMatcher extends RegexSpanMatcher {

    static final int MIN_TOKENS = 6;
    static final int EDGE_TOKENS = 3;
    static final int MIN_GAP = 400;
    static final int MAX_GAP = 4000;
    static final int GAP_SLACK = 200;

    @Override
    public String name() {
        return "head-tail";
    }

    @Override
    protected Pattern patternFor(final String needle) {
        final List<String> tokens = TokenRegexMatcher.tokens(needle);
        if (tokens.size() < MIN_TOKENS) {
            return null;
        }
        final String head = TokenRegexMatcher.join(tokens.subList(0, EDGE_TOKENS));
        final String tail = TokenRegexMatcher.join(tokens.subList(tokens.size() - EDGE_TOKENS, tokens.size()));
        final int gap = maxGap(needle.length());
        return Pattern.compile(head + "[\\s\\S]{0," + gap + "}?" + tail, FLAGS);
    }

    static int maxGap(final int needleLength) {
        return Math.min(MAX_GAP, Math.max(MIN_GAP, needleLength + GAP_SLACK));
    }
}
