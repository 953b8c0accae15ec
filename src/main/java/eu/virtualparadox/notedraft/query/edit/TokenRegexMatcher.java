package eu.virtualparadox.notedraft.query.edit;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Matches the words of the needle in order, whatever punctuation or spacing sits between them.
 */
public class TokenRegexMatcher extends RegexSpanMatcher {

    static final Pattern TOKEN = Pattern.compile("[\\p{L}\\p{N}]+");
    static final String SEPARATOR = "[^\\p{L}\\p{N}]+";

    @Override
    public String name() {
        return "token-regex";
    }

    @Override
    protected Pattern patternFor(final String needle) {
        final List<String> tokens = tokens(needle);
        if (tokens.isEmpty()) {
            return null;
        }
        return Pattern.compile(join(tokens), FLAGS);
    }

    static List<String> tokens(final String text) {
        final List<String> tokens = new ArrayList<>();
        final Matcher m = TOKEN.matcher(text);
        while (m.find()) {
            tokens.add(m.group());
        }
        return tokens;
    }

    static String join(final List<String> tokens) {
        return tokens.stream().map(Pattern::quote).collect(Collectors.joining(SEPARATOR));
    }
}
