package eu.virtualparadox.notedraft.query.question;

import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the "Open questions:" block out of a generated section.
 *
 * <p>The block starts at a header line ({@code Open questions:}, optionally bold or a markdown
 * heading) and runs to the end of the text. Each list item of the form
 * {@code Question? (Reason: ...)} is a candidate. Items without a question mark and items
 * asking for demographics or document metadata are skipped. At most
 * {@value #MAX_PER_SECTION} question is kept per section.</p>
 */
@Component
public class OpenQuestionExtractor {

    static final int MAX_PER_SECTION = 1;

    private static final Pattern HEADER = Pattern.compile(
            "(?im)^[ \\t]*(?:#{1,6}[ \\t]*)?(?:\\*\\*)?[ \\t]*open questions?[ \\t]*"
                    + "(?::[ \\t]*(?:\\*\\*)?|(?:\\*\\*)?[ \\t]*:?[ \\t]*$)");
    private static final Pattern BULLET = Pattern.compile("^\\s*(?:[-*•]|\\d+[.)])\\s+");
    private static final Pattern ITEM = Pattern.compile(
            "^(.*?\\?)\\s*(?:\\(\\s*(?:reason|why|rationale)\\s*:\\s*(.*?)\\)\\s*)?\\.?$",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private static final List<Pattern> DENY = List.of(
            deny("\\bage\\b(?! (?:at|of) onset)|\\bhow old\\b(?! (?:was|were) (?:he|she|they|the patient) when)"),
            deny("\\bdob\\b|\\bdate of birth\\b|\\bbirth ?date\\b"),
            deny("\\bgender\\b|\\bsex\\b|\\bpronouns?\\b"),
            deny("\\binsurance\\b|\\binsurer\\b|\\bpayer\\b"),
            deny("\\b(?:home |mailing |street )?address\\b(?! (?:the|this|these|his|her|their)\\b)"),
            deny("\\bphone\\b|\\bcontact number\\b|\\be-?mail\\b"),
            deny("\\b(?:patient'?s|legal|full|preferred|first|last) name\\b|\\bwhat is (?:his|her|their) name\\b"),
            deny("\\bmrn\\b|\\bmedical record number\\b"),
            deny("\\brace\\b|\\bethnicity\\b"),
            deny("\\bmetadata\\b|\\b(?:document|note|report|visit|admission|discharge) date\\b"
                    + "|\\bdate of (?:the )?(?:document|note|report|service|visit)\\b"));

    public List<ExtractedQuestion> extract(final String sectionText) {
        final List<ExtractedQuestion> out = new ArrayList<>();
        if (StringUtils.isBlank(sectionText)) {
            return out;
        }
        final Matcher header = HEADER.matcher(sectionText);
        if (!header.find()) {
            return out;
        }
        for (String line : sectionText.substring(header.end()).split("\n")) {
            if (out.size() >= MAX_PER_SECTION) {
                break;
            }
            final ExtractedQuestion question = parseItem(line);
            if (question != null && out.stream().noneMatch(q -> q.key().equals(question.key()))) {
                out.add(question);
            }
        }
        return out;
    }

    /**
     * Removes the open-question block, leaving the section prose.
     */
    public String stripBlock(final String sectionText) {
        if (StringUtils.isBlank(sectionText)) {
            return StringUtils.defaultString(sectionText);
        }
        final Matcher header = HEADER.matcher(sectionText);
        return header.find() ? sectionText.substring(0, header.start()).stripTrailing() : sectionText;
    }

    public static String normalizeKey(final String text) {
        return StringUtils.defaultString(text)
                .toLowerCase(Locale.ROOT)
                .replaceAll("[^\\p{L}\\p{N}\\s]", " ")
                .replaceAll("\\s+", " ")
                .trim();
    }

    static boolean isDenied(final String question) {
        return DENY.stream().anyMatch(p -> p.matcher(question).find());
    }

    private static ExtractedQuestion parseItem(final String line) {
        final String item = BULLET.matcher(line).replaceFirst("").replace("**", "").trim();
        if (item.isEmpty() || item.indexOf('?') < 0) {
            return null;
        }
        final Matcher m = ITEM.matcher(item);
        if (!m.matches()) {
            return null;
        }
        final String text = m.group(1).trim();
        if (isDenied(text)) {
            return null;
        }
        final String rationale = StringUtils.trimToNull(m.group(2));
        return new ExtractedQuestion(text, rationale, normalizeKey(text));
    }

    private static Pattern deny(final String regex) {
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }
}
