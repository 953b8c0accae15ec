package eu.virtualparadox.notedraft.query.question;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Reconciles a fresh extraction for one section with the questions already known.
 *
 * <ul>
 *   <li>known and extracted again: kept as is (answers and edits survive), a resolved one reopens</li>
 *   <li>extracted for the first time: added as open</li>
 *   <li>open but no longer extracted: resolved</li>
 *   <li>answered but no longer extracted: kept</li>
 * </ul>
 *
 * Questions of other sections pass through untouched. Merging the same extraction twice
 * changes nothing the second time.
 */
@Slf4j
@Component
public class OpenQuestionMerger {

    public List<OpenQuestion> merge(final List<OpenQuestion> existing,
                                    final String sectionId,
                                    final List<ExtractedQuestion> extracted,
                                    final Instant now) {
        final Map<String, ExtractedQuestion> incoming = new LinkedHashMap<>();
        for (ExtractedQuestion question : extracted) {
            incoming.putIfAbsent(question.key(), question);
        }

        final List<OpenQuestion> merged = new ArrayList<>(existing.size() + incoming.size());
        final Set<String> known = new HashSet<>();
        for (OpenQuestion question : existing) {
            if (!sectionId.equals(question.getSectionId())) {
                merged.add(question);
                continue;
            }
            known.add(question.getKey());
            merged.add(carryForward(question, incoming.containsKey(question.getKey()), now));
        }

        for (ExtractedQuestion question : incoming.values()) {
            if (known.contains(question.key())) {
                continue;
            }
            log.debug("New open question for {}: {}", sectionId, question.text());
            merged.add(OpenQuestion.builder()
                    .id(UUID.randomUUID().toString())
                    .sectionId(sectionId)
                    .key(question.key())
                    .text(question.text())
                    .rationale(question.rationale())
                    .status(EOpenQuestionStatus.OPEN)
                    .createdAt(now)
                    .updatedAt(now)
                    .build());
        }
        return merged;
    }

    private static OpenQuestion carryForward(final OpenQuestion question, final boolean stillPresent, final Instant now) {
        return switch (question.getStatus()) {
            case OPEN -> stillPresent ? question : question.resolve(now);
            case RESOLVED -> stillPresent ? question.reopen(now) : question;
            case ANSWERED -> question;
        };
    }
}
