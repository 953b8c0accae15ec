package eu.virtualparadox.notedraft.query.question;

/**
 * A question as found in generated text, before it is merged into the ledger.
 *
 * @param key normalized text used to match it against known questions
 */
public record ExtractedQuestion(String text, String rationale, String key) {
}
