package eu.virtualparadox.notedraft.query.edit;

/**
 * @param text    the resulting text, unchanged when rejected
 * @param matcher name of the matcher that located the target, {@code null} when none did
 * @param span    location of the target in the original text, {@code null} when none was found
 */
public record ReconciliationResult(String text, EReconcileOutcome outcome, String matcher, Span span) {

    public boolean changed() {
        return outcome != EReconcileOutcome.REJECTED;
    }
}
