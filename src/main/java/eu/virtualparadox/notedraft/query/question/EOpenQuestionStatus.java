package eu.virtualparadox.notedraft.query.question;

public enum EOpenQuestionStatus {
    OPEN,
    ANSWERED,
    RESOLVED;

    public boolean canTransitionTo(final EOpenQuestionStatus target) {
        return switch (this) {
            case OPEN -> target == ANSWERED || target == RESOLVED;
            case ANSWERED, RESOLVED -> target == OPEN;
        };
    }
}
