package eu.virtualparadox.notedraft.rag.schedule;

public enum EJobStatus {
    QUEUED,
    RUNNING,
    COMPLETED,
    REJECTED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this != QUEUED && this != RUNNING;
    }
}
