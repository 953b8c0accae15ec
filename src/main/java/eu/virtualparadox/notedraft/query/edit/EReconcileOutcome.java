package eu.virtualparadox.notedraft.query.edit;

public enum EReconcileOutcome {
    REPLACED,
    APPENDED,
    REPLACED_ALL,
    REJECTED
}
