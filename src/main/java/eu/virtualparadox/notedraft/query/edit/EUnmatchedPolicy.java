package eu.virtualparadox.notedraft.query.edit;

/**
 * What to do with a replacement whose target excerpt cannot be found.
 */
public enum EUnmatchedPolicy {
    APPEND,
    REPLACE_ALL,
    REJECT
}
