package eu.virtualparadox.notedraft.rag.rank;

public enum ERankingStrategy {
    WEIGHTED,
    DIVERSITY
}
