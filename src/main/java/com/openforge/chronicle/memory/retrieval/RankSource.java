package com.openforge.chronicle.memory.retrieval;

/**
 * Which retrieval path produced a result. A record found by both the recency and the
 * semantic path is tagged RECENCY. KEYWORD only comes from the memory tools' text scan,
 * used when the semantic path is unavailable.
 */
public enum RankSource {
    RECENCY,
    SEMANTIC,
    KEYWORD
}
