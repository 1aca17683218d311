package com.openforge.chronicle.memory.retrieval;

/**
 * Turns the situational context of a generation step into the text sent to the semantic index.
 */
@FunctionalInterface
public interface ContextQueryBuilder {

    /** Never null or blank. */
    String build(QueryContext context);
}
