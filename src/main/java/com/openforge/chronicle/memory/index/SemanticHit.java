package com.openforge.chronicle.memory.index;

/**
 * One ranked answer from the semantic index. Higher score means more similar.
 */
public record SemanticHit(long recordId, double score) {}
