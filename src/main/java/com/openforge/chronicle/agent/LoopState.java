package com.openforge.chronicle.agent;

/**
 * States of one tool-call conversation.
 *
 *   GENERATING ──(tool calls)──▶ TOOL_REQUESTED ──▶ TOOL_EXECUTED ──▶ GENERATING
 *        │                                               │
 *        └──(plain answer)──▶ FINALIZED ◀──(budget spent)─┘
 */
public enum LoopState {
    GENERATING,
    TOOL_REQUESTED,
    TOOL_EXECUTED,
    FINALIZED;

    public boolean isTerminal() {
        return this == FINALIZED;
    }
}
