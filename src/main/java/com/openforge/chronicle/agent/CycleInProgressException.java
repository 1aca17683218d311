package com.openforge.chronicle.agent;

/** Another observation cycle is still running; cycles never overlap. */
public class CycleInProgressException extends RuntimeException {

    public CycleInProgressException() {
        super("An observation cycle is already in progress");
    }
}
