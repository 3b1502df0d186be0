package com.pulsewatch.agent.pipeline;

public class CycleInProgressException extends RuntimeException {

    public CycleInProgressException(CycleState state) {
        super("A detection cycle is already running (state " + state.wireValue() + ")");
    }
}
