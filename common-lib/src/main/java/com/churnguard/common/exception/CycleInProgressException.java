package com.churnguard.common.exception;

/** A cycle was requested while another cycle of the same loop was still running. */
public class CycleInProgressException extends InterventionEngineException {

    public CycleInProgressException(String loopName) {
        super(loopName, "cycle already running");
    }
}
