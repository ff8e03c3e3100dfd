package com.raditha.bytelift.pipeline;

import com.raditha.bytelift.ByteliftException;

/**
 * A transform threw, or the pipeline failed to settle. Carries the name of the transform at fault.
 */
public class PassFaultException extends ByteliftException {

    private final String passName;

    public PassFaultException(String passName, String message) {
        super(passName + ": " + message);
        this.passName = passName;
    }

    public PassFaultException(String passName, String message, Throwable cause) {
        super(passName + ": " + message, cause);
        this.passName = passName;
    }

    public String getPassName() {
        return passName;
    }
}
