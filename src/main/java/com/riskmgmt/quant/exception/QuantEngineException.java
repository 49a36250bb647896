package com.riskmgmt.quant.exception;

/**
 * Base class for engine failures. Every failure names the parameter (or input) at fault.
 */
public abstract class QuantEngineException extends RuntimeException {

    private final String parameter;

    protected QuantEngineException(String parameter, String message) {
        super(message);
        this.parameter = parameter;
    }

    protected QuantEngineException(String parameter, String message, Throwable cause) {
        super(message, cause);
        this.parameter = parameter;
    }

    public String getParameter() {
        return parameter;
    }
}
