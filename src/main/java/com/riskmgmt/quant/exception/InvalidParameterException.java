package com.riskmgmt.quant.exception;

/**
 * Malformed simulation parameters or risk input.
 */
public class InvalidParameterException extends QuantEngineException {

    public InvalidParameterException(String parameter, String message) {
        super(parameter, message);
    }
}
