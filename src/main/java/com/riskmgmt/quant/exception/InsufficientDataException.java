package com.riskmgmt.quant.exception;

/**
 * Analysis requested on fewer inputs than it needs (e.g. correlation on a single risk).
 */
public class InsufficientDataException extends QuantEngineException {

    public InsufficientDataException(String parameter, String message) {
        super(parameter, message);
    }
}
