package com.riskmgmt.quant.exception;

public class SimulationCancelledException extends QuantEngineException {

    public SimulationCancelledException(String parameter, String message) {
        super(parameter, message);
    }

    public SimulationCancelledException(String parameter, String message, Throwable cause) {
        super(parameter, message, cause);
    }
}
