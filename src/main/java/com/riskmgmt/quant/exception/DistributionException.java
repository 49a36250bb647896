package com.riskmgmt.quant.exception;

/**
 * The sampler kept producing invalid values after its bounded retries.
 * Signals a misconfigured distribution, not bad input data.
 */
public class DistributionException extends QuantEngineException {

    public DistributionException(String parameter, String message) {
        super(parameter, message);
    }

    public DistributionException(String parameter, String message, Throwable cause) {
        super(parameter, message, cause);
    }
}
