package org.iceforge.runa.olap.service;

/**
 * The engine could not run an aggregation request. Fatal to that request only.
 */
public class AggregationExecutionException extends RuntimeException {

    public AggregationExecutionException(String message) {
        super(message);
    }

    public AggregationExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
