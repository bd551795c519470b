package org.iceforge.runa.olap.service;

/**
 * A dimension or level name that the catalog does not know. Raised before any request is built.
 */
public class UnknownLevelException extends RuntimeException {

    public UnknownLevelException(String message) {
        super(message);
    }
}
