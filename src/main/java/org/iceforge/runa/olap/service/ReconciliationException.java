package org.iceforge.runa.olap.service;

/**
 * Cross-tab margins that do not add up to their detail cells. Points at a classification bug or at source rows
 * whose dimension values did not map; the numbers are reported, never corrected.
 */
public class ReconciliationException extends RuntimeException {

    public ReconciliationException(String message) {
        super(message);
    }
}
