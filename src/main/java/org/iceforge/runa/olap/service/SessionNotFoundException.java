package org.iceforge.runa.olap.service;

public class SessionNotFoundException extends RuntimeException {

    public SessionNotFoundException(String sessionId) {
        super("No navigation session with id " + sessionId);
    }
}
