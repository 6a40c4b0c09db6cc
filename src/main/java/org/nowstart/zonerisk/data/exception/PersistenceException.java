package org.nowstart.zonerisk.data.exception;

public class PersistenceException extends ZoneRiskException {

    public static final String CODE = "persistence_error";

    public PersistenceException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}
