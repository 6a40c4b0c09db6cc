package org.nowstart.zonerisk.data.exception;

import lombok.Getter;

@Getter
public class MissingDataException extends ZoneRiskException {

    public static final String CODE = "missing_data";

    private final String source;

    public MissingDataException(String source, String message) {
        super(CODE, message);
        this.source = source;
    }

    public MissingDataException(String source, String message, Throwable cause) {
        super(CODE, message, cause);
        this.source = source;
    }
}
