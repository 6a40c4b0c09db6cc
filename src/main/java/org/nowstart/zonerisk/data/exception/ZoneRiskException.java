package org.nowstart.zonerisk.data.exception;

import lombok.Getter;

@Getter
public class ZoneRiskException extends RuntimeException {

    private final String code;

    public ZoneRiskException(String code, String message) {
        super(message);
        this.code = code;
    }

    public ZoneRiskException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }
}
