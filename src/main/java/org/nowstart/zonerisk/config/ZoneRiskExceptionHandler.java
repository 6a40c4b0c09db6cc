package org.nowstart.zonerisk.config;

import feign.FeignException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import java.util.List;
import java.util.concurrent.CompletionException;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.zonerisk.data.exception.InsufficientHistoryException;
import org.nowstart.zonerisk.data.exception.InvalidRiskBoundsException;
import org.nowstart.zonerisk.data.exception.MissingDataException;
import org.nowstart.zonerisk.data.exception.PersistenceException;
import org.nowstart.zonerisk.data.exception.ZoneRiskException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class ZoneRiskExceptionHandler {

    @ExceptionHandler(ZoneRiskException.class)
    public ProblemDetail handleZoneRiskException(ZoneRiskException exception) {
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(resolveStatus(exception), exception.getMessage());
        problemDetail.setProperty("code", exception.getCode());
        if (exception instanceof InvalidRiskBoundsException bounds) {
            problemDetail.setProperty("riskReward", bounds.getRiskReward());
            problemDetail.setProperty("requiredRiskReward", bounds.getRequiredRiskReward());
        }
        if (exception instanceof MissingDataException missing) {
            problemDetail.setProperty("source", missing.getSource());
        }
        return problemDetail;
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgumentException(IllegalArgumentException exception) {
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, exception.getMessage());
        problemDetail.setProperty("code", "bad_request");
        return problemDetail;
    }

    @ExceptionHandler(CompletionException.class)
    public ProblemDetail handleCompletionException(CompletionException exception) {
        Throwable cause = exception.getCause();
        if (cause instanceof ZoneRiskException zoneRiskException) {
            return handleZoneRiskException(zoneRiskException);
        }
        if (cause instanceof IllegalArgumentException illegalArgumentException) {
            return handleIllegalArgumentException(illegalArgumentException);
        }
        if (cause instanceof FeignException feignException) {
            return handleFeignException(feignException);
        }
        log.error("event=request_failed reason=completion", exception);
        return handleUnexpectedException();
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidationException(MethodArgumentNotValidException exception) {
        List<String> details = exception.getBindingResult()
                .getFieldErrors()
                .stream()
                .map(FieldError::getDefaultMessage)
                .toList();

        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, "Request validation failed");
        problemDetail.setProperty("code", "validation_error");
        problemDetail.setProperty("details", details);
        return problemDetail;
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ProblemDetail handleConstraintViolationException(ConstraintViolationException exception) {
        List<String> details = exception.getConstraintViolations()
                .stream()
                .map(ConstraintViolation::getMessage)
                .toList();

        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, "Request validation failed");
        problemDetail.setProperty("code", "validation_error");
        problemDetail.setProperty("details", details);
        return problemDetail;
    }

    @ExceptionHandler(FeignException.class)
    public ProblemDetail handleFeignException(FeignException exception) {
        HttpStatus status = HttpStatus.resolve(exception.status());
        if (status == null) {
            status = HttpStatus.BAD_GATEWAY;
        }

        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, extractFeignDetail(exception));
        problemDetail.setProperty("code", "upbit_error");
        problemDetail.setProperty("upstreamStatus", exception.status());
        return problemDetail;
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleUnexpectedException() {
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "Unexpected server error"
        );
        problemDetail.setProperty("code", "internal_error");
        return problemDetail;
    }

    HttpStatus resolveStatus(ZoneRiskException exception) {
        if (exception instanceof InvalidRiskBoundsException || exception instanceof InsufficientHistoryException) {
            return HttpStatus.UNPROCESSABLE_ENTITY;
        }
        if (exception instanceof MissingDataException) {
            return HttpStatus.SERVICE_UNAVAILABLE;
        }
        if (exception instanceof PersistenceException) {
            return HttpStatus.INTERNAL_SERVER_ERROR;
        }
        return HttpStatus.BAD_REQUEST;
    }

    private String extractFeignDetail(FeignException exception) {
        String body = exception.contentUTF8();
        if (body != null && !body.isBlank()) {
            return body;
        }

        String message = exception.getMessage();
        if (message != null && !message.isBlank()) {
            return message;
        }

        return "Upbit API request failed";
    }
}
