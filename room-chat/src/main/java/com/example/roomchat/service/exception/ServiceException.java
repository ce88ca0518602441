package com.example.roomchat.service.exception;

import org.springframework.http.HttpStatus;

/**
 * Failure of an HTTP-facing operation, carrying the status the API should answer with.
 */
public class ServiceException extends RuntimeException {

    private final HttpStatus status;
    private final String errorCode;

    public ServiceException(HttpStatus status, String message) {
        this(status, message, null);
    }

    public ServiceException(HttpStatus status, String message, String errorCode) {
        super(message, null, false, status.is5xxServerError());
        this.status = status;
        this.errorCode = errorCode;
    }

    public static ServiceException roomNotFound(String roomName) {
        return new ServiceException(HttpStatus.NOT_FOUND, "Room '%s' does not exist".formatted(roomName), "room_not_found");
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
