package fr.lapetina.chatgateway.api.dto;

import fr.lapetina.chatgateway.domain.model.ErrorKind;

/**
 * Error body: {@code {"error": {"kind", "message"}}}.
 */
public record ErrorResponse(ErrorBody error) {

    public static ErrorResponse of(ErrorKind kind, String message) {
        return new ErrorResponse(new ErrorBody(kind.name(), message));
    }

    public static ErrorResponse of(String kind, String message) {
        return new ErrorResponse(new ErrorBody(kind, message));
    }

    public record ErrorBody(String kind, String message) {
    }
}
