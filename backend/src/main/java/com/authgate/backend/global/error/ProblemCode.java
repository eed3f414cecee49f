package com.authgate.backend.global.error;

import org.springframework.http.HttpStatus;

/**
 * Error taxonomy shared by every module. The code is what clients branch on; the detail is the
 * only message ever shown to them.
 */
public enum ProblemCode {

    INVALID_CREDENTIALS(HttpStatus.UNAUTHORIZED, "Invalid email or password"),
    USER_INACTIVE(HttpStatus.FORBIDDEN, "User account is inactive"),
    USER_NOT_FOUND(HttpStatus.NOT_FOUND, "User not found"),
    USER_ALREADY_EXISTS(HttpStatus.CONFLICT, "User with this email already exists"),
    TOKEN_INVALID(HttpStatus.UNAUTHORIZED, "Invalid or expired token"),
    INVALID_REFRESH_TOKEN(HttpStatus.UNAUTHORIZED, "Invalid or expired refresh token"),
    PASSWORD_POLICY_VIOLATION(HttpStatus.UNPROCESSABLE_ENTITY, "Password does not meet the policy"),
    VALIDATION_ERROR(HttpStatus.UNPROCESSABLE_ENTITY, "Validation failed"),
    DATABASE_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "A database error occurred"),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred");

    private final HttpStatus status;
    private final String defaultDetail;

    ProblemCode(HttpStatus status, String defaultDetail) {
        this.status = status;
        this.defaultDetail = defaultDetail;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getDefaultDetail() {
        return defaultDetail;
    }
}
