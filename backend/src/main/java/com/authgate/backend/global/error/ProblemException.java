package com.authgate.backend.global.error;

import org.springframework.web.server.ResponseStatusException;

public class ProblemException extends ResponseStatusException {

    private final ProblemCode problemCode;
    private final String detail;

    public ProblemException(ProblemCode problemCode) {
        this(problemCode, null, null);
    }

    public ProblemException(ProblemCode problemCode, String detail) {
        this(problemCode, detail, null);
    }

    public ProblemException(ProblemCode problemCode, String detail, Throwable cause) {
        super(requireCode(problemCode).getStatus(), problemCode.name(), cause);
        this.problemCode = problemCode;
        this.detail = (detail != null && !detail.isBlank()) ? detail : problemCode.getDefaultDetail();
    }

    public ProblemCode getProblemCode() {
        return problemCode;
    }

    public String getCode() {
        return problemCode.name();
    }

    public String getDetailMessage() {
        return detail;
    }

    private static ProblemCode requireCode(ProblemCode problemCode) {
        if (problemCode == null) {
            throw new IllegalArgumentException("ProblemException code must not be null");
        }
        return problemCode;
    }
}
