package com.rollcall.backend.global.error;

import org.springframework.http.HttpStatus;

/**
 * The caller's authoritative role does not permit the requested scope.
 */
public class AuthorizationException extends ProblemException {

    public AuthorizationException(String code, String detail) {
        super(HttpStatus.FORBIDDEN, code, detail);
    }
}
