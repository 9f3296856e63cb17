package com.rollcall.backend.modules.auth.domain;

public enum UserStatus {
    ACTIVE,
    INACTIVE
}
