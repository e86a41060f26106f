package com.sessionguard.backend.auth.domain;

/** 인가용 역할. JWT role 클레임과 Spring Security 권한(ROLE_*)으로 쓰인다. */
public enum UserRole {
    USER,
    ADMIN
}
