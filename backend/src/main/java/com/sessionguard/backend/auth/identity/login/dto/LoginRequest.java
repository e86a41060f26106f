package com.sessionguard.backend.auth.identity.login.dto;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.sessionguard.backend.global.jackson.TrimStringDeserializer;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * 비밀번호 로그인 요청. useCookies를 빼면 쿠키 모드.
 * 비밀번호 72바이트 제한은 BCrypt 입력 한계.
 */
public record LoginRequest(

        @JsonDeserialize(using = TrimStringDeserializer.class)
        @NotBlank @Email @Size(max = 254)
        String email,

        @NotBlank @Size(max = 72)
        String password,

        Boolean rememberMe,

        Boolean useCookies
) {
    public boolean rememberMeOrFalse() {
        return Boolean.TRUE.equals(rememberMe);
    }

    public boolean useCookiesOrTrue() {
        return !Boolean.FALSE.equals(useCookies);
    }
}
