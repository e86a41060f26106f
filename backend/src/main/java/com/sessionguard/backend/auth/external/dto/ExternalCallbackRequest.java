package com.sessionguard.backend.auth.external.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * 제공자 리다이렉트 후 프론트가 넘겨주는 값
 * - provider/redirectUri는 받지 않는다. state에 묶인 값을 쓴다.
 */
public record ExternalCallbackRequest(
        @NotBlank
        String state,

        @NotBlank
        String code,

        Boolean useCookies
) {
    public boolean useCookiesOrTrue() {
        return !Boolean.FALSE.equals(useCookies);
    }
}
