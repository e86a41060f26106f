package com.sessionguard.backend.auth.token.dto;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.sessionguard.backend.global.jackson.TrimStringDeserializer;

/** bearer 모드 클라이언트가 refresh/logout 때 보내는 바디 (쿠키가 있으면 무시) */
public record RefreshTokenRequest(
        @JsonDeserialize(using = TrimStringDeserializer.class)
        String refreshToken
) {}
