package com.sessionguard.backend.auth.external.provider;

import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.web.util.UriComponentsBuilder;

import com.fasterxml.jackson.databind.JsonNode;
import com.sessionguard.backend.auth.config.ExternalAuthProperties;
import com.sessionguard.backend.global.ErrorCode;
import com.sessionguard.backend.global.Result;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * OIDC userinfo 방식 제공자
 *
 * code → token 엔드포인트(access_token) → userinfo 엔드포인트(sub, email, email_verified, 이름)
 * id_token을 직접 검증하지 않고 제공자의 userinfo 응답을 신뢰한다. (서명키 회전 관리 불필요)
 */
@Slf4j
@RequiredArgsConstructor
public class GoogleAuthProvider implements ExternalAuthProvider {

    public static final String NAME = "google";
    private static final String SCOPE = "openid email profile";

    private final ExternalAuthProperties.Google props;
    private final ProviderHttpClient http;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String displayName() {
        return "Google";
    }

    @Override
    public String buildAuthorizationUrl(String state, String redirectUri, String nonce) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(props.authorizationUri())
                .queryParam("response_type", "code")
                .queryParam("client_id", props.clientId())
                .queryParam("redirect_uri", redirectUri)
                .queryParam("scope", SCOPE)
                .queryParam("state", state)
                .queryParam("access_type", "online");
        if (nonce != null) {
            builder.queryParam("nonce", nonce);
        }
        return builder.encode().build().toUriString();
    }

    @Override
    public Result<ExternalUserInfo> exchangeCode(String code, String redirectUri) {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("grant_type", "authorization_code");
        form.put("code", code);
        form.put("client_id", props.clientId());
        form.put("client_secret", props.clientSecret());
        form.put("redirect_uri", redirectUri);

        return http.postForm(NAME, props.tokenUri(), form)
                .flatMap(this::readAccessToken)
                .flatMap(token -> http.getJson(NAME, props.userInfoUri(), token))
                .flatMap(this::toUserInfo);
    }

    private Result<String> readAccessToken(JsonNode tokenResponse) {
        String token = tokenResponse.path("access_token").asText(null);
        if (token == null || token.isBlank()) {
            log.warn("google token 응답에 access_token 없음: error={}", tokenResponse.path("error").asText(null));
            return Result.failure(ErrorCode.PROVIDER_EXCHANGE_FAILED);
        }
        return Result.success(token);
    }

    private Result<ExternalUserInfo> toUserInfo(JsonNode userInfo) {
        String sub = userInfo.path("sub").asText(null);
        if (sub == null || sub.isBlank()) {
            log.warn("google userinfo에 sub 없음");
            return Result.failure(ErrorCode.PROVIDER_EXCHANGE_FAILED);
        }

        String email = userInfo.path("email").asText(null);
        if (email == null || email.isBlank()) {
            return Result.failure(ErrorCode.NO_USABLE_EMAIL);
        }

        // 문자열 "true"로 오는 구현도 있다.
        boolean verified = userInfo.path("email_verified").asBoolean(false);

        return Result.success(new ExternalUserInfo(
                sub,
                email,
                verified,
                userInfo.path("given_name").asText(null),
                userInfo.path("family_name").asText(null)
        ));
    }
}
