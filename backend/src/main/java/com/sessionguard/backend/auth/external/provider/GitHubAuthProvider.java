package com.sessionguard.backend.auth.external.provider;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.springframework.web.util.UriComponentsBuilder;

import com.fasterxml.jackson.databind.JsonNode;
import com.sessionguard.backend.auth.config.ExternalAuthProperties;
import com.sessionguard.backend.auth.external.provider.EmailSelector.ProviderEmail;
import com.sessionguard.backend.global.ErrorCode;
import com.sessionguard.backend.global.Result;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 프로필 + 별도 이메일 엔드포인트 방식 제공자
 *
 * code → token 엔드포인트(access_token) → /user(id, name) → /user/emails(목록)
 * 이메일은 EmailSelector 우선순위로 고른다.
 */
@Slf4j
@RequiredArgsConstructor
public class GitHubAuthProvider implements ExternalAuthProvider {

    public static final String NAME = "github";
    private static final String SCOPE = "read:user user:email";

    private final ExternalAuthProperties.GitHub props;
    private final ProviderHttpClient http;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String displayName() {
        return "GitHub";
    }

    @Override
    public String buildAuthorizationUrl(String state, String redirectUri, String nonce) {
        // nonce는 OIDC 전용이라 쓰지 않는다.
        return UriComponentsBuilder.fromUriString(props.authorizationUri())
                .queryParam("client_id", props.clientId())
                .queryParam("redirect_uri", redirectUri)
                .queryParam("scope", SCOPE)
                .queryParam("state", state)
                .encode()
                .build()
                .toUriString();
    }

    @Override
    public Result<ExternalUserInfo> exchangeCode(String code, String redirectUri) {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("code", code);
        form.put("client_id", props.clientId());
        form.put("client_secret", props.clientSecret());
        form.put("redirect_uri", redirectUri);

        Result<String> token = http.postForm(NAME, props.tokenUri(), form).flatMap(this::readAccessToken);
        if (token.isFailure()) return token.castFailure();

        Result<JsonNode> profile = http.getJson(NAME, props.userUri(), token.value());
        if (profile.isFailure()) return profile.castFailure();

        String id = profile.value().path("id").asText(null);
        if (id == null || id.isBlank()) {
            log.warn("github 프로필에 id 없음");
            return Result.failure(ErrorCode.PROVIDER_EXCHANGE_FAILED);
        }

        Result<JsonNode> emails = http.getJson(NAME, props.emailsUri(), token.value());
        if (emails.isFailure()) return emails.castFailure();

        Optional<ProviderEmail> selected = EmailSelector.select(readEmails(emails.value()));
        if (selected.isEmpty()) {
            return Result.failure(ErrorCode.NO_USABLE_EMAIL);
        }

        String[] names = splitName(profile.value().path("name").asText(null));
        return Result.success(new ExternalUserInfo(
                id,
                selected.get().email(),
                selected.get().verified(),
                names[0],
                names[1]
        ));
    }

    private Result<String> readAccessToken(JsonNode tokenResponse) {
        // 이 제공자는 잘못된 code에도 200 + {"error": ...}를 준다.
        String token = tokenResponse.path("access_token").asText(null);
        if (token == null || token.isBlank()) {
            log.warn("github token 응답에 access_token 없음: error={}", tokenResponse.path("error").asText(null));
            return Result.failure(ErrorCode.PROVIDER_EXCHANGE_FAILED);
        }
        return Result.success(token);
    }

    private static List<ProviderEmail> readEmails(JsonNode array) {
        List<ProviderEmail> list = new ArrayList<>();
        if (array == null || !array.isArray()) return list;
        for (JsonNode e : array) {
            list.add(new ProviderEmail(
                    e.path("email").asText(null),
                    e.path("primary").asBoolean(false),
                    e.path("verified").asBoolean(false)
            ));
        }
        return list;
    }

    /** "First Last" → [First, Last]. 공백이 없으면 [name, null] */
    private static String[] splitName(String name) {
        if (name == null || name.isBlank()) return new String[] {null, null};
        String trimmed = name.trim();
        int idx = trimmed.indexOf(' ');
        if (idx < 0) return new String[] {trimmed, null};
        return new String[] {trimmed.substring(0, idx), trimmed.substring(idx + 1).trim()};
    }
}
