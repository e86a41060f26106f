package com.sessionguard.backend.auth.external.service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.sessionguard.backend.auth.config.ExternalAuthProperties;
import com.sessionguard.backend.auth.external.domain.ExternalAuthState;
import com.sessionguard.backend.auth.external.provider.ExternalAuthProvider;
import com.sessionguard.backend.auth.external.provider.ExternalProviderRegistry;
import com.sessionguard.backend.auth.external.repo.ExternalAuthStateRepository;
import com.sessionguard.backend.auth.token.support.TokenGenerator;
import com.sessionguard.backend.auth.token.support.TokenHashUtils;
import com.sessionguard.backend.global.ErrorCode;
import com.sessionguard.backend.global.Result;

import lombok.RequiredArgsConstructor;

/**
 * 외부 로그인 시작(authorize) / state 소비(callback)
 *
 * - redirectUri는 허용 목록과 정확히 일치해야 한다. (오픈 리다이렉트 방지)
 * - state 원문은 authorization URL에만 실리고 DB에는 해시만 남는다.
 * - 미존재/만료/사용된 state는 전부 VALIDATION_ERROR 하나로 응답한다.
 * - authorizeLink: 로그인된 사용자의 연결 요청. state에 userId를 묶어 두고 callback은 연결만 한다.
 */
@Service
@RequiredArgsConstructor
public class ExternalAuthorizationService {

    private static final String INVALID_STATE_MESSAGE = "유효하지 않은 외부 로그인 요청입니다. 다시 시도해주세요.";

    private final ExternalProviderRegistry registry;
    private final ExternalAuthStateRepository stateRepository;
    private final TokenGenerator tokenGenerator;
    private final ExternalAuthProperties props;
    private final Clock clock;

    @Transactional
    public Result<String> authorize(String providerName, String redirectUri) {
        return start(providerName, redirectUri, null);
    }

    @Transactional
    public Result<String> authorizeLink(Long userId, String providerName, String redirectUri) {
        if (userId == null) {
            return Result.failure(ErrorCode.UNAUTHORIZED);
        }
        return start(providerName, redirectUri, userId);
    }

    private Result<String> start(String providerName, String redirectUri, Long linkUserId) {
        Optional<ExternalAuthProvider> provider = registry.find(providerName);
        if (provider.isEmpty()) {
            return Result.failure(ErrorCode.VALIDATION_ERROR, "지원하지 않는 외부 로그인입니다.");
        }
        if (redirectUri == null || !props.allowedRedirectUris().contains(redirectUri)) {
            return Result.failure(ErrorCode.VALIDATION_ERROR, "허용되지 않은 redirectUri 입니다.");
        }

        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime expiresAt = now.plusSeconds(props.stateTtlSeconds());
        String rawState = tokenGenerator.newExternalState();
        String stateHash = TokenHashUtils.sha256Hex(rawState);
        String name = provider.get().name();
        stateRepository.save(linkUserId == null
                ? ExternalAuthState.create(stateHash, name, redirectUri, now, expiresAt)
                : ExternalAuthState.createForLink(stateHash, name, redirectUri, linkUserId, now, expiresAt));

        return Result.success(provider.get().buildAuthorizationUrl(rawState, redirectUri, null));
    }

    @Transactional
    public Result<ConsumedState> consumeState(String rawState) {
        if (rawState == null || rawState.isBlank()) {
            return Result.failure(ErrorCode.VALIDATION_ERROR, INVALID_STATE_MESSAGE);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        Optional<ExternalAuthState> found = stateRepository.findByStateHash(TokenHashUtils.sha256Hex(rawState.trim()));
        if (found.isEmpty() || found.get().isUsed() || found.get().isExpired(now)) {
            return Result.failure(ErrorCode.VALIDATION_ERROR, INVALID_STATE_MESSAGE);
        }

        ExternalAuthState state = found.get();
        if (stateRepository.consume(state.getId()) == 0) {
            return Result.failure(ErrorCode.VALIDATION_ERROR, INVALID_STATE_MESSAGE);
        }
        return Result.success(new ConsumedState(state.getProvider(), state.getRedirectUri(), state.getUserId()));
    }

    /** linkUserId != null 이면 연결 전용 callback */
    public record ConsumedState(String provider, String redirectUri, Long linkUserId) {

        public boolean isLinkOnly() {
            return linkUserId != null;
        }
    }
}
