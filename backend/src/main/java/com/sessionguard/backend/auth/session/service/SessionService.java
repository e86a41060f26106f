package com.sessionguard.backend.auth.session.service;

import java.util.Locale;
import java.util.Optional;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.sessionguard.backend.auth.audit.AuditAction;
import com.sessionguard.backend.auth.audit.AuditSink;
import com.sessionguard.backend.auth.cache.UserCacheInvalidator;
import com.sessionguard.backend.auth.domain.User;
import com.sessionguard.backend.auth.domain.UserRole;
import com.sessionguard.backend.auth.external.provider.ExternalAuthProvider;
import com.sessionguard.backend.auth.external.provider.ExternalProviderRegistry;
import com.sessionguard.backend.auth.external.provider.ExternalUserInfo;
import com.sessionguard.backend.auth.external.service.ExternalAccountResolver;
import com.sessionguard.backend.auth.external.service.ExternalAccountResolver.ResolvedAccount;
import com.sessionguard.backend.auth.external.service.ExternalAuthorizationService;
import com.sessionguard.backend.auth.external.service.ExternalAuthorizationService.ConsumedState;
import com.sessionguard.backend.auth.external.service.ExternalLinkService;
import com.sessionguard.backend.auth.identity.credential.UserCredentialService;
import com.sessionguard.backend.auth.repo.UserRepository;
import com.sessionguard.backend.auth.token.domain.RefreshInvalidateReason;
import com.sessionguard.backend.auth.token.service.RefreshTokenService;
import com.sessionguard.backend.auth.token.service.TokenPair;
import com.sessionguard.backend.auth.twofactor.service.TwoFactorChallengeService;
import com.sessionguard.backend.auth.twofactor.service.VerifiedChallenge;
import com.sessionguard.backend.global.ErrorCode;
import com.sessionguard.backend.global.Result;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 세션 수명주기 오케스트레이터
 *
 * 로그인 / 리프레시 / 2FA 완료 / 로그아웃 / 비밀번호 변경·설정 / 전체 세션 폐기 / 권한 변경 전파 / 외부 로그인·연결
 *
 * - HTTP(쿠키, 상태코드)는 모른다. Result<...>를 돌려주고, 쿠키/바디 변환은 웹 계층이 한다.
 * - 예상된 실패(비밀번호 불일치, 잠김, 만료)는 Result 실패로, 인프라 장애만 예외로 올라간다.
 * - security stamp가 바뀌는 경로는 전부 캐시 evict + 감사 로그를 남긴다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionService {

    private final UserRepository userRepository;
    private final UserCredentialService credentialService;
    private final RefreshTokenService refreshTokenService;
    private final TwoFactorChallengeService challengeService;
    private final ExternalProviderRegistry providerRegistry;
    private final ExternalAuthorizationService authorizationService;
    private final ExternalAccountResolver accountResolver;
    private final ExternalLinkService linkService;
    private final UserCacheInvalidator cacheInvalidator;
    private final AuditSink auditSink;

    // ========= login =========

    /**
     * 비밀번호 로그인
     *
     * 1) 이메일 normalize(trim + lowercase) 후 FOR UPDATE 조회 (실패 카운터 경쟁 방지)
     * 2) 잠김 → ACCOUNT_LOCKED (비밀번호 확인 전)
     * 3) 비밀번호 불일치 → 실패 기록 후 INVALID_CREDENTIALS ("이메일 없음"과 같은 응답)
     * 4) 2FA 사용자 → 챌린지, 아니면 토큰 쌍
     */
    @Transactional
    public Result<SessionOutcome> login(String identifier, String password, boolean rememberMe) {
        if (isBlank(identifier) || isBlank(password)) {
            return Result.failure(ErrorCode.VALIDATION_ERROR);
        }

        String email = identifier.trim().toLowerCase(Locale.ROOT);
        Optional<User> found = userRepository.findByEmailForUpdate(email);
        if (found.isEmpty()) {
            auditSink.record(AuditAction.LOGIN_FAILED, null, "reason=unknown_identifier");
            return Result.failure(ErrorCode.INVALID_CREDENTIALS);
        }
        User user = found.get();

        if (credentialService.isLockedOut(user)) {
            auditSink.record(AuditAction.LOGIN_LOCKED_OUT, user.getId());
            return Result.failureRetryAfter(ErrorCode.ACCOUNT_LOCKED, credentialService.remainingLockoutSeconds(user));
        }

        if (!credentialService.checkPassword(user, password)) {
            boolean lockedNow = credentialService.recordFailure(user);
            auditSink.record(AuditAction.LOGIN_FAILED, user.getId(), "reason=bad_password");
            if (lockedNow) {
                auditSink.record(AuditAction.LOGIN_LOCKED_OUT, user.getId());
            }
            return Result.failure(ErrorCode.INVALID_CREDENTIALS);
        }

        credentialService.recordSuccess(user);

        if (user.isTwoFactorEnabled()) {
            return Result.success(SessionOutcome.twoFactorRequired(challengeService.issue(user.getId(), rememberMe)));
        }

        auditSink.record(AuditAction.LOGIN_SUCCESS, user.getId());
        return Result.success(SessionOutcome.authenticated(refreshTokenService.issuePair(user, rememberMe)));
    }

    // ========= refresh / logout =========

    public Result<TokenPair> refresh(String refreshToken) {
        return refreshTokenService.rotate(refreshToken);
    }

    /** 제출된 refresh 하나만 무효화. 없거나 모르는 토큰이어도 성공(멱등) */
    @Transactional
    public void logout(String refreshToken) {
        refreshTokenService.invalidateIfPresent(refreshToken, RefreshInvalidateReason.LOGOUT)
                .ifPresent(userId -> {
                    cacheInvalidator.evict(userId);
                    auditSink.record(AuditAction.LOGOUT, userId);
                });
    }

    // ========= two-factor =========

    @Transactional
    public Result<TokenPair> completeTwoFactor(String challengeToken, String code) {
        return challengeService.verify(challengeToken, code).flatMap(this::issueForChallenge);
    }

    @Transactional
    public Result<TokenPair> completeTwoFactorWithRecoveryCode(String challengeToken, String recoveryCode) {
        return challengeService.verifyRecoveryCode(challengeToken, recoveryCode).flatMap(this::issueForChallenge);
    }

    private Result<TokenPair> issueForChallenge(VerifiedChallenge verified) {
        Optional<User> user = userRepository.findById(verified.userId());
        if (user.isEmpty()) {
            return Result.failure(ErrorCode.CHALLENGE_NOT_FOUND);
        }
        auditSink.record(AuditAction.LOGIN_SUCCESS, verified.userId(), "factor=2fa");
        return Result.success(refreshTokenService.issuePair(user.get(), verified.rememberMe()));
    }

    // ========= credential / permission change =========

    /**
     * 비밀번호 변경
     * - stamp 교체 → 기존 access token 전부 무효
     * - 모든 refresh 무효화 → 다른 기기 세션 종료
     * - 호출한 클라이언트에는 새 쌍을 준다.
     */
    @Transactional
    public Result<TokenPair> changePassword(Long userId, String currentPassword, String newPassword, boolean rememberMe) {
        if (isBlank(newPassword)) {
            return Result.failure(ErrorCode.VALIDATION_ERROR);
        }
        Optional<User> found = userRepository.findById(userId);
        if (found.isEmpty()) {
            return Result.failure(ErrorCode.UNAUTHORIZED);
        }
        User user = found.get();

        if (!credentialService.checkPassword(user, currentPassword)) {
            return Result.failure(ErrorCode.INVALID_CREDENTIALS);
        }

        user.changePasswordHash(credentialService.hashPassword(newPassword));
        int invalidated = refreshTokenService.invalidateAllForUser(userId, RefreshInvalidateReason.PASSWORD_CHANGED);

        cacheInvalidator.evict(userId);
        auditSink.record(AuditAction.PASSWORD_CHANGED, userId, "invalidatedRefreshTokens=" + invalidated);

        return Result.success(refreshTokenService.issuePair(user, rememberMe));
    }

    /**
     * 비밀번호 설정 (외부 로그인으로 만들어져 비밀번호가 없는 계정 전용)
     * - 이미 비밀번호가 있으면 VALIDATION_ERROR (변경은 현재 비밀번호 확인 경로로)
     * - 자격 증명이 바뀌므로 변경과 같이 다른 세션은 끊고 호출자에게 새 쌍을 준다.
     */
    @Transactional
    public Result<TokenPair> setPassword(Long userId, String newPassword, boolean rememberMe) {
        if (isBlank(newPassword)) {
            return Result.failure(ErrorCode.VALIDATION_ERROR);
        }
        Optional<User> found = userRepository.findByIdForUpdate(userId);
        if (found.isEmpty()) {
            return Result.failure(ErrorCode.UNAUTHORIZED);
        }
        User user = found.get();
        if (user.hasPassword()) {
            return Result.failure(ErrorCode.VALIDATION_ERROR, "이미 비밀번호가 설정되어 있습니다.");
        }

        user.setInitialPassword(credentialService.hashPassword(newPassword));
        int invalidated = refreshTokenService.invalidateAllForUser(userId, RefreshInvalidateReason.PASSWORD_CHANGED);

        cacheInvalidator.evict(userId);
        auditSink.record(AuditAction.PASSWORD_SET, userId, "invalidatedRefreshTokens=" + invalidated);

        return Result.success(refreshTokenService.issuePair(user, rememberMe));
    }

    /** 모든 기기에서 로그아웃 */
    @Transactional
    public Result<Void> revokeAllSessions(Long userId) {
        Optional<User> found = userRepository.findById(userId);
        if (found.isEmpty()) {
            return Result.failure(ErrorCode.UNAUTHORIZED);
        }

        found.get().rotateSecurityStamp();
        int invalidated = refreshTokenService.invalidateAllForUser(userId, RefreshInvalidateReason.SESSIONS_REVOKED);

        cacheInvalidator.evict(userId);
        auditSink.record(AuditAction.SESSIONS_REVOKED, userId, "invalidatedRefreshTokens=" + invalidated);
        return Result.success(null);
    }

    /**
     * 권한 변경 전파 (soft refresh)
     * - stamp만 교체한다. refresh는 그대로라 클라이언트는 조용히 재발급받아 새 권한을 얻는다.
     */
    @Transactional
    public Result<Void> propagatePermissionChange(Long userId, UserRole newRole) {
        Optional<User> found = userRepository.findById(userId);
        if (found.isEmpty()) {
            return Result.failure(ErrorCode.UNAUTHORIZED);
        }

        found.get().changeRole(newRole);
        cacheInvalidator.evict(userId);
        auditSink.record(AuditAction.PERMISSIONS_CHANGED, userId, "role=" + newRole);
        return Result.success(null);
    }

    // ========= external =========

    /**
     * callback: state 소비 → 제공자/redirectUri는 state에서 꺼낸다.
     * - 로그인된 사용자가 시작한 state면 로그인하지 않고 그 사용자에 연결만 한다.
     */
    public Result<SessionOutcome> completeExternalLogin(String state, String code) {
        Result<ConsumedState> consumed = authorizationService.consumeState(state);
        if (consumed.isFailure()) return consumed.castFailure();

        ConsumedState st = consumed.value();
        if (st.isLinkOnly()) {
            return linkExternalProvider(st.linkUserId(), st.provider(), code, st.redirectUri());
        }
        return loginWithExternalProvider(st.provider(), code, st.redirectUri());
    }

    /**
     * 외부 제공자 로그인
     * - 트랜잭션 밖에서 제공자 HTTP를 호출한다. (DB 커넥션을 붙잡고 외부 호출 대기 금지)
     * - 5xx/타임아웃은 ExternalProviderUnavailableException으로 그대로 올라간다.
     */
    public Result<SessionOutcome> loginWithExternalProvider(String providerName, String code, String redirectUri) {
        Result<ExchangedIdentity> exchanged = exchange(providerName, code, redirectUri);
        if (exchanged.isFailure()) return exchanged.castFailure();
        String name = exchanged.value().provider();

        Result<ResolvedAccount> resolved = accountResolver.resolve(name, exchanged.value().info());
        if (resolved.isFailure()) {
            auditSink.record(AuditAction.EXTERNAL_LOGIN_FAILED, null, "provider=" + name + " error=" + resolved.error());
            return resolved.castFailure();
        }

        User user = resolved.value().user();
        boolean newAccount = resolved.value().newAccount();

        if (credentialService.isLockedOut(user)) {
            auditSink.record(AuditAction.LOGIN_LOCKED_OUT, user.getId(), "provider=" + name);
            return Result.failureRetryAfter(ErrorCode.ACCOUNT_LOCKED, credentialService.remainingLockoutSeconds(user));
        }

        // 외부 로그인은 rememberMe 선택 단계가 없어 세션 수명으로 발급한다.
        if (user.isTwoFactorEnabled()) {
            return Result.success(SessionOutcome.twoFactorRequired(challengeService.issue(user.getId(), false), newAccount));
        }

        auditSink.record(AuditAction.EXTERNAL_LOGIN_SUCCESS, user.getId(), "provider=" + name);
        return Result.success(SessionOutcome.authenticated(refreshTokenService.issuePair(user, false), newAccount));
    }

    /** 로그인된 사용자에 외부 계정 연결. 토큰은 발급하지 않는다. */
    public Result<SessionOutcome> linkExternalProvider(Long userId, String providerName, String code, String redirectUri) {
        Result<ExchangedIdentity> exchanged = exchange(providerName, code, redirectUri);
        if (exchanged.isFailure()) return exchanged.castFailure();
        String name = exchanged.value().provider();

        Result<Void> linked = linkService.link(userId, name, exchanged.value().info());
        if (linked.isFailure()) {
            auditSink.record(AuditAction.EXTERNAL_LOGIN_FAILED, userId, "provider=" + name + " mode=link error=" + linked.error());
            return linked.castFailure();
        }
        return Result.success(SessionOutcome.linked(name));
    }

    private Result<ExchangedIdentity> exchange(String providerName, String code, String redirectUri) {
        Optional<ExternalAuthProvider> provider = providerRegistry.find(providerName);
        if (provider.isEmpty()) {
            return Result.failure(ErrorCode.VALIDATION_ERROR, "지원하지 않는 외부 로그인입니다.");
        }
        if (isBlank(code) || isBlank(redirectUri)) {
            return Result.failure(ErrorCode.VALIDATION_ERROR);
        }
        String name = provider.get().name();

        Result<ExternalUserInfo> info = provider.get().exchangeCode(code, redirectUri);
        if (info.isFailure()) {
            log.warn("외부 로그인 교환 실패: provider={}, error={}", name, info.error());
            auditSink.record(AuditAction.EXTERNAL_LOGIN_FAILED, null, "provider=" + name + " error=" + info.error());
            return info.castFailure();
        }
        return Result.success(new ExchangedIdentity(name, info.value()));
    }

    private record ExchangedIdentity(String provider, ExternalUserInfo info) {}

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
