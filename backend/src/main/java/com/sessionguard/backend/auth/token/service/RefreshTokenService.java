package com.sessionguard.backend.auth.token.service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.sessionguard.backend.auth.audit.AuditAction;
import com.sessionguard.backend.auth.audit.AuditSink;
import com.sessionguard.backend.auth.cache.UserCacheInvalidator;
import com.sessionguard.backend.auth.config.AuthProperties;
import com.sessionguard.backend.auth.domain.User;
import com.sessionguard.backend.auth.repo.UserRepository;
import com.sessionguard.backend.auth.token.domain.RefreshInvalidateReason;
import com.sessionguard.backend.auth.token.domain.RefreshToken;
import com.sessionguard.backend.auth.token.repo.RefreshTokenRepository;
import com.sessionguard.backend.auth.token.support.TokenGenerator;
import com.sessionguard.backend.auth.token.support.TokenHashUtils;
import com.sessionguard.backend.global.ErrorCode;
import com.sessionguard.backend.global.Result;
import com.sessionguard.backend.security.JwtService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Refresh Token 발급/로테이션/무효화 서비스
 *
 * - DB에는 refresh raw를 저장하지 않고 sha256(token_hash)만 저장한다.
 * - rotate 시 old는 used로 표시하고, 같은 rememberMe 정책으로 새 refresh를 발급한다.
 * - used 토큰이 다시 제출되면 탈취 신호로 보고 그 유저의 살아있는 토큰을 전부 무효화한다.
 *
 * 판정 순서 (rotate):
 *   빈 값 → TOKEN_MISSING
 *   해시 미존재 → TOKEN_NOT_FOUND
 *   만료 → TOKEN_EXPIRED (used/invalidated 여부보다 먼저)
 *   invalidated → TOKEN_INVALIDATED
 *   used → TOKEN_REUSED (+ 전체 무효화, 감사 로그, 캐시 evict)
 *
 * 동시성:
 * - old row를 SELECT ... FOR UPDATE(PESSIMISTIC_WRITE)로 잠근다.
 *   같은 토큰을 동시에 제출하면 하나만 성공하고 나머지는 커밋된 used를 보고 재사용으로 판정된다.
 * - 실패도 예외가 아닌 Result로 돌려준다. 재사용 탐지의 전체 무효화가 롤백되면 안 되기 때문이다.
 *
 * rememberMe 정책
 * - rememberMe=true → persistentTtlSeconds
 * - rememberMe=false → sessionTtlSeconds
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RefreshTokenService {

    private final RefreshTokenRepository refreshTokenRepository;
    private final UserRepository userRepository;

    private final JwtService jwtService;
    private final TokenGenerator tokenGenerator;
    private final AuditSink auditSink;
    private final UserCacheInvalidator cacheInvalidator;

    private final AuthProperties props;
    private final Clock clock;

    /** 로그인 성공 직후: access + refresh 새 쌍 발급 */
    @Transactional
    public TokenPair issuePair(User user, boolean rememberMe) {
        if (user == null || user.getId() == null) throw new IllegalArgumentException("user must be persisted");

        Issued refresh = issue(user.getId(), rememberMe);
        String accessToken = jwtService.issueAccessToken(user);
        return new TokenPair(accessToken, jwtService.accessTtlSeconds(), refresh.raw(), refresh.expiresAt(), rememberMe);
    }

    // 리프레쉬 토큰 발급 (row 1개 insert)
    @Transactional
    public Issued issue(Long userId, boolean rememberMe) {
        if (userId == null) throw new IllegalArgumentException("userId must not be null");

        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime expiresAt = now.plusSeconds(resolveTtlSeconds(rememberMe));

        String raw = tokenGenerator.newRefreshToken();
        String hash = TokenHashUtils.sha256Hex(raw);

        refreshTokenRepository.save(RefreshToken.issue(userId, hash, rememberMe, now, expiresAt));

        return new Issued(raw, expiresAt, rememberMe); // 원문은 응답으로 한 번만 나간다.
    }

    // 리프레쉬 토큰 로테이션
    @Transactional
    public Result<TokenPair> rotate(String oldRefreshRaw) {
        if (oldRefreshRaw == null || oldRefreshRaw.isBlank()) {
            return Result.failure(ErrorCode.TOKEN_MISSING);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        String hash = TokenHashUtils.sha256Hex(oldRefreshRaw.trim());

        Optional<RefreshToken> found = refreshTokenRepository.findByTokenHashForUpdate(hash);
        if (found.isEmpty()) {
            return Result.failure(ErrorCode.TOKEN_NOT_FOUND);
        }
        RefreshToken old = found.get();

        if (old.isExpired(now)) {
            return Result.failure(ErrorCode.TOKEN_EXPIRED);
        }
        if (old.isInvalidated()) {
            return Result.failure(ErrorCode.TOKEN_INVALIDATED);
        }
        if (old.isUsed()) {
            return handleReuse(old, now);
        }

        // 유저가 사라졌으면 미발급 토큰과 구분하지 않는다.
        Optional<User> user = userRepository.findById(old.getUserId());
        if (user.isEmpty()) {
            return Result.failure(ErrorCode.TOKEN_NOT_FOUND);
        }

        old.markUsed(now);
        return Result.success(issuePair(user.get(), old.isRememberMe()));
    }

    /**
     * 로그아웃: 제출된 토큰 하나만 무효화 (멱등)
     * @return 무효화 대상 토큰의 userId (없으면 empty)
     */
    @Transactional
    public Optional<Long> invalidateIfPresent(String refreshRaw, RefreshInvalidateReason reason) {
        if (refreshRaw == null || refreshRaw.isBlank()) return Optional.empty();

        String hash = TokenHashUtils.sha256Hex(refreshRaw.trim());
        LocalDateTime now = LocalDateTime.now(clock);

        return refreshTokenRepository.findByTokenHashForUpdate(hash)
                .map(token -> {
                    token.invalidate(now, reason);
                    return token.getUserId();
                });
    }

    /** 유저의 살아있는 refresh 전부 무효화 (비밀번호 변경, 전체 세션 폐기, 재사용 탐지) */
    @Transactional
    public int invalidateAllForUser(Long userId, RefreshInvalidateReason reason) {
        if (userId == null) throw new IllegalArgumentException("userId must not be null");
        return refreshTokenRepository.invalidateActiveByUserId(userId, LocalDateTime.now(clock), reason);
    }

    private Result<TokenPair> handleReuse(RefreshToken reused, LocalDateTime now) {
        Long userId = reused.getUserId();
        int revoked = refreshTokenRepository.invalidateActiveByUserId(userId, now, RefreshInvalidateReason.REUSE_DETECTED);

        log.warn("refresh token 재사용 탐지: userId={}, tokenId={}, invalidated={}", userId, reused.getId(), revoked);
        auditSink.record(AuditAction.REFRESH_TOKEN_REUSED, userId, "tokenId=" + reused.getId() + " invalidated=" + revoked);
        cacheInvalidator.evict(userId);

        return Result.failure(ErrorCode.TOKEN_REUSED);
    }

    private long resolveTtlSeconds(boolean rememberMe) {
        return rememberMe
                ? props.refresh().persistentTtlSeconds()
                : props.refresh().sessionTtlSeconds();
    }

    public record Issued(String raw, LocalDateTime expiresAt, boolean rememberMe) {}
}
