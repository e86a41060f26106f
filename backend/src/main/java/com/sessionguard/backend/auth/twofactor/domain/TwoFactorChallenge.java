package com.sessionguard.backend.auth.twofactor.domain;

import java.time.LocalDateTime;
import java.util.Objects;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * two_factor_challenges 테이블 매핑 엔티티
 *
 * 비밀번호 확인(성공) → 2차 코드 입력 사이를 잇는 짧은 수명의 1회용 증표.
 *
 * 상태:
 *   Created -> Verified (used=true, 토큰 발급)
 *   Created -> FailedAttempt (failedAttempts++) -> ... -> Locked (failedAttempts >= max, 영구)
 *   Created -> Expired (시간으로 판단)
 *
 * - 원문은 저장하지 않는다. (token_hash = sha256)
 * - rememberMe는 비밀번호 단계의 선택을 그대로 들고 간다.
 * - failedAttempts / used 변경은 엔티티 setter가 아니라 repository의 조건부 update로만 한다.
 */
@Getter
@Entity
@Table(
    name = "two_factor_challenges",
    indexes = {
        @Index(name = "idx_two_factor_challenge_hash", columnList = "token_hash", unique = true),
        @Index(name = "idx_two_factor_challenge_user_id", columnList = "user_id")
    }
)
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class TwoFactorChallenge {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "token_hash", nullable = false, length = 64, columnDefinition = "char(64)")
    private String tokenHash;

    @Column(name = "remember_me", nullable = false)
    private boolean rememberMe;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "expires_at", nullable = false)
    private LocalDateTime expiresAt;

    @Column(name = "used", nullable = false)
    private boolean used;

    @Column(name = "failed_attempts", nullable = false)
    private int failedAttempts;

    public static TwoFactorChallenge issue(Long userId, String tokenHash, boolean rememberMe,
                                           LocalDateTime now, LocalDateTime expiresAt) {
        Objects.requireNonNull(userId, "userId must not be null");
        Objects.requireNonNull(tokenHash, "tokenHash must not be null");
        Objects.requireNonNull(now, "now must not be null");
        if (expiresAt == null || !expiresAt.isAfter(now)) {
            throw new IllegalArgumentException("expiresAt must be after now");
        }

        TwoFactorChallenge c = new TwoFactorChallenge();
        c.userId = userId;
        c.tokenHash = tokenHash;
        c.rememberMe = rememberMe;
        c.createdAt = now;
        c.expiresAt = expiresAt;
        c.used = false;
        c.failedAttempts = 0;
        return c;
    }

    public boolean isExpired(LocalDateTime now) {
        return !expiresAt.isAfter(now);
    }

    public boolean isLocked(int maxFailedAttempts) {
        return failedAttempts >= maxFailedAttempts;
    }
}
