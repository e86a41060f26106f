package com.sessionguard.backend.auth.token.domain;

import java.time.LocalDateTime;
import java.util.Objects;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * refresh_tokens 테이블 매핑 엔티티 (서버가 관리하는 로그인 세션)
 *
 * - Access Token(JWT)은 서버에 저장하지 않음(Stateless)
 * - Refresh Token은 서버가 DB로 상태 관리 (append-only: 로테이션마다 새 row)
 *
 * 상태:
 *   Active -> Used (로테이션 1회) -> 다시 제출되면 재사용 탐지
 *   Active -> Invalidated (로그아웃/비밀번호 변경/재사용 탐지/전체 세션 폐기)
 *   Active -> Expired (저장되는 전이가 아니라 시간으로 판단)
 *
 * 불변 조건:
 * 1) refresh raw(원문)은 DB에 절대 저장하지 않는다. (token_hash만 저장)
 * 2) 사용 가능 <=> !used && !invalidated && now < expiresAt
 * 3) used 는 정확히 한 번만 true가 된다. 이후 제출은 탈취 신호다.
 * 4) 동기 삭제 없음. 정리는 별도 보존 스윕이 한다.
 */
@Getter
@Entity
@Table(
    name = "refresh_tokens",
    indexes = {
        @Index(name = "idx_refresh_token_hash", columnList = "token_hash", unique = true),
        @Index(name = "idx_refresh_user_id", columnList = "user_id")
    }
)
@NoArgsConstructor(access=AccessLevel.PROTECTED) // JPA가 리플렉션으로 객체 생성
public class RefreshToken {

    public static final int TOKEN_HASH_LEN = 64;      // sha256 hex

    private static final String HEX64_REGEX = "^[0-9a-f]{64}$";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "token_hash", nullable = false, length = TOKEN_HASH_LEN, columnDefinition = "char(64)")
    private String tokenHash;

    @Column(name = "remember_me", nullable = false)
    private boolean rememberMe;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "expires_at", nullable = false)
    private LocalDateTime expiresAt;

    @Column(name = "used", nullable = false)
    private boolean used;

    @Column(name = "used_at")
    private LocalDateTime usedAt;

    @Column(name = "invalidated", nullable = false)
    private boolean invalidated;

    @Column(name = "invalidated_at")
    private LocalDateTime invalidatedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "invalidate_reason", length = 50)
    private RefreshInvalidateReason invalidateReason;


    // ========= factory =========

    public static RefreshToken issue(
            Long userId,
            String tokenHash,
            boolean rememberMe,
            LocalDateTime now,
            LocalDateTime expiresAt
    ) {
        require(userId != null, "userId must not be null");
        require(now != null, "now must not be null");
        require(expiresAt != null, "expiresAt must not be null");
        require(expiresAt.isAfter(now), "expiresAt must be after now");

        RefreshToken rt = new RefreshToken();
        rt.userId = userId;
        rt.tokenHash = requireTokenHash(tokenHash);
        rt.rememberMe = rememberMe;
        rt.createdAt = now;
        rt.expiresAt = expiresAt;
        rt.used = false;
        rt.invalidated = false;
        return rt;
    }

    /**
     * 로테이션으로 소비. 정확히 한 번만 가능하다.
     * (동시 소비는 repository의 SELECT ... FOR UPDATE로 직렬화한다.)
     */
    public void markUsed(LocalDateTime now) {
        Objects.requireNonNull(now, "now must not be null");
        if (used) {
            throw new IllegalStateException("refresh token already used: id=" + id);
        }
        this.used = true;
        this.usedAt = now;
    }

    /** invalidate: 멱등. 이미 무효면 최초 사유를 유지한다. */
    public void invalidate(LocalDateTime now, RefreshInvalidateReason reason) {
        Objects.requireNonNull(now, "now must not be null");
        Objects.requireNonNull(reason, "reason must not be null");

        if (invalidated) return;
        this.invalidated = true;
        this.invalidatedAt = now;
        this.invalidateReason = reason;
    }


    // ========= domain =========

    public boolean isExpired(LocalDateTime now) {
        Objects.requireNonNull(now, "now must not be null");
        return !expiresAt.isAfter(now);
    }

    public boolean isRedeemable(LocalDateTime now) {
        return !used && !invalidated && !isExpired(now);
    }


    // ========= helpers =========
    private static String requireTokenHash(String tokenHash) {
        require(tokenHash != null, "tokenHash must not be null");
        String h = tokenHash.trim();
        require(h.length() == TOKEN_HASH_LEN, "tokenHash must be 64 chars");
        require(h.matches(HEX64_REGEX), "tokenHash must be lowercase hex(64)");
        return h;
    }

    private static void require(boolean cond, String msg) {
        if (!cond) throw new IllegalArgumentException(msg);
    }
}
