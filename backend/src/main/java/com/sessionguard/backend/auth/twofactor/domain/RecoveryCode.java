package com.sessionguard.backend.auth.twofactor.domain;

import java.time.LocalDateTime;
import java.util.Objects;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 2FA 복구 코드 (1회용). 원문은 발급 응답으로 한 번만 나가고 해시만 저장한다.
 */
@Getter
@Entity
@Table(name = "two_factor_recovery_codes")
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class RecoveryCode {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "code_hash", nullable = false, length = 64, columnDefinition = "char(64)")
    private String codeHash;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "used_at")
    private LocalDateTime usedAt;

    public static RecoveryCode of(Long userId, String codeHash, LocalDateTime now) {
        RecoveryCode rc = new RecoveryCode();
        rc.userId = Objects.requireNonNull(userId, "userId must not be null");
        rc.codeHash = Objects.requireNonNull(codeHash, "codeHash must not be null");
        rc.createdAt = Objects.requireNonNull(now, "now must not be null");
        return rc;
    }

    public boolean isUsed() {
        return usedAt != null;
    }
}
