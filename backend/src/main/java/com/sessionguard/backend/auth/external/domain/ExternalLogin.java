package com.sessionguard.backend.auth.external.domain;

import java.time.LocalDateTime;
import java.util.Objects;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/** (provider, providerKey) → 로컬 사용자 연결 */
@Getter
@Entity
@Table(name = "external_logins", uniqueConstraints = {
        @UniqueConstraint(name = "uq_external_logins_provider_key", columnNames = {"provider", "provider_key"})
})
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ExternalLogin {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(nullable = false, length = 50)
    private String provider;

    @Column(name = "provider_key", nullable = false, length = 255)
    private String providerKey;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public static ExternalLogin link(Long userId, String provider, String providerKey, LocalDateTime now) {
        ExternalLogin l = new ExternalLogin();
        l.userId = Objects.requireNonNull(userId, "userId must not be null");
        l.provider = Objects.requireNonNull(provider, "provider must not be null");
        l.providerKey = Objects.requireNonNull(providerKey, "providerKey must not be null");
        l.createdAt = Objects.requireNonNull(now, "now must not be null");
        return l;
    }
}
