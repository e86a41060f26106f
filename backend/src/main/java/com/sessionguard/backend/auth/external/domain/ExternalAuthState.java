package com.sessionguard.backend.auth.external.domain;

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
 * 외부 로그인 state (CSRF 방지, 1회용)
 *
 * - authorize 시점의 provider와 redirectUri를 서버가 들고 있다가 callback에서 그대로 쓴다.
 *   callback 요청의 값은 믿지 않는다.
 * - userId가 있으면 로그인된 사용자의 연결(link) 요청이다. callback은 로그인 대신 그 사용자에 연결만 한다.
 */
@Getter
@Entity
@Table(
    name = "external_auth_states",
    indexes = @Index(name = "idx_external_state_hash", columnList = "state_hash", unique = true)
)
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ExternalAuthState {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "state_hash", nullable = false, length = 64, columnDefinition = "char(64)")
    private String stateHash;

    @Column(nullable = false, length = 50)
    private String provider;

    @Column(name = "redirect_uri", nullable = false, length = 2048)
    private String redirectUri;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "expires_at", nullable = false)
    private LocalDateTime expiresAt;

    @Column(nullable = false)
    private boolean used;

    @Column(name = "user_id")
    private Long userId;

    public static ExternalAuthState create(String stateHash, String provider, String redirectUri,
                                           LocalDateTime now, LocalDateTime expiresAt) {
        ExternalAuthState s = new ExternalAuthState();
        s.stateHash = Objects.requireNonNull(stateHash, "stateHash must not be null");
        s.provider = Objects.requireNonNull(provider, "provider must not be null");
        s.redirectUri = Objects.requireNonNull(redirectUri, "redirectUri must not be null");
        s.createdAt = Objects.requireNonNull(now, "now must not be null");
        s.expiresAt = Objects.requireNonNull(expiresAt, "expiresAt must not be null");
        s.used = false;
        return s;
    }

    public static ExternalAuthState createForLink(String stateHash, String provider, String redirectUri, Long userId,
                                                  LocalDateTime now, LocalDateTime expiresAt) {
        ExternalAuthState s = create(stateHash, provider, redirectUri, now, expiresAt);
        s.userId = Objects.requireNonNull(userId, "userId must not be null");
        return s;
    }

    public boolean isExpired(LocalDateTime now) {
        return !expiresAt.isAfter(now);
    }
}
