package com.sessionguard.backend.auth.domain;

import java.time.LocalDateTime;
import java.util.Objects;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

/**
 * users 테이블 = Principal (세션 코어가 참조하는 외부 엔티티)
 *
 * 세션 코어가 읽는 것:
 * - id: JWT sub
 * - passwordHash: BCrypt 해시 (코어는 내용을 모른다. PasswordEncoder에 위임)
 * - hasPassword: 외부 로그인으로 만들어진 계정은 false (해시는 난수 비밀번호). set-password로만 true가 된다.
 * - securityStamp: 자격 증명/권한이 바뀔 때마다 새 값으로 교체된다.
 *      액세스 토큰에는 이 값의 해시가 실리고, 요청마다 현재 값과 비교한다.
 * - twoFactorEnabled / twoFactorSecret: TOTP 사용 여부와 Base32 시크릿
 * - failedLoginCount / lockoutEndAt: 비밀번호 연속 실패 잠금
 */
@Entity
@Table(name = "users", uniqueConstraints = {
        @UniqueConstraint(name = "uq_users_email", columnNames = "email")
})
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class User {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 255)
    private String email; // 로그인 ID (Unique, 소문자 정규화)

    @Column(name = "password_hash", nullable = false, length = 100)
    private String passwordHash;

    @Column(name = "has_password", nullable = false)
    private boolean hasPassword;

    @Column(nullable = false, length = 30)
    private String nickname;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private UserRole role;

    @Column(name = "security_stamp", nullable = false, length = 64)
    private String securityStamp;

    @Column(name = "failed_login_count", nullable = false)
    private int failedLoginCount;

    @Column(name = "lockout_end_at")
    private LocalDateTime lockoutEndAt;

    @Column(name = "two_factor_enabled", nullable = false)
    private boolean twoFactorEnabled;

    @Column(name = "two_factor_secret", length = 64)
    private String twoFactorSecret;

    @Column(name = "last_login_at")
    private LocalDateTime lastLoginAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public static User create(String email, String passwordHash, String nickname, LocalDateTime now) {
        Objects.requireNonNull(email, "email must not be null");
        Objects.requireNonNull(passwordHash, "passwordHash must not be null");
        Objects.requireNonNull(now, "now must not be null");

        User u = new User();
        u.email = email;
        u.passwordHash = passwordHash;
        u.hasPassword = true;
        u.nickname = nickname;

        // 기본 정책값
        u.role = UserRole.USER;
        u.securityStamp = newStamp();
        u.failedLoginCount = 0;
        u.twoFactorEnabled = false;
        u.createdAt = now;
        return u;
    }

    /** 외부 로그인 최초 가입: 사용할 수 없는 비밀번호 해시로 만든다. */
    public static User createWithoutPassword(String email, String unusablePasswordHash, String nickname, LocalDateTime now) {
        User u = create(email, unusablePasswordHash, nickname, now);
        u.hasPassword = false;
        return u;
    }

    // ========= lockout =========

    public boolean isLockedOut(LocalDateTime now) {
        return lockoutEndAt != null && lockoutEndAt.isAfter(now);
    }

    /**
     * 비밀번호 실패 기록. 임계치에 도달하면 잠그고 카운터를 0으로 되돌린다.
     * @return 이번 실패로 잠겼으면 true
     */
    public boolean recordFailedLogin(LocalDateTime now, int maxFailedAttempts, long lockoutSeconds) {
        this.failedLoginCount += 1;
        if (failedLoginCount >= maxFailedAttempts) {
            this.lockoutEndAt = now.plusSeconds(lockoutSeconds);
            this.failedLoginCount = 0;
            return true;
        }
        return false;
    }

    public void recordSuccessfulLogin(LocalDateTime now) {
        this.failedLoginCount = 0;
        this.lockoutEndAt = null;
        this.lastLoginAt = now;
    }

    // ========= credentials / security stamp =========

    public void changePasswordHash(String newPasswordHash) {
        this.passwordHash = Objects.requireNonNull(newPasswordHash, "newPasswordHash must not be null");
        rotateSecurityStamp();
    }

    /** 비밀번호가 없던 계정에 처음 비밀번호를 붙인다. */
    public void setInitialPassword(String passwordHash) {
        if (hasPassword) {
            throw new IllegalStateException("password is already set");
        }
        this.passwordHash = Objects.requireNonNull(passwordHash, "passwordHash must not be null");
        this.hasPassword = true;
        rotateSecurityStamp();
    }

    public void changeRole(UserRole newRole) {
        this.role = Objects.requireNonNull(newRole, "newRole must not be null");
        rotateSecurityStamp();
    }

    /** 발급된 액세스 토큰을 전부 무효화하는 효과 (스탬프 해시 불일치) */
    public void rotateSecurityStamp() {
        this.securityStamp = newStamp();
    }

    // ========= two-factor =========

    /** 설정 시작: 시크릿만 저장하고 아직 켜지 않는다. (확인 코드 검증 후 enable) */
    public void stageTwoFactorSecret(String base32Secret) {
        this.twoFactorSecret = Objects.requireNonNull(base32Secret, "base32Secret must not be null");
    }

    public void enableTwoFactor() {
        if (twoFactorSecret == null) {
            throw new IllegalStateException("two-factor secret is not staged");
        }
        this.twoFactorEnabled = true;
        rotateSecurityStamp();
    }

    public void disableTwoFactor() {
        this.twoFactorEnabled = false;
        this.twoFactorSecret = null;
        rotateSecurityStamp();
    }

    private static String newStamp() {
        return UUID.randomUUID().toString();
    }

    public Long getId() {return id;}
    public String getEmail() {return email;}
    public String getPasswordHash() {return passwordHash;}
    public boolean hasPassword() {return hasPassword;}
    public String getNickname() {return nickname;}
    public UserRole getRole() {return role;}
    public String getSecurityStamp() {return securityStamp;}
    public int getFailedLoginCount() {return failedLoginCount;}
    public LocalDateTime getLockoutEndAt() {return lockoutEndAt;}
    public boolean isTwoFactorEnabled() {return twoFactorEnabled;}
    public String getTwoFactorSecret() {return twoFactorSecret;}
    public LocalDateTime getLastLoginAt() {return lastLoginAt;}
}
