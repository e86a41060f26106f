package com.sessionguard.backend.auth.identity.credential;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;

import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import com.sessionguard.backend.auth.config.AuthProperties;
import com.sessionguard.backend.auth.domain.User;

import lombok.RequiredArgsConstructor;

/**
 * 자격 증명 확인 + 계정 잠금 (identity store 쪽 협력자)
 *
 * - 비밀번호 비교는 PasswordEncoder(BCrypt)에 위임한다. (상수 시간 비교)
 * - 잠금 상태 변경은 호출자의 트랜잭션 안에서 dirty checking으로 반영된다.
 *   동시 시도 직렬화는 호출자가 users row를 FOR UPDATE로 잡은 상태를 전제로 한다.
 */
@Service
@RequiredArgsConstructor
public class UserCredentialService {

    private final PasswordEncoder passwordEncoder;
    private final AuthProperties props;
    private final Clock clock;

    public boolean checkPassword(User user, String rawPassword) {
        if (user == null || rawPassword == null || rawPassword.isEmpty()) return false;
        return passwordEncoder.matches(rawPassword, user.getPasswordHash());
    }

    public boolean isLockedOut(User user) {
        return user.isLockedOut(LocalDateTime.now(clock));
    }

    /** @return 이번 실패로 잠겼으면 true */
    public boolean recordFailure(User user) {
        AuthProperties.Lockout lockout = props.lockout();
        return user.recordFailedLogin(LocalDateTime.now(clock), lockout.maxFailedAttempts(), lockout.lockoutSeconds());
    }

    public void recordSuccess(User user) {
        user.recordSuccessfulLogin(LocalDateTime.now(clock));
    }

    public String hashPassword(String rawPassword) {
        return passwordEncoder.encode(rawPassword);
    }

    /** 남은 잠금 시간(초). Retry-After 헤더용 */
    public long remainingLockoutSeconds(User user) {
        LocalDateTime end = user.getLockoutEndAt();
        if (end == null) return 0;
        return Math.max(0, Duration.between(LocalDateTime.now(clock), end).getSeconds());
    }
}
