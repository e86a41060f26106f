package com.sessionguard.backend.auth.twofactor.service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.sessionguard.backend.auth.audit.AuditAction;
import com.sessionguard.backend.auth.audit.AuditSink;
import com.sessionguard.backend.auth.config.TwoFactorProperties;
import com.sessionguard.backend.auth.domain.User;
import com.sessionguard.backend.auth.repo.UserRepository;
import com.sessionguard.backend.auth.token.support.TokenGenerator;
import com.sessionguard.backend.auth.token.support.TokenHashUtils;
import com.sessionguard.backend.auth.twofactor.domain.RecoveryCode;
import com.sessionguard.backend.auth.twofactor.domain.TwoFactorChallenge;
import com.sessionguard.backend.auth.twofactor.repo.TwoFactorChallengeRepository;
import com.sessionguard.backend.auth.twofactor.support.TotpVerifier;
import com.sessionguard.backend.global.ErrorCode;
import com.sessionguard.backend.global.Result;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 2FA 챌린지 발급/검증
 *
 * 판정 순서 (verify / verifyRecoveryCode):
 *   미존재 또는 이미 사용됨 → CHALLENGE_NOT_FOUND
 *   만료 → CHALLENGE_EXPIRED
 *   failedAttempts >= max → CHALLENGE_LOCKED (코드가 맞아도)
 *   코드 불일치 → failedAttempts 원자적 증가 후 INVALID_CODE (증가 실패 = 이미 잠김)
 *   코드 일치 → 조건부 소비 후 VerifiedChallenge
 *
 * 실패도 Result로 돌려주므로 트랜잭션은 커밋된다. (실패 횟수 증가가 롤백되면 안 됨)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TwoFactorChallengeService {

    private final TwoFactorChallengeRepository challengeRepository;
    private final UserRepository userRepository;
    private final RecoveryCodeService recoveryCodeService;
    private final TotpVerifier totpVerifier;
    private final TokenGenerator tokenGenerator;
    private final AuditSink auditSink;
    private final TwoFactorProperties props;
    private final Clock clock;

    @Transactional
    public IssuedChallenge issue(Long userId, boolean rememberMe) {
        if (userId == null) throw new IllegalArgumentException("userId must not be null");

        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime expiresAt = now.plusSeconds(props.challengeTtlSeconds());

        String raw = tokenGenerator.newChallengeToken();
        challengeRepository.save(TwoFactorChallenge.issue(userId, TokenHashUtils.sha256Hex(raw), rememberMe, now, expiresAt));

        auditSink.record(AuditAction.TWO_FACTOR_CHALLENGE_ISSUED, userId);
        return new IssuedChallenge(raw, expiresAt);
    }

    /** TOTP 코드로 챌린지 완료 */
    @Transactional
    public Result<VerifiedChallenge> verify(String challengeToken, String code) {
        Result<Pending> pending = loadPending(challengeToken);
        if (pending.isFailure()) return pending.castFailure();

        TwoFactorChallenge challenge = pending.value().challenge();
        User user = pending.value().user();

        if (!totpVerifier.verify(user.getTwoFactorSecret(), code)) {
            return recordFailure(challenge);
        }
        Result<VerifiedChallenge> consumed = consume(challenge);
        if (consumed.isSuccess()) {
            auditSink.record(AuditAction.TWO_FACTOR_VERIFIED, user.getId());
        }
        return consumed;
    }

    /** 복구 코드로 챌린지 완료 (코드 1개 소비) */
    @Transactional
    public Result<VerifiedChallenge> verifyRecoveryCode(String challengeToken, String recoveryCode) {
        Result<Pending> pending = loadPending(challengeToken);
        if (pending.isFailure()) return pending.castFailure();

        TwoFactorChallenge challenge = pending.value().challenge();
        Long userId = challenge.getUserId();

        Optional<RecoveryCode> usable = recoveryCodeService.findUsable(userId, recoveryCode);
        if (usable.isEmpty()) {
            return recordFailure(challenge);
        }

        // 코드 먼저: 같은 코드를 동시에 낸 요청이 이기면 이 챌린지는 실패 1회로 남는다
        if (!recoveryCodeService.consume(usable.get())) {
            return recordFailure(challenge);
        }

        Result<VerifiedChallenge> consumed = consume(challenge);
        if (consumed.isFailure()) {
            recoveryCodeService.release(usable.get());
            return consumed;
        }
        auditSink.record(AuditAction.RECOVERY_CODE_USED, userId, "remaining=" + recoveryCodeService.remaining(userId));
        return consumed;
    }

    private Result<Pending> loadPending(String challengeToken) {
        if (challengeToken == null || challengeToken.isBlank()) {
            return Result.failure(ErrorCode.CHALLENGE_NOT_FOUND);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        Optional<TwoFactorChallenge> found = challengeRepository.findByTokenHash(TokenHashUtils.sha256Hex(challengeToken.trim()));
        if (found.isEmpty() || found.get().isUsed()) {
            return Result.failure(ErrorCode.CHALLENGE_NOT_FOUND);
        }

        TwoFactorChallenge challenge = found.get();
        if (challenge.isExpired(now)) {
            return Result.failure(ErrorCode.CHALLENGE_EXPIRED);
        }
        if (challenge.isLocked(props.maxFailedAttempts())) {
            return Result.failure(ErrorCode.CHALLENGE_LOCKED);
        }

        // 챌린지 발급 후 2FA가 꺼졌거나 유저가 사라졌으면 통과시키지 않는다.
        Optional<User> user = userRepository.findById(challenge.getUserId());
        if (user.isEmpty() || !user.get().isTwoFactorEnabled()) {
            return Result.failure(ErrorCode.CHALLENGE_NOT_FOUND);
        }
        return Result.success(new Pending(challenge, user.get()));
    }

    private Result<VerifiedChallenge> recordFailure(TwoFactorChallenge challenge) {
        Long userId = challenge.getUserId();
        int max = props.maxFailedAttempts();

        int updated = challengeRepository.incrementFailedAttempts(challenge.getId(), max);
        if (updated == 0) {
            // 병렬 시도가 먼저 임계치에 도달시켰다.
            return Result.failure(ErrorCode.CHALLENGE_LOCKED);
        }

        auditSink.record(AuditAction.TWO_FACTOR_FAILED, userId, "challengeId=" + challenge.getId());

        boolean nowLocked = challengeRepository.findById(challenge.getId())
                .map(c -> c.isLocked(max))
                .orElse(true);
        if (nowLocked) {
            log.info("2FA challenge locked: userId={}, challengeId={}", userId, challenge.getId());
            auditSink.record(AuditAction.TWO_FACTOR_LOCKED, userId, "challengeId=" + challenge.getId());
        }
        return Result.failure(ErrorCode.INVALID_CODE);
    }

    private Result<VerifiedChallenge> consume(TwoFactorChallenge challenge) {
        int updated = challengeRepository.consume(challenge.getId(), props.maxFailedAttempts());
        if (updated == 0) {
            boolean locked = challengeRepository.findById(challenge.getId())
                    .map(c -> !c.isUsed() && c.isLocked(props.maxFailedAttempts()))
                    .orElse(false);
            return Result.failure(locked ? ErrorCode.CHALLENGE_LOCKED : ErrorCode.CHALLENGE_NOT_FOUND);
        }

        return Result.success(new VerifiedChallenge(challenge.getUserId(), challenge.isRememberMe()));
    }

    private record Pending(TwoFactorChallenge challenge, User user) {}
}
