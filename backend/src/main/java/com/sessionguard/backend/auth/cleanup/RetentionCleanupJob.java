package com.sessionguard.backend.auth.cleanup;

import java.time.Clock;
import java.time.LocalDateTime;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import com.sessionguard.backend.auth.config.AuthProperties;
import com.sessionguard.backend.auth.external.repo.ExternalAuthStateRepository;
import com.sessionguard.backend.auth.token.repo.RefreshTokenRepository;
import com.sessionguard.backend.auth.twofactor.repo.TwoFactorChallengeRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 만료/사용된 행 정리
 *
 * - refresh: 만료된 지 graceSeconds 지난 행
 *   (만료 전의 사용된 행은 재사용 탐지 근거라 남긴다)
 * - 2FA 챌린지: 사용된 행, 또는 만료된 지 graceSeconds 지난 행
 * - 외부 로그인 state: 사용되었거나 만료된 행
 *
 * cron "-" 이면 스케줄 비활성 (테스트)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RetentionCleanupJob {

    private final RefreshTokenRepository refreshTokenRepository;
    private final TwoFactorChallengeRepository challengeRepository;
    private final ExternalAuthStateRepository stateRepository;
    private final TransactionTemplate transactionTemplate;
    private final AuthProperties props;
    private final Clock clock;

    @Scheduled(cron = "${app.auth.cleanup.cron}")
    public void run() {
        try {
            // 같은 빈 안의 호출이라 @Transactional 프록시를 타지 않는다.
            CleanupResult result = transactionTemplate.execute(status -> purge());
            log.info("[CLEANUP] refreshTokens={}, challenges={}, externalStates={}",
                    result.refreshTokens(), result.challenges(), result.externalStates());
        } catch (RuntimeException e) {
            // 다음 주기에 다시 시도한다.
            log.error("[CLEANUP] 정리 작업 실패", e);
        }
    }

    @Transactional
    public CleanupResult purge() {
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime threshold = now.minusSeconds(props.cleanup().graceSeconds());

        int refreshTokens = refreshTokenRepository.deleteExpiredBefore(threshold);
        int challenges = challengeRepository.deleteFinished(threshold);
        int externalStates = stateRepository.deleteFinished(now);

        return new CleanupResult(refreshTokens, challenges, externalStates);
    }

    public record CleanupResult(int refreshTokens, int challenges, int externalStates) {}
}
