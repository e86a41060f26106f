package com.sessionguard.backend.auth.twofactor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.web.servlet.MockMvc;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.sessionguard.backend.auth.AbstractAuthIntegrationTest;
import com.sessionguard.backend.auth.domain.User;
import com.sessionguard.backend.auth.support.AuthFlowSupport;
import com.sessionguard.backend.auth.support.AuthHttpSupport;
import com.sessionguard.backend.auth.token.support.TokenHashUtils;
import com.sessionguard.backend.auth.twofactor.domain.TwoFactorChallenge;
import com.sessionguard.backend.auth.twofactor.service.IssuedChallenge;
import com.sessionguard.backend.auth.twofactor.service.RecoveryCodeService;
import com.sessionguard.backend.auth.twofactor.service.TwoFactorChallengeService;
import com.sessionguard.backend.auth.twofactor.service.VerifiedChallenge;
import com.sessionguard.backend.global.ErrorCode;
import com.sessionguard.backend.global.Result;
import com.sessionguard.backend.infra.TestClockConfig;

/**
 * 2FA 로그인 2단계 통합 테스트
 *
 * - 비밀번호만으로는 토큰이 나오지 않는다. (챌린지만)
 * - 챌린지는 1회용, TTL, 실패 횟수 잠금
 * - 복구 코드는 코드마다 1회용
 */
@DisplayName("[Auth][2FA] 2단계 로그인(/auth/2fa/verify, /auth/2fa/recovery) 통합 테스트")
class TwoFactorLoginTest extends AbstractAuthIntegrationTest {

    @Autowired MockMvc mvc;
    @Autowired RecoveryCodeService recoveryCodeService;
    @Autowired TwoFactorChallengeService challengeService;

    private User user;
    private String secret;

    @BeforeEach
    void setUp() {
        user = createDefaultUser();
        secret = enableTwoFactor(user);
    }

    @Test
    @DisplayName("비밀번호 OK → 챌린지만 발급, 토큰/쿠키/refresh row 없음")
    void password_step_returns_challenge_only() throws Exception {
        AuthFlowSupport.loginExpectingChallenge(mvc, EMAIL, PASSWORD);

        assertThat(refreshTokenRepository.findAllByUserId(user.getId())).isEmpty();
        assertThat(challengeRepository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("챌린지 + 올바른 TOTP → 토큰 쌍 발급, 그 access로 /auth/me 성공")
    void verify_with_correct_code_issues_tokens() throws Exception {
        String challenge = AuthFlowSupport.loginExpectingChallenge(mvc, EMAIL, PASSWORD);

        var res = AuthHttpSupport.performTwoFactorVerify(mvc, challenge, currentTotp(secret))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.accessToken").isNotEmpty())
                .andExpect(jsonPath("$.refreshToken").isNotEmpty())
                .andReturn();

        String access = AuthHttpSupport.readJson(res).path("accessToken").asText();
        AuthHttpSupport.performMe(mvc, AuthHttpSupport.bearer(access))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.twoFactorEnabled").value(true));
    }

    @Test
    @DisplayName("챌린지는 1회용: 성공 후 같은 챌린지 재사용 → CHALLENGE_NOT_FOUND")
    void challenge_is_single_use() throws Exception {
        String challenge = AuthFlowSupport.loginExpectingChallenge(mvc, EMAIL, PASSWORD);
        AuthHttpSupport.performTwoFactorVerify(mvc, challenge, currentTotp(secret)).andExpect(status().isOk());

        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performTwoFactorVerify(mvc, challenge, currentTotp(secret)),
                ErrorCode.CHALLENGE_NOT_FOUND
        );
    }

    @Test
    @DisplayName("틀린 코드 → INVALID_CODE, 최대 횟수 후에는 올바른 코드도 CHALLENGE_LOCKED")
    void challenge_locks_after_max_failures() throws Exception {
        String challenge = AuthFlowSupport.loginExpectingChallenge(mvc, EMAIL, PASSWORD);
        String wrong = wrongCode(currentTotp(secret));

        for (int i = 0; i < 5; i++) {
            AuthHttpSupport.expectErrorWithCode(
                    AuthHttpSupport.performTwoFactorVerify(mvc, challenge, wrong),
                    ErrorCode.INVALID_CODE
            );
        }

        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performTwoFactorVerify(mvc, challenge, currentTotp(secret)),
                ErrorCode.CHALLENGE_LOCKED
        );
        assertThat(refreshTokenRepository.findAllByUserId(user.getId())).isEmpty();

        // 잠금은 챌린지 단위: 새로 로그인하면 새 챌린지로 통과
        String fresh = AuthFlowSupport.loginExpectingChallenge(mvc, EMAIL, PASSWORD);
        AuthHttpSupport.performTwoFactorVerify(mvc, fresh, currentTotp(secret)).andExpect(status().isOk());
    }

    @Test
    @DisplayName("동시에 틀린 코드를 쏟아부어도 실패 카운트는 최대치에서 멈추고 챌린지는 잠긴다")
    void parallel_wrong_codes_cannot_exceed_attempt_limit() throws Exception {
        IssuedChallenge issued = challengeService.issue(user.getId(), false);
        String wrong = wrongCode(currentTotp(secret));

        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Result<VerifiedChallenge>>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return challengeService.verify(issued.challengeToken(), wrong);
                }));
            }
            start.countDown();

            List<ErrorCode> errors = new ArrayList<>();
            for (Future<Result<VerifiedChallenge>> f : futures) {
                errors.add(f.get(30, TimeUnit.SECONDS).error());
            }

            assertThat(errors).filteredOn(e -> e == ErrorCode.INVALID_CODE).hasSize(5);
            assertThat(errors).filteredOn(e -> e == ErrorCode.CHALLENGE_LOCKED).hasSize(threads - 5);
        } finally {
            pool.shutdownNow();
        }

        TwoFactorChallenge row = challengeRepository.findAll().get(0);
        assertThat(row.getFailedAttempts()).isEqualTo(5);
        assertThat(challengeService.verify(issued.challengeToken(), currentTotp(secret)).error())
                .isEqualTo(ErrorCode.CHALLENGE_LOCKED);
    }

    @Test
    @DisplayName("TTL 경과 → CHALLENGE_EXPIRED")
    void expired_challenge_is_rejected() throws Exception {
        String challenge = AuthFlowSupport.loginExpectingChallenge(mvc, EMAIL, PASSWORD);

        TestClockConfig.TEST_CLOCK.advance(Duration.ofSeconds(301));

        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performTwoFactorVerify(mvc, challenge, currentTotp(secret)),
                ErrorCode.CHALLENGE_EXPIRED
        );
    }

    @Test
    @DisplayName("모르는 챌린지 토큰 → CHALLENGE_NOT_FOUND")
    void unknown_challenge_is_rejected() throws Exception {
        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performTwoFactorVerify(mvc, "not-issued-challenge", currentTotp(secret)),
                ErrorCode.CHALLENGE_NOT_FOUND
        );
    }

    @Test
    @DisplayName("복구 코드 로그인 성공 → 같은 코드는 다음 챌린지에서 INVALID_CODE")
    void recovery_code_is_single_use() throws Exception {
        List<String> codes = recoveryCodeService.regenerate(user.getId());
        String code = codes.get(0);

        String first = AuthFlowSupport.loginExpectingChallenge(mvc, EMAIL, PASSWORD);
        AuthHttpSupport.performRecoveryLogin(mvc, first, code)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.accessToken").isNotEmpty());

        assertThat(recoveryCodeService.remaining(user.getId())).isEqualTo(codes.size() - 1);

        String second = AuthFlowSupport.loginExpectingChallenge(mvc, EMAIL, PASSWORD);
        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performRecoveryLogin(mvc, second, code),
                ErrorCode.INVALID_CODE
        );

        // 입력 형식(소문자/하이픈 없음)은 무시된다.
        String loose = codes.get(1).replace("-", "").toLowerCase();
        AuthHttpSupport.performRecoveryLogin(mvc, second, loose).andExpect(status().isOk());
    }

    @Test
    @DisplayName("같은 복구 코드를 두 챌린지가 동시에 쓰면 하나만 통과하고 진 쪽 챌린지는 살아 있다")
    void racing_recovery_code_leaves_losing_challenge_usable() throws Exception {
        String code = recoveryCodeService.regenerate(user.getId()).get(0);
        IssuedChallenge first = challengeService.issue(user.getId(), false);
        IssuedChallenge second = challengeService.issue(user.getId(), false);

        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Result<VerifiedChallenge>>> futures = new ArrayList<>();
            for (IssuedChallenge issued : List.of(first, second)) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return challengeService.verifyRecoveryCode(issued.challengeToken(), code);
                }));
            }
            start.countDown();

            List<Result<VerifiedChallenge>> results = new ArrayList<>();
            for (Future<Result<VerifiedChallenge>> f : futures) {
                results.add(f.get(30, TimeUnit.SECONDS));
            }
            assertThat(results).filteredOn(Result::isSuccess).hasSize(1);
            assertThat(results).filteredOn(Result::isFailure)
                    .singleElement()
                    .extracting(Result::error)
                    .isEqualTo(ErrorCode.INVALID_CODE);
        } finally {
            pool.shutdownNow();
        }

        assertThat(recoveryCodeService.remaining(user.getId())).isEqualTo(9);
        List<TwoFactorChallenge> open = challengeRepository.findAll().stream()
                .filter(c -> !c.isUsed())
                .toList();
        assertThat(open).singleElement()
                .extracting(TwoFactorChallenge::getFailedAttempts)
                .isEqualTo(1);

        // 진 쪽 챌린지는 TOTP로 마저 끝낼 수 있다
        String loser = open.get(0).getId().equals(challengeIdOf(first)) ? first.challengeToken() : second.challengeToken();
        assertThat(challengeService.verify(loser, currentTotp(secret)).isSuccess()).isTrue();
    }

    private Long challengeIdOf(IssuedChallenge issued) {
        return challengeRepository.findByTokenHash(TokenHashUtils.sha256Hex(issued.challengeToken()))
                .orElseThrow()
                .getId();
    }

    private static String wrongCode(String correct) {
        int n = (Integer.parseInt(correct) + 500_000) % 1_000_000;
        return String.format("%06d", n);
    }
}
