package com.sessionguard.backend.auth.twofactor;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.ResultActions;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.JsonNode;
import com.sessionguard.backend.auth.AbstractAuthIntegrationTest;
import com.sessionguard.backend.auth.domain.User;
import com.sessionguard.backend.auth.support.AuthFlowSupport;
import com.sessionguard.backend.auth.support.AuthHttpSupport;
import com.sessionguard.backend.auth.twofactor.service.RecoveryCodeService;
import com.sessionguard.backend.global.ErrorCode;

@DisplayName("[Auth][2FA] 2단계 인증 설정(/auth/2fa/setup ...) 통합 테스트")
class TwoFactorSetupTest extends AbstractAuthIntegrationTest {

    @Autowired MockMvc mvc;
    @Autowired RecoveryCodeService recoveryCodeService;

    private String access;

    @BeforeEach
    void setUp() throws Exception {
        createDefaultUser();
        access = AuthFlowSupport.bearerLoginOk(mvc, EMAIL, PASSWORD, false).accessToken();
    }

    @Test
    @DisplayName("setup → confirm: 복구 코드 발급 + 2FA 활성화, 기존 access는 stamp 변경으로 무효")
    void setup_and_confirm_enables_two_factor() throws Exception {
        String secret = beginSetup(access);

        MvcResult res = confirm(access, currentTotp(secret))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.recoveryCodes.length()").value(10))
                .andReturn();
        JsonNode codes = AuthHttpSupport.readJson(res).path("recoveryCodes");
        assertThat(codes.get(0).asText()).matches("[A-Z2-9]{5}-[A-Z2-9]{5}");

        User user = userRepository.findByEmail(EMAIL).orElseThrow();
        assertThat(user.isTwoFactorEnabled()).isTrue();
        assertThat(recoveryCodeRepository.countByUserIdAndUsedAtIsNull(user.getId())).isEqualTo(10);

        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performMe(mvc, AuthHttpSupport.bearer(access)),
                ErrorCode.ACCESS_INVALID
        );

        // 이후 로그인은 챌린지를 거친다.
        AuthFlowSupport.loginExpectingChallenge(mvc, EMAIL, PASSWORD);
    }

    @Test
    @DisplayName("confirm: 틀린 코드 → INVALID_CODE, 아직 비활성")
    void confirm_with_wrong_code_keeps_disabled() throws Exception {
        String secret = beginSetup(access);
        String correct = currentTotp(secret);
        String wrong = String.format("%06d", (Integer.parseInt(correct) + 500_000) % 1_000_000);

        AuthHttpSupport.expectErrorWithCode(confirm(access, wrong), ErrorCode.INVALID_CODE);
        assertThat(userRepository.findByEmail(EMAIL).orElseThrow().isTwoFactorEnabled()).isFalse();
    }

    @Test
    @DisplayName("confirm: setup 없이 → 400 VALIDATION_ERROR")
    void confirm_without_setup() throws Exception {
        AuthHttpSupport.expectErrorWithCode(confirm(access, "123456"), ErrorCode.VALIDATION_ERROR);
    }

    @Test
    @DisplayName("setup/confirm: 이미 켜진 계정 → 400, 등록된 시크릿과 복구 코드는 그대로")
    void setup_is_refused_while_enabled() throws Exception {
        User user = userRepository.findByEmail(EMAIL).orElseThrow();
        String enrolled = enableTwoFactor(user);
        List<String> codes = recoveryCodeService.regenerate(user.getId());
        String fresh = freshAccessAfterTwoFactor();

        AuthHttpSupport.expectErrorWithCode(
                mvc.perform(post("/auth/2fa/setup")
                        .header(HttpHeaders.AUTHORIZATION, AuthHttpSupport.bearer(fresh))),
                ErrorCode.VALIDATION_ERROR
        );
        AuthHttpSupport.expectErrorWithCode(confirm(fresh, currentTotp(enrolled)), ErrorCode.VALIDATION_ERROR);

        User reloaded = userRepository.findByEmail(EMAIL).orElseThrow();
        assertThat(reloaded.getTwoFactorSecret()).isEqualTo(enrolled);
        assertThat(reloaded.isTwoFactorEnabled()).isTrue();
        assertThat(recoveryCodeRepository.countByUserIdAndUsedAtIsNull(user.getId())).isEqualTo(codes.size());

        // 기존 인증 앱으로 계속 로그인된다
        String challenge = AuthFlowSupport.loginExpectingChallenge(mvc, EMAIL, PASSWORD);
        AuthHttpSupport.performTwoFactorVerify(mvc, challenge, currentTotp(enrolled)).andExpect(status().isOk());
    }

    @Test
    @DisplayName("disable: 비밀번호 틀림 → INVALID_CREDENTIALS / 맞음 → 204 + 복구 코드 삭제")
    void disable_requires_password() throws Exception {
        User user = userRepository.findByEmail(EMAIL).orElseThrow();
        enableTwoFactor(user);
        // stamp가 바뀌었으니 새 access가 필요하다. (2FA 유저라 로그인 대신 직접 발급)
        String fresh = freshAccessAfterTwoFactor();

        AuthHttpSupport.expectErrorWithCode(
                passwordAction(fresh, "/auth/2fa/disable", "wrong-password"),
                ErrorCode.INVALID_CREDENTIALS
        );

        passwordAction(fresh, "/auth/2fa/disable", PASSWORD).andExpect(status().isNoContent());

        User reloaded = userRepository.findByEmail(EMAIL).orElseThrow();
        assertThat(reloaded.isTwoFactorEnabled()).isFalse();
        assertThat(recoveryCodeRepository.countByUserIdAndUsedAtIsNull(reloaded.getId())).isZero();

        AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD, false);
    }

    @Test
    @DisplayName("recovery-codes: 재발급하면 이전 세트는 전부 폐기")
    void regenerate_recovery_codes_replaces_set() throws Exception {
        String secret = beginSetup(access);
        JsonNode first = AuthHttpSupport.readJson(confirm(access, currentTotp(secret)).andReturn()).path("recoveryCodes");

        String fresh = freshAccessAfterTwoFactor();
        MvcResult res = passwordAction(fresh, "/auth/2fa/recovery-codes", PASSWORD)
                .andExpect(status().isOk())
                .andReturn();
        JsonNode second = AuthHttpSupport.readJson(res).path("recoveryCodes");
        assertThat(second.size()).isEqualTo(10);

        String challenge = AuthFlowSupport.loginExpectingChallenge(mvc, EMAIL, PASSWORD);
        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performRecoveryLogin(mvc, challenge, first.get(0).asText()),
                ErrorCode.INVALID_CODE
        );
        MvcResult recovered = AuthHttpSupport.performRecoveryLogin(mvc, challenge, second.get(0).asText())
                .andExpect(status().isOk())
                .andReturn();

        String recoveredAccess = AuthHttpSupport.readJson(recovered).path("accessToken").asText();
        AuthHttpSupport.performMe(mvc, AuthHttpSupport.bearer(recoveredAccess))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.twoFactorEnabled").value(true))
                .andExpect(jsonPath("$.recoveryCodesRemaining").value(9));
    }

    @Test
    @DisplayName("recovery-codes: 2FA 비활성 유저 → 400 VALIDATION_ERROR")
    void regenerate_requires_two_factor() throws Exception {
        AuthHttpSupport.expectErrorWithCode(
                passwordAction(access, "/auth/2fa/recovery-codes", PASSWORD),
                ErrorCode.VALIDATION_ERROR
        );
    }

    @Test
    @DisplayName("setup: 인증 없음 → 401 UNAUTHORIZED")
    void setup_requires_authentication() throws Exception {
        AuthHttpSupport.expectErrorWithCode(mvc.perform(post("/auth/2fa/setup")), ErrorCode.UNAUTHORIZED);
    }

    // =====================
    //    helpers
    // =====================

    private String beginSetup(String accessToken) throws Exception {
        MvcResult res = mvc.perform(post("/auth/2fa/setup")
                        .header(HttpHeaders.AUTHORIZATION, AuthHttpSupport.bearer(accessToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.authenticatorUri").value(org.hamcrest.Matchers.startsWith("otpauth://totp/")))
                .andReturn();
        String secret = AuthHttpSupport.readJson(res).path("sharedKey").asText();
        assertThat(secret).isNotBlank();
        return secret;
    }

    private ResultActions confirm(String accessToken, String code) throws Exception {
        return mvc.perform(post("/auth/2fa/setup/confirm")
                .header(HttpHeaders.AUTHORIZATION, AuthHttpSupport.bearer(accessToken))
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                        {"code":"%s"}
                        """.formatted(code)));
    }

    private ResultActions passwordAction(String accessToken, String path, String password) throws Exception {
        return mvc.perform(post(path)
                .header(HttpHeaders.AUTHORIZATION, AuthHttpSupport.bearer(accessToken))
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                        {"password":"%s"}
                        """.formatted(password)));
    }

    /** 2FA 켜진 상태의 access: 챌린지 → TOTP 로 받는다. */
    private String freshAccessAfterTwoFactor() throws Exception {
        User user = userRepository.findByEmail(EMAIL).orElseThrow();
        String challenge = AuthFlowSupport.loginExpectingChallenge(mvc, EMAIL, PASSWORD);
        MvcResult res = AuthHttpSupport.performTwoFactorVerify(mvc, challenge, currentTotp(user.getTwoFactorSecret()))
                .andExpect(status().isOk())
                .andReturn();
        return AuthHttpSupport.readJson(res).path("accessToken").asText();
    }
}
