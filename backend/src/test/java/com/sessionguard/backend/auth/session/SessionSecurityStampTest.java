package com.sessionguard.backend.auth.session;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.transaction.support.TransactionTemplate;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.JsonNode;
import com.sessionguard.backend.auth.AbstractAuthIntegrationTest;
import com.sessionguard.backend.auth.cache.PrincipalSnapshot;
import com.sessionguard.backend.auth.cache.PrincipalSnapshotService;
import com.sessionguard.backend.auth.domain.User;
import com.sessionguard.backend.auth.domain.UserRole;
import com.sessionguard.backend.auth.session.service.SessionService;
import com.sessionguard.backend.auth.support.AuthFlowSupport;
import com.sessionguard.backend.auth.support.AuthHttpSupport;
import com.sessionguard.backend.auth.support.AuthHttpSupport.LoginResult;
import com.sessionguard.backend.auth.support.AuthHttpSupport.RefreshResult;
import com.sessionguard.backend.auth.token.domain.RefreshInvalidateReason;
import com.sessionguard.backend.global.ErrorCode;
import com.sessionguard.backend.security.JwtService;

import jakarta.servlet.http.Cookie;

/**
 * security stamp 전파 통합 테스트
 *
 * - 비밀번호 변경: 기존 access 즉시 무효 + 다른 세션 refresh 전부 무효 + 호출자만 새 쌍
 * - 전체 세션 폐기: access/refresh 전부 무효
 * - 권한 변경: access만 무효, refresh로 조용히 새 권한을 받는다 (soft refresh)
 */
@DisplayName("[Auth][Session] security stamp 변경 전파 통합 테스트")
class SessionSecurityStampTest extends AbstractAuthIntegrationTest {

    private static final String NEW_PASSWORD = "n3w-passw0rd!";

    @Autowired MockMvc mvc;
    @Autowired SessionService sessionService;
    @Autowired PrincipalSnapshotService snapshots;
    @Autowired TransactionTemplate transactionTemplate;

    @BeforeEach
    void setUp() {
        createDefaultUser();
    }

    @Test
    @DisplayName("비밀번호 변경 → 옛 access는 ACCESS_INVALID, 다른 기기 refresh는 TOKEN_INVALIDATED, 새 쌍은 동작")
    void password_change_ends_other_sessions() throws Exception {
        LoginResult current = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD, false);
        LoginResult otherDevice = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD, true);

        MvcResult res = AuthHttpSupport.performChangePassword(mvc, current.accessToken(), PASSWORD, NEW_PASSWORD)
                .andExpect(status().isOk())
                .andReturn();
        JsonNode json = AuthHttpSupport.readJson(res);
        String newAccess = json.path("accessToken").asText();
        String newRefresh = json.path("refreshToken").asText();

        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performMe(mvc, AuthHttpSupport.bearer(current.accessToken())),
                ErrorCode.ACCESS_INVALID
        );
        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performRefresh(mvc, new Cookie(AuthHttpSupport.REFRESH_COOKIE, otherDevice.refreshRaw())),
                ErrorCode.TOKEN_INVALIDATED
        );

        AuthHttpSupport.performMe(mvc, AuthHttpSupport.bearer(newAccess)).andExpect(status().isOk());
        AuthHttpSupport.performBodyRefresh(mvc, newRefresh).andExpect(status().isOk());

        // 새 비밀번호로만 로그인된다.
        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performLogin(mvc, EMAIL, PASSWORD, false),
                ErrorCode.INVALID_CREDENTIALS
        );
        AuthFlowSupport.loginOk(mvc, EMAIL, NEW_PASSWORD, false);
    }

    @Test
    @DisplayName("비밀번호 변경: 현재 비밀번호 틀림 → 401 INVALID_CREDENTIALS, 아무것도 바뀌지 않음")
    void password_change_with_wrong_current_password() throws Exception {
        LoginResult current = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD, false);

        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performChangePassword(mvc, current.accessToken(), "not-my-password", NEW_PASSWORD),
                ErrorCode.INVALID_CREDENTIALS
        );

        AuthHttpSupport.performMe(mvc, AuthHttpSupport.bearer(current.accessToken())).andExpect(status().isOk());
        AuthFlowSupport.refreshOk(mvc, current.refreshRaw());
    }

    @Test
    @DisplayName("비밀번호 변경: 새 비밀번호가 너무 짧음 → 400")
    void password_change_rejects_short_password() throws Exception {
        LoginResult current = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD, false);

        AuthHttpSupport.performChangePassword(mvc, current.accessToken(), PASSWORD, "short")
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("전체 세션 폐기 → 204, access/refresh 모두 무효 (사유 SESSIONS_REVOKED)")
    void revoke_all_sessions() throws Exception {
        LoginResult a = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD, false);
        LoginResult b = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD, true);

        AuthHttpSupport.performRevokeAll(mvc, a.accessToken()).andExpect(status().isNoContent());

        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performMe(mvc, AuthHttpSupport.bearer(a.accessToken())),
                ErrorCode.ACCESS_INVALID
        );
        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performRefresh(mvc, new Cookie(AuthHttpSupport.REFRESH_COOKIE, b.refreshRaw())),
                ErrorCode.TOKEN_INVALIDATED
        );

        User user = userRepository.findByEmail(EMAIL).orElseThrow();
        assertThat(refreshTokenRepository.findAllByUserId(user.getId()))
                .allMatch(t -> t.getInvalidateReason() == RefreshInvalidateReason.SESSIONS_REVOKED);
    }

    @Test
    @DisplayName("커밋 전에 끼어든 요청이 옛 stamp를 캐시에 올려도, 커밋 후 캐시는 새 stamp를 본다")
    void stamp_cache_is_evicted_after_commit() throws Exception {
        Long userId = userRepository.findByEmail(EMAIL).orElseThrow().getId();
        String oldHash = snapshots.load(userId).securityStampHash();

        ExecutorService reader = Executors.newSingleThreadExecutor();
        try {
            transactionTemplate.executeWithoutResult(status -> {
                assertThat(sessionService.revokeAllSessions(userId).isSuccess()).isTrue();
                try {
                    // 아직 커밋 전: 다른 스레드는 옛 stamp를 읽어 캐시에 올린다
                    PrincipalSnapshot concurrent = reader.submit(() -> snapshots.load(userId)).get(30, TimeUnit.SECONDS);
                    assertThat(concurrent.securityStampHash()).isEqualTo(oldHash);
                } catch (Exception e) {
                    throw new IllegalStateException(e);
                }
            });
        } finally {
            reader.shutdownNow();
        }

        String liveHash = JwtService.stampHash(userRepository.findById(userId).orElseThrow().getSecurityStamp());
        assertThat(liveHash).isNotEqualTo(oldHash);
        assertThat(snapshots.load(userId).securityStampHash()).isEqualTo(liveHash);
    }

    @Test
    @DisplayName("권한 변경 → 옛 access는 ACCESS_INVALID, refresh는 살아 있어 새 권한이 실린 access를 받는다")
    void permission_change_forces_soft_refresh() throws Exception {
        LoginResult login = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD, false);
        User user = userRepository.findByEmail(EMAIL).orElseThrow();

        // 캐시에 스냅샷을 올려둔다.
        AuthHttpSupport.performMe(mvc, AuthHttpSupport.bearer(login.accessToken())).andExpect(status().isOk());

        assertThat(sessionService.propagatePermissionChange(user.getId(), UserRole.ADMIN).isSuccess()).isTrue();

        // evict 덕분에 다음 요청에서 바로 불일치가 잡힌다.
        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performMe(mvc, AuthHttpSupport.bearer(login.accessToken())),
                ErrorCode.ACCESS_INVALID
        );

        RefreshResult refreshed = AuthFlowSupport.refreshOk(mvc, login.refreshRaw());
        AuthHttpSupport.performMe(mvc, AuthHttpSupport.bearer(refreshed.accessToken()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.role").value(UserRole.ADMIN.name()));
    }

    @Test
    @DisplayName("보호 엔드포인트: 토큰 없음 → 401 UNAUTHORIZED")
    void protected_endpoints_require_authentication() throws Exception {
        AuthHttpSupport.expectErrorWithCode(
                mvc.perform(org.springframework.test.web.servlet.request.MockMvcRequestBuilders
                        .post(AuthHttpSupport.REVOKE_ALL_ENDPOINT)),
                ErrorCode.UNAUTHORIZED
        );
    }
}
