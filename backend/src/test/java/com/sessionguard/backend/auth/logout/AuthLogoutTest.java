package com.sessionguard.backend.auth.logout;

import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.sessionguard.backend.auth.AbstractAuthIntegrationTest;
import com.sessionguard.backend.auth.support.AuthFlowSupport;
import com.sessionguard.backend.auth.support.AuthHttpSupport;
import com.sessionguard.backend.auth.support.AuthHttpSupport.LoginResult;
import com.sessionguard.backend.auth.token.domain.RefreshInvalidateReason;
import com.sessionguard.backend.auth.token.domain.RefreshToken;
import com.sessionguard.backend.auth.token.support.TokenHashUtils;

import jakarta.servlet.http.Cookie;

@DisplayName("[Auth][Logout] 로그아웃(/auth/logout) 통합 테스트")
class AuthLogoutTest extends AbstractAuthIntegrationTest {

    @Autowired MockMvc mvc;

    @BeforeEach
    void setUp() {
        createDefaultUser();
    }

    @Test
    @DisplayName("logout: refresh 쿠키 있음 → 그 토큰만 무효화(LOGOUT) + 두 쿠키 삭제(Max-Age=0)")
    void logout_with_cookie_invalidates_token_and_clears_cookies() throws Exception {
        LoginResult login = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD, false);
        LoginResult otherDevice = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD, false);

        MvcResult res = AuthHttpSupport.performLogout(mvc, new Cookie(AuthHttpSupport.REFRESH_COOKIE, login.refreshRaw()))
                .andExpect(status().isNoContent())
                .andExpect(header().exists(HttpHeaders.SET_COOKIE))
                .andReturn();

        var cookies = res.getResponse().getHeaders(HttpHeaders.SET_COOKIE);
        AuthHttpSupport.assertCookieCleared(
                AuthHttpSupport.findSetCookieLine(cookies, AuthHttpSupport.REFRESH_COOKIE), "/auth");
        AuthHttpSupport.assertCookieCleared(
                AuthHttpSupport.findSetCookieLine(cookies, AuthHttpSupport.ACCESS_COOKIE), "/");

        RefreshToken row = refreshTokenRepository.findByTokenHash(TokenHashUtils.sha256Hex(login.refreshRaw())).orElseThrow();
        assertThat(row.isInvalidated()).isTrue();
        assertThat(row.getInvalidateReason()).isEqualTo(RefreshInvalidateReason.LOGOUT);

        // 다른 기기 세션은 그대로
        AuthFlowSupport.refreshOk(mvc, otherDevice.refreshRaw());
    }

    @Test
    @DisplayName("logout: bearer 모드(바디의 refreshToken) → 204 + 무효화")
    void logout_with_body_token() throws Exception {
        LoginResult login = AuthFlowSupport.bearerLoginOk(mvc, EMAIL, PASSWORD, false);

        mvc.perform(post(AuthHttpSupport.LOGOUT_ENDPOINT)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"refreshToken":"%s"}
                                """.formatted(login.refreshRaw())))
                .andExpect(status().isNoContent());

        RefreshToken row = refreshTokenRepository.findByTokenHash(TokenHashUtils.sha256Hex(login.refreshRaw())).orElseThrow();
        assertThat(row.isInvalidated()).isTrue();
    }

    @Test
    @DisplayName("logout: 같은 토큰으로 두 번 → 둘 다 204, 최초 사유 유지")
    void logout_twice_is_idempotent() throws Exception {
        LoginResult login = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD, false);
        Cookie cookie = new Cookie(AuthHttpSupport.REFRESH_COOKIE, login.refreshRaw());

        AuthHttpSupport.performLogout(mvc, cookie).andExpect(status().isNoContent());
        AuthHttpSupport.performLogout(mvc, cookie).andExpect(status().isNoContent());

        RefreshToken row = refreshTokenRepository.findByTokenHash(TokenHashUtils.sha256Hex(login.refreshRaw())).orElseThrow();
        assertThat(row.getInvalidateReason()).isEqualTo(RefreshInvalidateReason.LOGOUT);
    }

    @Test
    @DisplayName("logout: 쿠키 없음 → 204 (idempotent) + 쿠키 삭제 헤더는 내려옴")
    void logout_without_cookie_is_idempotent_and_still_clears_cookie() throws Exception {
        MvcResult res = AuthHttpSupport.performLogout(mvc, null)
                .andExpect(status().isNoContent())
                .andExpect(header().exists(HttpHeaders.SET_COOKIE))
                .andReturn();

        AuthHttpSupport.assertCookieCleared(AuthHttpSupport.findSetCookieLine(
                res.getResponse().getHeaders(HttpHeaders.SET_COOKIE),
                AuthHttpSupport.REFRESH_COOKIE
        ), "/auth");
    }

    @Test
    @DisplayName("logout: 미발급 쿠키 → 204 (idempotent) + 쿠키 삭제(Max-Age=0)")
    void logout_with_unknown_cookie_is_idempotent_and_clears_cookie() throws Exception {
        MvcResult res = AuthHttpSupport.performLogout(mvc, new Cookie(AuthHttpSupport.REFRESH_COOKIE, "not-issued"))
                .andExpect(status().isNoContent())
                .andExpect(header().exists(HttpHeaders.SET_COOKIE))
                .andReturn();

        AuthHttpSupport.assertCookieCleared(AuthHttpSupport.findSetCookieLine(
                res.getResponse().getHeaders(HttpHeaders.SET_COOKIE),
                AuthHttpSupport.REFRESH_COOKIE
        ), "/auth");
    }
}
