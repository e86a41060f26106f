package com.sessionguard.backend.auth.token.support;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Arrays;

import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;

import com.sessionguard.backend.auth.config.AuthProperties;
import com.sessionguard.backend.auth.config.AuthProperties.Refresh;
import com.sessionguard.backend.auth.token.service.TokenPair;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;

/**
 * 인증 쿠키 유틸 (access / refresh)
 *
 * - 두 쿠키 모두 HttpOnly로 내려 JS 접근을 막는다(XSS 완화).
 * - secure / sameSite 는 refresh 설정을 같이 쓴다. path만 다르다.
 *   access: "/" (모든 API 요청에 실림), refresh: "/auth" (인증 엔드포인트에만 실림)
 * - refresh Max-Age: rememberMe 여부에 따라 persistent / session TTL
 * - access Max-Age: access token TTL
 */
@Component
@RequiredArgsConstructor
public class AuthCookieUtils {

    private static final String DELETED = "deleted";

    private final AuthProperties props;

    /** Refresh 쿠키 읽기 (없으면 null) */
    public String readRefreshCookie(HttpServletRequest request) {
        return readCookie(request, props.refresh().cookieName());
    }

    /** access + refresh 쿠키 동시 세팅 */
    public void setTokenCookies(HttpServletResponse response, TokenPair pair) {
        setAccessCookie(response, pair.accessToken(), pair.accessTokenExpiresInSeconds());
        setRefreshCookie(response, pair.refreshToken(), pair.rememberMe());
    }

    public void setAccessCookie(HttpServletResponse response, String accessToken, long ttlSeconds) {
        if (accessToken == null || accessToken.isBlank()) return;

        ResponseCookie cookie = baseCookie(props.accessCookie().name(), accessToken, props.accessCookie().path())
                .maxAge(Duration.ofSeconds(ttlSeconds))
                .build();
        response.addHeader(HttpHeaders.SET_COOKIE, cookie.toString());
    }

    /**
     * Refresh 쿠키 세팅
     * - rememberMe=true  -> 긴 TTL (Max-Age = persistentTtlSeconds)
     * - rememberMe=false -> 짧은 TTL (Max-Age = sessionTtlSeconds)
     */
    public void setRefreshCookie(HttpServletResponse response, String refreshRaw, boolean rememberMe) {
        if (refreshRaw == null || refreshRaw.isBlank()) return;

        Refresh r = props.refresh();
        long ttlSeconds = rememberMe ? r.persistentTtlSeconds() : r.sessionTtlSeconds();

        ResponseCookie cookie = baseCookie(r.cookieName(), refreshRaw, r.cookiePath())
                .maxAge(Duration.ofSeconds(ttlSeconds))
                .build();
        response.addHeader(HttpHeaders.SET_COOKIE, cookie.toString());
    }

    /** 두 쿠키 삭제 (속성(path/sameSite/secure)이 같아야 브라우저가 제대로 삭제함) */
    public void clearTokenCookies(HttpServletResponse response) {
        Refresh r = props.refresh();
        response.addHeader(HttpHeaders.SET_COOKIE,
                baseCookie(props.accessCookie().name(), DELETED, props.accessCookie().path())
                        .maxAge(Duration.ZERO).build().toString());
        response.addHeader(HttpHeaders.SET_COOKIE,
                baseCookie(r.cookieName(), DELETED, r.cookiePath())
                        .maxAge(Duration.ZERO).build().toString());
    }

    /** 2FA 챌린지처럼 TTL이 절대 시각으로 주어질 때 */
    public static long secondsUntil(LocalDateTime now, LocalDateTime expiresAt) {
        return Math.max(0, Duration.between(now, expiresAt).getSeconds());
    }

    private String readCookie(HttpServletRequest request, String cookieName) {
        Cookie[] cookies = request.getCookies();
        if (cookies == null || cookies.length == 0) return null;

        return Arrays.stream(cookies)
                .filter(c -> cookieName.equals(c.getName()))
                .map(Cookie::getValue)
                .map(v -> v == null ? null : v.trim())
                .filter(v -> v != null && !v.isBlank() && !DELETED.equals(v))
                .findFirst()
                .orElse(null);
    }

    private ResponseCookie.ResponseCookieBuilder baseCookie(String name, String value, String path) {
        Refresh r = props.refresh();
        return ResponseCookie.from(name, value)
                .httpOnly(true)
                .secure(r.cookieSecure())
                .path(path)
                .sameSite(r.cookieSameSite().name());
    }
}
