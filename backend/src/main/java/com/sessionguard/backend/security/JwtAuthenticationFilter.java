package com.sessionguard.backend.security;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;

import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.util.AntPathMatcher;
import org.springframework.web.filter.OncePerRequestFilter;

import com.sessionguard.backend.auth.cache.PrincipalSnapshot;
import com.sessionguard.backend.auth.cache.PrincipalSnapshotService;
import com.sessionguard.backend.global.ErrorCode;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * "Security Filter Chain"에서 "JWT 기반 인증"을 수행하는 인증 필터
 *
 * 역할:
 * - Authorization: Bearer 헤더 → 없으면 access 쿠키 순서로 Access Token을 꺼낸다.
 * - JwtService로 서명/만료/issuer/audience를 검증해서 AuthPrincipal을 얻는다.
 * - 토큰의 security stamp 해시가 사용자의 현재 값과 같을 때만 SecurityContext에 인증을 세팅한다.
 *
 * 정책:
 * - 토큰이 "없으면" 통과한다. (차단은 SecurityConfig의 인가 규칙 + EntryPoint가 담당)
 * - 토큰이 "있는데 유효하지 않으면" 여기서 401 ACCESS_INVALID로 종료한다.
 *   stamp 불일치/사용자 삭제도 같은 코드다. (비밀번호 변경, 2FA 변경, 전체 세션 폐기 이후)
 * - 로그인/리프레시 같은 공개 인증 엔드포인트는 이 필터를 건너뛴다.
 *   만료된 access 쿠키가 남아 있어도 리프레시가 막히면 안 된다.
 */
@Slf4j
@RequiredArgsConstructor
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final String BEARER_PREFIX = "Bearer ";
    private static final AntPathMatcher PATH_MATCHER = new AntPathMatcher();

    private final JwtService jwtService;
    private final PrincipalSnapshotService principalSnapshotService;
    private final SecurityErrorWriter errorWriter;
    private final String accessCookieName;
    private final List<String> skipPatterns;

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        return skipPatterns.stream().anyMatch(p -> PATH_MATCHER.match(p, path));
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {

        // 이미 인증이 만들어진 요청이면 중복 처리하지 않는다.
        if (SecurityContextHolder.getContext().getAuthentication() != null) {
            filterChain.doFilter(request, response);
            return;
        }

        String token = resolveToken(request);
        if (token == null) {
            filterChain.doFilter(request, response);
            return;
        }

        AuthPrincipal principal;
        try {
            // 서명/만료/nbf/iss/aud + 필수 클레임
            principal = jwtService.verifyAccessToken(token);
        } catch (JwtService.InvalidJwtException ex) {
            SecurityContextHolder.clearContext();
            errorWriter.write(response, ErrorCode.ACCESS_INVALID);
            return;
        }

        // 현재 stamp와 비교 (캐시 → DB)
        PrincipalSnapshot current = principalSnapshotService.load(principal.userId());
        if (!principal.matchesStampOf(current)) {
            log.debug("access token stamp mismatch: userId={}", principal.userId());
            SecurityContextHolder.clearContext();
            errorWriter.write(response, ErrorCode.ACCESS_INVALID);
            return;
        }

        // 권한은 현재 값 기준 (stamp가 같으면 role도 같다)
        AuthPrincipal effective = AuthPrincipal.from(current);
        var authorities = List.of(new SimpleGrantedAuthority(effective.authority()));

        var authentication = new UsernamePasswordAuthenticationToken(effective, null, authorities);
        authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
        SecurityContextHolder.getContext().setAuthentication(authentication);

        filterChain.doFilter(request, response);
    }

    /** Bearer 헤더 우선, 없으면 access 쿠키 */
    private String resolveToken(HttpServletRequest request) {
        String fromHeader = resolveBearerToken(request);
        if (fromHeader != null) return fromHeader;
        return resolveCookieToken(request);
    }

    /**
     * Authorization: Bearer <token> 형태에서 <token>만 추출한다.
     * - 없거나 형식이 다르면 null을 반환한다.
     */
    private String resolveBearerToken(HttpServletRequest request) {
        String authHeader = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authHeader == null || authHeader.isBlank()) return null;
        if (!authHeader.startsWith(BEARER_PREFIX)) return null;

        String token = authHeader.substring(BEARER_PREFIX.length()).trim();
        return token.isBlank() ? null : token;
    }

    private String resolveCookieToken(HttpServletRequest request) {
        Cookie[] cookies = request.getCookies();
        if (cookies == null) return null;

        return Arrays.stream(cookies)
                .filter(c -> accessCookieName.equals(c.getName()))
                .map(Cookie::getValue)
                .filter(v -> v != null && !v.isBlank())
                .map(String::trim)
                .findFirst()
                .orElse(null);
    }
}
