package com.sessionguard.backend.security;

import java.util.List;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

import com.sessionguard.backend.auth.cache.PrincipalSnapshotService;
import com.sessionguard.backend.auth.config.AuthProperties;

import lombok.RequiredArgsConstructor;

/**
 * Spring Security 전역 보안 설정
 *
 * - JWT 인증: JwtAuthenticationFilter (Bearer 헤더 또는 access 쿠키)
 * - 인증 필요 리소스 접근 시 인증 없으면: RestAuthEntryPoint (UNAUTHORIZED)
 * - 토큰은 있는데 invalid/stamp 불일치면: JwtAuthenticationFilter (ACCESS_INVALID)
 *
 * 세션은 서버에 저장하지 않는다(STATELESS). 로그인 상태는 refresh_tokens 테이블이 관리한다.
 */
@Configuration
@RequiredArgsConstructor
public class SecurityConfig {

    /** 인증 없이 호출하는 인증 엔드포인트. 이 경로들은 JWT 필터도 건너뛴다. */
    static final List<String> PUBLIC_AUTH_ENDPOINTS = List.of(
            "/auth/login",
            "/auth/refresh",
            "/auth/logout",
            "/auth/2fa/verify",
            "/auth/2fa/recovery",
            "/auth/external/**"
    );

    private static final List<String> INFRA_ENDPOINTS = List.of(
            "/error",
            "/actuator/health/**"
    );

    private final JwtService jwtService;
    private final PrincipalSnapshotService principalSnapshotService;
    private final SecurityErrorWriter securityErrorWriter;
    private final AuthProperties authProperties;

    @Bean
    RestAuthEntryPoint restAuthEntryPoint() {
        return new RestAuthEntryPoint(securityErrorWriter);
    }

    @Bean
    JwtAuthenticationFilter jwtAuthenticationFilter() {
        return new JwtAuthenticationFilter(
                jwtService,
                principalSnapshotService,
                securityErrorWriter,
                authProperties.accessCookie().name(),
                PUBLIC_AUTH_ENDPOINTS
        );
    }

    @Bean
    SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        return http
                // 쿠키 모드도 SameSite + HttpOnly 쿠키와 JSON 바디만 받는다.
                .csrf(csrf -> csrf.disable())
                .httpBasic(b -> b.disable())
                .formLogin(f -> f.disable())

                .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))

                // 인증 없이 보호 리소스 접근 - 401
                .exceptionHandling(eh -> eh.authenticationEntryPoint(restAuthEntryPoint()))

                .addFilterBefore(
                        jwtAuthenticationFilter(),
                        UsernamePasswordAuthenticationFilter.class
                )

                .authorizeHttpRequests(auth -> auth
                        .requestMatchers(INFRA_ENDPOINTS.toArray(String[]::new)).permitAll()
                        .requestMatchers(PUBLIC_AUTH_ENDPOINTS.toArray(String[]::new)).permitAll()

                        // 그 외는 인증 필요 (/auth/me, /auth/password, /auth/2fa/setup ...)
                        .anyRequest().authenticated()
                )
                .build();
    }
}
