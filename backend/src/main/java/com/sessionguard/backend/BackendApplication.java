package com.sessionguard.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;
import org.springframework.context.annotation.Import;

import com.sessionguard.backend.auth.config.AuthModuleConfig;

/**
 * 세션 보안 백엔드 진입점
 *
 * ------------------------------------------------------------------------------------
 * 설정 적용 순서
 * ------------------------------------------------------------------------------------
 * 1) application.yml (+ 프로필별 yml)
 * 2) ${ENV:default} 치환: 환경변수가 있으면 그 값, 없으면 default
 * 3) @ConfigurationProperties 바인딩 (app.auth.*, app.auth.two-factor.*, app.auth.external.*)
 *    - @Validated 규칙 위반 시 부팅 실패(Fail-fast)
 *
 * ------------------------------------------------------------------------------------
 * 운영/디버깅 체크 포인트
 * ------------------------------------------------------------------------------------
 * - Flyway 적용 여부: "Successfully applied ... migration"
 * - 감사 로그: logger "AUDIT"
 * - "Using generated security password" 경고가 보이면 UserDetailsService 자동설정이 살아있다는 뜻
 *      => JWT 방식이라 exclude로 끈다.
 */
@Import(AuthModuleConfig.class)
@SpringBootApplication(exclude = {UserDetailsServiceAutoConfiguration.class})
public class BackendApplication {
    public static void main(String[] args) {
        SpringApplication.run(BackendApplication.class, args);
    }
}
