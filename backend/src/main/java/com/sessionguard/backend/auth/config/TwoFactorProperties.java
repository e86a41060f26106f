package com.sessionguard.backend.auth.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * 2단계 인증(TOTP) 설정 (app.auth.two-factor)
 *
 * - issuer: otpauth URI 라벨 (인증 앱에 보이는 서비스 이름)
 * - challengeTtlSeconds: 비밀번호 확인 후 코드 입력까지 허용 시간 (분 단위로 짧게)
 * - maxFailedAttempts: 챌린지 하나당 허용 실패 횟수. 도달하면 그 챌린지는 영구 잠김
 * - recoveryCodeCount: 복구 코드 세트 크기
 * - allowedTimeStepDrift: TOTP 검증 시 앞뒤로 허용하는 30초 스텝 수
 */
@Validated
@ConfigurationProperties(prefix = "app.auth.two-factor")
public record TwoFactorProperties(
        @NotBlank String issuer,
        @Min(30) @Max(900) long challengeTtlSeconds,
        @Min(1) @Max(20) int maxFailedAttempts,
        @Min(1) @Max(50) int recoveryCodeCount,
        @Min(0) @Max(3) int allowedTimeStepDrift
) {}
