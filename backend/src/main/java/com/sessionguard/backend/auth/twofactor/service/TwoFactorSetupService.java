package com.sessionguard.backend.auth.twofactor.service;

import java.util.List;
import java.util.Optional;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.sessionguard.backend.auth.audit.AuditAction;
import com.sessionguard.backend.auth.audit.AuditSink;
import com.sessionguard.backend.auth.cache.UserCacheInvalidator;
import com.sessionguard.backend.auth.domain.User;
import com.sessionguard.backend.auth.identity.credential.UserCredentialService;
import com.sessionguard.backend.auth.repo.UserRepository;
import com.sessionguard.backend.auth.twofactor.support.TotpVerifier;
import com.sessionguard.backend.global.ErrorCode;
import com.sessionguard.backend.global.Result;

import lombok.RequiredArgsConstructor;

/**
 * 2FA 설정 수명주기 (로그인된 사용자 본인)
 *
 * - begin: 새 시크릿을 staging (아직 비활성). 이미 켜져 있으면 거부
 * - confirm: staging 시크릿으로 만든 코드가 맞으면 활성화 + 복구 코드 발급
 * - disable: 비밀번호 재확인 후 비활성화 + 복구 코드 삭제
 * - regenerateRecoveryCodes: 비밀번호 재확인 후 새 세트
 *
 * 활성/비활성은 security stamp를 바꾸므로 기존 access token은 전부 무효가 된다. (soft refresh)
 */
@Service
@RequiredArgsConstructor
public class TwoFactorSetupService {

    private final UserRepository userRepository;
    private final UserCredentialService credentialService;
    private final RecoveryCodeService recoveryCodeService;
    private final TotpVerifier totpVerifier;
    private final UserCacheInvalidator cacheInvalidator;
    private final AuditSink auditSink;

    private static final String ALREADY_ENABLED = "2단계 인증이 이미 활성화되어 있습니다.";

    @Transactional
    public Result<SetupKey> begin(Long userId) {
        Result<User> loaded = loadUser(userId);
        if (loaded.isFailure()) return loaded.castFailure();
        User user = loaded.value();

        // 켜진 상태에서 시크릿을 덮으면 등록된 인증 앱이 죽는다. 바꾸려면 disable부터.
        if (user.isTwoFactorEnabled()) {
            return Result.failure(ErrorCode.VALIDATION_ERROR, ALREADY_ENABLED);
        }

        String secret = totpVerifier.newSecret();
        user.stageTwoFactorSecret(secret);
        return Result.success(new SetupKey(secret, totpVerifier.authenticatorUri(user.getEmail(), secret)));
    }

    @Transactional
    public Result<List<String>> confirm(Long userId, String code) {
        Result<User> loaded = loadUser(userId);
        if (loaded.isFailure()) return loaded.castFailure();
        User user = loaded.value();

        // 복구 코드 재발급은 비밀번호 재확인 경로(regenerateRecoveryCodes)로만
        if (user.isTwoFactorEnabled()) {
            return Result.failure(ErrorCode.VALIDATION_ERROR, ALREADY_ENABLED);
        }
        if (user.getTwoFactorSecret() == null) {
            return Result.failure(ErrorCode.VALIDATION_ERROR, "2단계 인증 설정을 먼저 시작해주세요.");
        }
        if (!totpVerifier.verify(user.getTwoFactorSecret(), code)) {
            return Result.failure(ErrorCode.INVALID_CODE);
        }

        user.enableTwoFactor();
        List<String> codes = recoveryCodeService.regenerate(user.getId());

        cacheInvalidator.evict(user.getId());
        auditSink.record(AuditAction.TWO_FACTOR_ENABLED, user.getId());
        return Result.success(codes);
    }

    @Transactional
    public Result<Void> disable(Long userId, String password) {
        Result<User> checked = loadUserWithPassword(userId, password);
        if (checked.isFailure()) return checked.castFailure();
        User user = checked.value();

        user.disableTwoFactor();
        recoveryCodeService.deleteAll(user.getId());

        cacheInvalidator.evict(user.getId());
        auditSink.record(AuditAction.TWO_FACTOR_DISABLED, user.getId());
        return Result.success(null);
    }

    @Transactional
    public Result<List<String>> regenerateRecoveryCodes(Long userId, String password) {
        Result<User> checked = loadUserWithPassword(userId, password);
        if (checked.isFailure()) return checked.castFailure();
        User user = checked.value();

        if (!user.isTwoFactorEnabled()) {
            return Result.failure(ErrorCode.VALIDATION_ERROR, "2단계 인증이 활성화되어 있지 않습니다.");
        }

        List<String> codes = recoveryCodeService.regenerate(user.getId());
        auditSink.record(AuditAction.RECOVERY_CODES_REGENERATED, user.getId());
        return Result.success(codes);
    }

    private Result<User> loadUser(Long userId) {
        Optional<User> user = userRepository.findById(userId);
        if (user.isEmpty()) {
            return Result.failure(ErrorCode.UNAUTHORIZED);
        }
        return Result.success(user.get());
    }

    private Result<User> loadUserWithPassword(Long userId, String password) {
        Result<User> loaded = loadUser(userId);
        if (loaded.isFailure()) return loaded;
        if (!credentialService.checkPassword(loaded.value(), password)) {
            return Result.failure(ErrorCode.INVALID_CREDENTIALS);
        }
        return loaded;
    }

    /** 인증 앱 등록용 키 */
    public record SetupKey(String sharedKey, String authenticatorUri) {}
}
