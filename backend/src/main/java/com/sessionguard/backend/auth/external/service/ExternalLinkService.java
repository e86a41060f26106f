package com.sessionguard.backend.auth.external.service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.sessionguard.backend.auth.audit.AuditAction;
import com.sessionguard.backend.auth.audit.AuditSink;
import com.sessionguard.backend.auth.domain.User;
import com.sessionguard.backend.auth.external.domain.ExternalLogin;
import com.sessionguard.backend.auth.external.provider.ExternalUserInfo;
import com.sessionguard.backend.auth.external.repo.ExternalLoginRepository;
import com.sessionguard.backend.auth.repo.UserRepository;
import com.sessionguard.backend.global.ErrorCode;
import com.sessionguard.backend.global.Result;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 로그인된 사용자의 외부 계정 연결 / 해제
 *
 * - 연결: 이미 이 사용자에 연결돼 있으면 성공(멱등), 다른 사용자에 연결돼 있으면 거부.
 *   제공자당 연결은 하나다.
 * - 해제: 비밀번호가 없고 연결이 하나뿐이면 거부 (로그인 수단이 사라진다)
 * - 둘 다 사용자 행을 FOR UPDATE로 잡는다. 동시 해제 두 건이 마지막 수단을 같이 지우지 못하게.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExternalLinkService {

    private final ExternalLoginRepository externalLoginRepository;
    private final UserRepository userRepository;
    private final AuditSink auditSink;
    private final Clock clock;

    @Transactional
    public Result<Void> link(Long userId, String provider, ExternalUserInfo info) {
        Optional<User> user = userRepository.findByIdForUpdate(userId);
        if (user.isEmpty()) {
            return Result.failure(ErrorCode.UNAUTHORIZED);
        }

        Optional<ExternalLogin> existing = externalLoginRepository.findByProviderAndProviderKey(provider, info.providerKey());
        if (existing.isPresent()) {
            if (existing.get().getUserId().equals(userId)) {
                return Result.success(null);
            }
            log.info("다른 사용자에 연결된 외부 계정 연결 시도: userId={}, provider={}", userId, provider);
            return Result.failure(ErrorCode.VALIDATION_ERROR, "이미 다른 계정에 연결된 외부 계정입니다.");
        }

        boolean sameProvider = externalLoginRepository.findAllByUserId(userId).stream()
                .anyMatch(link -> link.getProvider().equals(provider));
        if (sameProvider) {
            return Result.failure(ErrorCode.VALIDATION_ERROR, "이미 같은 제공자의 다른 계정이 연결되어 있습니다.");
        }

        externalLoginRepository.save(ExternalLogin.link(userId, provider, info.providerKey(), LocalDateTime.now(clock)));
        auditSink.record(AuditAction.EXTERNAL_ACCOUNT_LINKED, userId, "provider=" + provider + " mode=link");
        return Result.success(null);
    }

    @Transactional
    public Result<Void> unlink(Long userId, String provider) {
        Optional<User> found = userRepository.findByIdForUpdate(userId);
        if (found.isEmpty()) {
            return Result.failure(ErrorCode.UNAUTHORIZED);
        }
        User user = found.get();

        List<ExternalLogin> links = externalLoginRepository.findAllByUserId(userId);
        Optional<ExternalLogin> target = links.stream()
                .filter(link -> link.getProvider().equalsIgnoreCase(provider))
                .findFirst();
        if (target.isEmpty()) {
            return Result.failure(ErrorCode.VALIDATION_ERROR, "연결되지 않은 외부 로그인입니다.");
        }
        if (!user.hasPassword() && links.size() <= 1) {
            return Result.failure(ErrorCode.VALIDATION_ERROR, "마지막 로그인 수단은 해제할 수 없습니다. 비밀번호를 먼저 설정하세요.");
        }

        externalLoginRepository.delete(target.get());
        auditSink.record(AuditAction.EXTERNAL_ACCOUNT_UNLINKED, userId, "provider=" + target.get().getProvider());
        return Result.success(null);
    }
}
