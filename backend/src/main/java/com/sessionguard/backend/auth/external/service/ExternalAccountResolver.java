package com.sessionguard.backend.auth.external.service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Locale;
import java.util.Optional;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.sessionguard.backend.auth.audit.AuditAction;
import com.sessionguard.backend.auth.audit.AuditSink;
import com.sessionguard.backend.auth.domain.User;
import com.sessionguard.backend.auth.external.domain.ExternalLogin;
import com.sessionguard.backend.auth.external.provider.ExternalUserInfo;
import com.sessionguard.backend.auth.external.repo.ExternalLoginRepository;
import com.sessionguard.backend.auth.identity.credential.UserCredentialService;
import com.sessionguard.backend.auth.repo.UserRepository;
import com.sessionguard.backend.auth.token.support.TokenGenerator;
import com.sessionguard.backend.global.ErrorCode;
import com.sessionguard.backend.global.Result;

import lombok.RequiredArgsConstructor;

/**
 * 외부 신원 → 로컬 계정 (find-or-provision)
 *
 * 1) (provider, providerKey) 연결이 있으면 그 사용자
 * 2) 같은 이메일의 로컬 사용자가 있으면: 제공자가 이메일을 검증한 경우에만 연결
 *    (검증 안 된 이메일로 남의 계정에 붙는 것 방지)
 * 3) 없으면 새 사용자 생성. 비밀번호는 아무도 모르는 난수 해시 (hasPassword=false)
 */
@Service
@RequiredArgsConstructor
public class ExternalAccountResolver {

    private static final int NICKNAME_MAX = 30;

    private final ExternalLoginRepository externalLoginRepository;
    private final UserRepository userRepository;
    private final UserCredentialService credentialService;
    private final TokenGenerator tokenGenerator;
    private final AuditSink auditSink;
    private final Clock clock;

    @Transactional
    public Result<ResolvedAccount> resolve(String provider, ExternalUserInfo info) {
        LocalDateTime now = LocalDateTime.now(clock);

        Optional<User> linked = externalLoginRepository.findByProviderAndProviderKey(provider, info.providerKey())
                .flatMap(link -> userRepository.findById(link.getUserId()));
        if (linked.isPresent()) {
            return Result.success(new ResolvedAccount(linked.get(), false));
        }

        if (info.email() == null || info.email().isBlank()) {
            return Result.failure(ErrorCode.NO_USABLE_EMAIL);
        }
        String email = info.email().trim().toLowerCase(Locale.ROOT);

        Optional<User> sameEmail = userRepository.findByEmail(email);
        if (sameEmail.isPresent()) {
            if (!info.emailVerified()) {
                return Result.failure(ErrorCode.NO_USABLE_EMAIL, "검증되지 않은 이메일로는 기존 계정에 연결할 수 없습니다.");
            }
            User user = sameEmail.get();
            externalLoginRepository.save(ExternalLogin.link(user.getId(), provider, info.providerKey(), now));
            auditSink.record(AuditAction.EXTERNAL_ACCOUNT_LINKED, user.getId(), "provider=" + provider);
            return Result.success(new ResolvedAccount(user, false));
        }

        User created = userRepository.save(User.createWithoutPassword(
                email,
                credentialService.hashPassword(tokenGenerator.newUnusablePassword()),
                nickname(info, email),
                now
        ));
        externalLoginRepository.save(ExternalLogin.link(created.getId(), provider, info.providerKey(), now));
        auditSink.record(AuditAction.EXTERNAL_ACCOUNT_CREATED, created.getId(), "provider=" + provider);
        return Result.success(new ResolvedAccount(created, true));
    }

    private static String nickname(ExternalUserInfo info, String email) {
        String base = info.firstName() != null && !info.firstName().isBlank()
                ? info.firstName().trim()
                : email.substring(0, email.indexOf('@') > 0 ? email.indexOf('@') : email.length());
        return base.length() > NICKNAME_MAX ? base.substring(0, NICKNAME_MAX) : base;
    }

    public record ResolvedAccount(User user, boolean newAccount) {}
}
