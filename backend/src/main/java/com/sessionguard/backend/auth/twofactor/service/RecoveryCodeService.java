package com.sessionguard.backend.auth.twofactor.service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.sessionguard.backend.auth.config.TwoFactorProperties;
import com.sessionguard.backend.auth.twofactor.domain.RecoveryCode;
import com.sessionguard.backend.auth.twofactor.repo.RecoveryCodeRepository;
import com.sessionguard.backend.auth.twofactor.support.RecoveryCodeGenerator;

import lombok.RequiredArgsConstructor;

/**
 * 복구 코드 세트 관리
 * - regenerate: 기존 세트를 지우고 새 세트 발급 (원문 반환은 이 때 한 번뿐)
 * - findUsable / consume: 1회 소비 (조건부 update)
 */
@Service
@RequiredArgsConstructor
public class RecoveryCodeService {

    private final RecoveryCodeRepository recoveryCodeRepository;
    private final RecoveryCodeGenerator generator;
    private final TwoFactorProperties props;
    private final Clock clock;

    @Transactional
    public List<String> regenerate(Long userId) {
        LocalDateTime now = LocalDateTime.now(clock);
        recoveryCodeRepository.deleteAllByUserId(userId);

        List<String> codes = generator.generate(props.recoveryCodeCount());
        recoveryCodeRepository.saveAll(codes.stream()
                .map(code -> RecoveryCode.of(userId, RecoveryCodeGenerator.hash(code), now))
                .toList());
        return codes;
    }

    @Transactional(readOnly = true)
    public Optional<RecoveryCode> findUsable(Long userId, String rawCode) {
        if (RecoveryCodeGenerator.normalize(rawCode).isEmpty()) return Optional.empty();
        return recoveryCodeRepository.findFirstByUserIdAndCodeHashAndUsedAtIsNull(
                userId, RecoveryCodeGenerator.hash(rawCode));
    }

    /** @return 이 호출이 소비했으면 true */
    @Transactional
    public boolean consume(RecoveryCode code) {
        return recoveryCodeRepository.markUsed(code.getId(), LocalDateTime.now(clock)) == 1;
    }

    /** consume 직후 챌린지 소비에 실패했을 때만 쓴다. */
    @Transactional
    public void release(RecoveryCode code) {
        recoveryCodeRepository.release(code.getId());
    }

    @Transactional(readOnly = true)
    public long remaining(Long userId) {
        return recoveryCodeRepository.countByUserIdAndUsedAtIsNull(userId);
    }

    @Transactional
    public void deleteAll(Long userId) {
        recoveryCodeRepository.deleteAllByUserId(userId);
    }
}
