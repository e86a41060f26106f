package com.sessionguard.backend.auth.cache;

import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.sessionguard.backend.auth.repo.UserRepository;
import com.sessionguard.backend.security.JwtService;

import lombok.RequiredArgsConstructor;

/**
 * userId -> PrincipalSnapshot 조회 (principals 캐시)
 *
 * - 유저가 없으면 null (캐시하지 않음)
 * - stamp가 바뀌는 모든 경로는 UserCacheInvalidator로 즉시 evict 한다.
 *   evict가 실패해도 TTL이 지나면 결국 새 값을 읽는다.
 */
@Service
@RequiredArgsConstructor
public class PrincipalSnapshotService {

    private final UserRepository userRepository;

    @Transactional(readOnly = true)
    @Cacheable(cacheNames = PrincipalCacheConfig.PRINCIPALS, key = "#userId", unless = "#result == null")
    public PrincipalSnapshot load(Long userId) {
        return userRepository.findById(userId)
                .map(u -> new PrincipalSnapshot(u.getId(), u.getRole(), JwtService.stampHash(u.getSecurityStamp())))
                .orElse(null);
    }
}
