package com.sessionguard.backend.auth.cache;

import com.sessionguard.backend.auth.domain.UserRole;

/**
 * 인증 필터가 매 요청 비교하는 사용자 상태의 캐시 가능한 사본.
 * - securityStampHash: sha256(현재 security stamp). 토큰의 stamp 클레임과 같은 형식
 */
public record PrincipalSnapshot(Long userId, UserRole role, String securityStampHash) {}
