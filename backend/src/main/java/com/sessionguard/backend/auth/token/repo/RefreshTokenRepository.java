package com.sessionguard.backend.auth.token.repo;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.sessionguard.backend.auth.token.domain.RefreshInvalidateReason;
import com.sessionguard.backend.auth.token.domain.RefreshToken;

import jakarta.persistence.LockModeType;

@Repository
public interface RefreshTokenRepository extends JpaRepository<RefreshToken, Long> {

    Optional<RefreshToken> findByTokenHash(String tokenHash);

    List<RefreshToken> findAllByUserId(Long userId);

    /**
     * rotate 동시성 방어용 Row Lock 조회.
     *
     * - PESSIMISTIC_WRITE = SELECT ... FOR UPDATE
     * - 같은 token_hash row에 대한 두 rotate는 직렬화된다.
     * - 먼저 끝난 쪽이 used=true로 커밋하면, 대기하던 쪽은 깨어난 뒤 used를 보고 재사용 탐지로 빠진다.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select r from RefreshToken r where r.tokenHash = :tokenHash")
    Optional<RefreshToken> findByTokenHashForUpdate(@Param("tokenHash") String tokenHash);

    /**
     * 유저의 "살아있는" 리프레시 토큰 전체 무효화 (family = userId 근사)
     * - 이미 무효화된 행과 이미 만료된 행은 건드리지 않는다.
     * - used=true 인 행도 대상이다. (재사용 판정 근거는 used, 무효화 여부와 무관)
     * @return 무효화된 행 수
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update RefreshToken r
               set r.invalidated = true,
                   r.invalidatedAt = :now,
                   r.invalidateReason = :reason
             where r.userId = :userId
               and r.invalidated = false
               and r.expiresAt > :now
            """)
    int invalidateActiveByUserId(@Param("userId") Long userId,
                                 @Param("now") LocalDateTime now,
                                 @Param("reason") RefreshInvalidateReason reason);

    /**
     * 보존 스윕: 만료 후 유예 기간이 지난 행 삭제
     * - 만료된 토큰은 재사용 여부와 상관없이 TOKEN_EXPIRED로 판정되므로 남겨둘 이유가 없다.
     */
    @Modifying
    @Query("delete from RefreshToken r where r.expiresAt < :threshold")
    int deleteExpiredBefore(@Param("threshold") LocalDateTime threshold);
}
