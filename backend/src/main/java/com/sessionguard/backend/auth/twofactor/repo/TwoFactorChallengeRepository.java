package com.sessionguard.backend.auth.twofactor.repo;

import java.time.LocalDateTime;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.sessionguard.backend.auth.twofactor.domain.TwoFactorChallenge;

@Repository
public interface TwoFactorChallengeRepository extends JpaRepository<TwoFactorChallenge, Long> {

    Optional<TwoFactorChallenge> findByTokenHash(String tokenHash);

    /**
     * 실패 횟수 증가 (원자적 increment-and-compare)
     * - 이미 max에 도달했거나 사용된 챌린지는 0행 → 호출자는 잠김으로 처리
     * - read-modify-write가 아니므로 병렬 추측으로 임계치를 넘길 수 없다.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update TwoFactorChallenge c
               set c.failedAttempts = c.failedAttempts + 1
             where c.id = :id
               and c.used = false
               and c.failedAttempts < :max
            """)
    int incrementFailedAttempts(@Param("id") Long id, @Param("max") int max);

    /**
     * 챌린지 소비 (1회)
     * - 0행이면 다른 요청이 먼저 소비했거나 그 사이 잠긴 것
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update TwoFactorChallenge c
               set c.used = true
             where c.id = :id
               and c.used = false
               and c.failedAttempts < :max
            """)
    int consume(@Param("id") Long id, @Param("max") int max);

    /** 보존 스윕: 사용된 챌린지 + 유예 기간 이전에 만료된 챌린지 */
    @Modifying
    @Query("delete from TwoFactorChallenge c where c.used = true or c.expiresAt < :threshold")
    int deleteFinished(@Param("threshold") LocalDateTime threshold);
}
