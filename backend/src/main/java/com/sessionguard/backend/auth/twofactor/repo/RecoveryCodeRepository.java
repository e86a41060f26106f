package com.sessionguard.backend.auth.twofactor.repo;

import java.time.LocalDateTime;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.sessionguard.backend.auth.twofactor.domain.RecoveryCode;

@Repository
public interface RecoveryCodeRepository extends JpaRepository<RecoveryCode, Long> {

    Optional<RecoveryCode> findFirstByUserIdAndCodeHashAndUsedAtIsNull(Long userId, String codeHash);

    long countByUserIdAndUsedAtIsNull(Long userId);

    /** 1회 소비. 0행이면 동시에 다른 요청이 먼저 썼다. */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update RecoveryCode r set r.usedAt = :now where r.id = :id and r.usedAt is null")
    int markUsed(@Param("id") Long id, @Param("now") LocalDateTime now);

    /** 같은 트랜잭션에서 방금 소비한 코드를 되돌린다. (행 잠금은 아직 이 트랜잭션이 쥐고 있다) */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update RecoveryCode r set r.usedAt = null where r.id = :id")
    int release(@Param("id") Long id);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from RecoveryCode r where r.userId = :userId")
    int deleteAllByUserId(@Param("userId") Long userId);
}
