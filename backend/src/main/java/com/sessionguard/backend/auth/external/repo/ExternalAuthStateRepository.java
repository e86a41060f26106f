package com.sessionguard.backend.auth.external.repo;

import java.time.LocalDateTime;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.sessionguard.backend.auth.external.domain.ExternalAuthState;

@Repository
public interface ExternalAuthStateRepository extends JpaRepository<ExternalAuthState, Long> {

    Optional<ExternalAuthState> findByStateHash(String stateHash);

    /** 1회 소비. 0행이면 이미 사용됨 (동시 callback 포함) */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update ExternalAuthState s set s.used = true where s.id = :id and s.used = false")
    int consume(@Param("id") Long id);

    @Modifying
    @Query("delete from ExternalAuthState s where s.used = true or s.expiresAt < :now")
    int deleteFinished(@Param("now") LocalDateTime now);
}
