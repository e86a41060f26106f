package com.sessionguard.backend.auth.external.repo;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.sessionguard.backend.auth.external.domain.ExternalLogin;

@Repository
public interface ExternalLoginRepository extends JpaRepository<ExternalLogin, Long> {

    Optional<ExternalLogin> findByProviderAndProviderKey(String provider, String providerKey);

    List<ExternalLogin> findAllByUserId(Long userId);
}
