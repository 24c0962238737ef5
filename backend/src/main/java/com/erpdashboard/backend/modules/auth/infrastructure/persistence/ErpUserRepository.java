package com.erpdashboard.backend.modules.auth.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.erpdashboard.backend.modules.auth.domain.ErpUser;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ErpUserRepository extends JpaRepository<ErpUser, UUID> {

    @EntityGraph(attributePaths = "branch")
    @Query("""
            select u
              from ErpUser u
             where lower(u.email) = lower(:email)
               and u.externalUid = :externalUid
            """)
    Optional<ErpUser> findByEmailAndExternalUid(@Param("email") String email, @Param("externalUid") String externalUid);

    @Query("select case when count(u) > 0 then true else false end from ErpUser u where lower(u.email) = lower(:email)")
    boolean existsByEmailIgnoreCase(@Param("email") String email);

    @EntityGraph(attributePaths = "branch")
    @Query("select u from ErpUser u where u.id = :id")
    Optional<ErpUser> findWithBranchById(@Param("id") UUID id);
}
