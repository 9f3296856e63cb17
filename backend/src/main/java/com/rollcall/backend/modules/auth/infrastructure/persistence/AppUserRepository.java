package com.rollcall.backend.modules.auth.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.rollcall.backend.modules.auth.domain.AppUser;
import com.rollcall.backend.modules.auth.domain.UserRole;
import com.rollcall.backend.modules.auth.domain.UserStatus;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AppUserRepository extends JpaRepository<AppUser, UUID> {

    @Query("select u from AppUser u where lower(u.email) = lower(:email)")
    Optional<AppUser> findByEmailIgnoreCase(@Param("email") String email);

    @Query("select case when count(u) > 0 then true else false end from AppUser u where lower(u.email) = lower(:email)")
    boolean existsByEmailIgnoreCase(@Param("email") String email);

    @Query("""
            select u
              from AppUser u
             where u.role = :role
               and u.status = :status
             order by lower(u.fullName), u.email
            """)
    List<AppUser> findByRoleAndStatus(@Param("role") UserRole role, @Param("status") UserStatus status);
}
