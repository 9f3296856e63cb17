package com.rollcall.backend.modules.auth.infrastructure;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.rollcall.backend.global.error.StoreException;
import com.rollcall.backend.modules.auth.application.UserDirectory;
import com.rollcall.backend.modules.auth.domain.AppUser;
import com.rollcall.backend.modules.auth.domain.UserRole;
import com.rollcall.backend.modules.auth.domain.UserStatus;
import com.rollcall.backend.modules.auth.infrastructure.persistence.AppUserRepository;

import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
@Transactional(readOnly = true)
public class JpaUserDirectory implements UserDirectory {

    private final AppUserRepository appUserRepository;

    public JpaUserDirectory(AppUserRepository appUserRepository) {
        this.appUserRepository = appUserRepository;
    }

    @Override
    public Optional<DirectoryEntry> findUser(UUID userId) {
        try {
            return appUserRepository.findById(userId).map(JpaUserDirectory::toEntry);
        } catch (DataAccessException ex) {
            throw new StoreException("User directory lookup failed", ex);
        }
    }

    @Override
    public Optional<DirectoryEntry> findByEmail(String email) {
        if (email == null || email.isBlank()) {
            return Optional.empty();
        }
        try {
            return appUserRepository.findByEmailIgnoreCase(email.trim()).map(JpaUserDirectory::toEntry);
        } catch (DataAccessException ex) {
            throw new StoreException("User directory lookup failed", ex);
        }
    }

    @Override
    public List<DirectoryEntry> listByRole(UserRole role) {
        try {
            return appUserRepository.findByRoleAndStatus(role, UserStatus.ACTIVE).stream()
                    .map(JpaUserDirectory::toEntry)
                    .toList();
        } catch (DataAccessException ex) {
            throw new StoreException("User directory listing failed", ex);
        }
    }

    static DirectoryEntry toEntry(AppUser user) {
        return new DirectoryEntry(
                user.getId(),
                user.getEmail(),
                user.getFullName(),
                user.getRole(),
                user.isActive(),
                user.getEnrollmentId()
        );
    }
}
