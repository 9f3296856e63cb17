package com.rollcall.backend.modules.auth.application;

import java.util.Locale;
import java.util.Optional;

import com.rollcall.backend.modules.auth.application.UserDirectory.DirectoryEntry;
import com.rollcall.backend.modules.auth.domain.AppUser;
import com.rollcall.backend.modules.auth.domain.UserRole;
import com.rollcall.backend.modules.auth.domain.UserStatus;
import com.rollcall.backend.modules.auth.infrastructure.persistence.AppUserRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/**
 * Creates the first department-head account when none is active, since only a department head
 * can register further accounts. Disabled unless {@code rollcall.bootstrap.hod-email} is set.
 */
@Component
public class BootstrapHodInitializer implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(BootstrapHodInitializer.class);

    private final UserDirectory userDirectory;
    private final AppUserRepository appUserRepository;
    private final PasswordEncoder passwordEncoder;
    private final String email;
    private final String password;
    private final String name;

    public BootstrapHodInitializer(
            UserDirectory userDirectory,
            AppUserRepository appUserRepository,
            PasswordEncoder passwordEncoder,
            @Value("${rollcall.bootstrap.hod-email:}") String email,
            @Value("${rollcall.bootstrap.hod-password:}") String password,
            @Value("${rollcall.bootstrap.hod-name:Department Head}") String name
    ) {
        this.userDirectory = userDirectory;
        this.appUserRepository = appUserRepository;
        this.passwordEncoder = passwordEncoder;
        this.email = email;
        this.password = password;
        this.name = name;
    }

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        if (!StringUtils.hasText(email)) {
            return;
        }
        if (!userDirectory.listByRole(UserRole.HOD).isEmpty()) {
            return;
        }
        if (!StringUtils.hasText(password) || password.length() < 6) {
            throw new IllegalStateException("rollcall.bootstrap.hod-password must be at least 6 characters");
        }
        Optional<DirectoryEntry> existing = userDirectory.findByEmail(email);
        if (existing.isPresent()) {
            log.warn("Bootstrap department head {} already exists as {} (active={}); skipping",
                    email, existing.get().role(), existing.get().active());
            return;
        }
        AppUser hod = new AppUser();
        hod.setEmail(email.trim().toLowerCase(Locale.ROOT));
        hod.setPasswordHash(passwordEncoder.encode(password));
        hod.setFullName(name);
        hod.setRole(UserRole.HOD);
        hod.setStatus(UserStatus.ACTIVE);
        appUserRepository.save(hod);
        log.info("Bootstrap department head account {} created", hod.getEmail());
    }
}
