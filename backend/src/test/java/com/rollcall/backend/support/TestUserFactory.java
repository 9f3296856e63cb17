package com.rollcall.backend.support;

import com.rollcall.backend.modules.auth.domain.AppUser;
import com.rollcall.backend.modules.auth.domain.UserRole;
import com.rollcall.backend.modules.auth.domain.UserStatus;
import com.rollcall.backend.modules.auth.infrastructure.persistence.AppUserRepository;

import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
@Transactional
public class TestUserFactory {

    private final AppUserRepository appUserRepository;
    private final PasswordEncoder passwordEncoder;

    public TestUserFactory(AppUserRepository appUserRepository, PasswordEncoder passwordEncoder) {
        this.appUserRepository = appUserRepository;
        this.passwordEncoder = passwordEncoder;
    }

    public AppUser ensureHod(String email, String rawPassword) {
        AppUser hod = ensureUser(email, rawPassword, "Head " + email, UserRole.HOD);
        hod.setEmployeeId("EMP-" + Math.abs(email.hashCode() % 10_000));
        return appUserRepository.save(hod);
    }

    public AppUser ensureTeacher(String email, String rawPassword) {
        AppUser teacher = ensureUser(email, rawPassword, "Teacher " + email, UserRole.TEACHER);
        teacher.setEmployeeId("EMP-" + Math.abs(email.hashCode() % 10_000));
        return appUserRepository.save(teacher);
    }

    public AppUser ensureStudent(String email, String rawPassword) {
        AppUser student = ensureUser(email, rawPassword, "Student " + email, UserRole.STUDENT);
        student.setEnrollmentId("ENR-" + Math.abs(email.hashCode() % 10_000));
        student.setCourse("Computer Science");
        student.setSemester("4");
        student.setPhone("0123456789");
        return appUserRepository.save(student);
    }

    public AppUser changeRole(AppUser user, UserRole role) {
        AppUser managed = appUserRepository.findById(user.getId()).orElseThrow();
        managed.setRole(role);
        return appUserRepository.save(managed);
    }

    private AppUser ensureUser(String email, String rawPassword, String fullName, UserRole role) {
        AppUser user = appUserRepository.findByEmailIgnoreCase(email).orElseGet(AppUser::new);
        user.setEmail(email);
        user.setPasswordHash(passwordEncoder.encode(rawPassword));
        user.setFullName(fullName);
        user.setRole(role);
        user.setStatus(UserStatus.ACTIVE);
        return user;
    }
}
