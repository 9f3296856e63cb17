package com.rollcall.backend.modules.auth.presentation;

import com.rollcall.backend.modules.auth.application.AuthService;
import com.rollcall.backend.modules.auth.presentation.dto.LoginRequest;
import com.rollcall.backend.modules.auth.presentation.dto.LoginResponse;
import com.rollcall.backend.modules.auth.presentation.dto.LogoutRequest;
import com.rollcall.backend.modules.auth.presentation.dto.RefreshRequest;

import jakarta.validation.Valid;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AuthController {

    private final AuthService authService;

    public AuthController(AuthService authService) {
        this.authService = authService;
    }

    @Operation(summary = "Sign in as a specific role")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Credentials valid and role confirmed"),
            @ApiResponse(responseCode = "401", description = "Unknown email or wrong password"),
            @ApiResponse(responseCode = "403", description = "Account holds a different role or is deactivated")
    })
    @PostMapping("/auth/login")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request) {
        return ResponseEntity.ok(authService.login(request));
    }

    @PostMapping("/auth/refresh")
    public ResponseEntity<LoginResponse> refresh(@Valid @RequestBody RefreshRequest request) {
        return ResponseEntity.ok(authService.refresh(request));
    }

    @PostMapping("/auth/logout")
    public ResponseEntity<Void> logout(@Valid @RequestBody LogoutRequest request) {
        authService.logout(request);
        return ResponseEntity.noContent().build();
    }
}
