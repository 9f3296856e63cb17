package com.rollcall.backend.modules.auth.infrastructure.jwt;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import javax.crypto.SecretKey;

import io.jsonwebtoken.security.Keys;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Holds the HMAC key access tokens are signed with. The configured secret may be Base64 or plain text.
 */
@Component
public class JwtTokenProvider {

    private final SecretKey secretKey;

    public JwtTokenProvider(@Value("${jwt.secret}") String secretString) {
        this.secretKey = Keys.hmacShaKeyFor(decode(secretString));
    }

    public SecretKey getSecretKey() {
        return secretKey;
    }

    private static byte[] decode(String secretString) {
        try {
            byte[] decoded = Base64.getDecoder().decode(secretString);
            // short Base64-looking strings are more likely plain passphrases
            if (decoded.length >= 32) {
                return decoded;
            }
        } catch (IllegalArgumentException ignored) {
            // not Base64; fall through to the raw bytes
        }
        return secretString.getBytes(StandardCharsets.UTF_8);
    }
}
