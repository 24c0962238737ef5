package com.erpdashboard.backend.modules.auth.infrastructure.jwt;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import javax.crypto.SecretKey;

import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.WeakKeyException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * 액세스 토큰용 HMAC-SHA256 서명 키.
 *
 * <p>{@code jwt.secret}은 Base64일 수 있으며, 디코딩되지 않으면 UTF-8 원문을 그대로 쓴다.
 * 어느 쪽이든 256비트 이상이어야 한다.
 */
@Component
public class JwtTokenProvider {

    private final SecretKey secretKey;

    public JwtTokenProvider(@Value("${jwt.secret}") String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("jwt.secret must be set");
        }
        try {
            this.secretKey = Keys.hmacShaKeyFor(keyMaterial(secret.trim()));
        } catch (WeakKeyException ex) {
            throw new IllegalStateException("jwt.secret must provide at least 256 bits of key material", ex);
        }
    }

    public SecretKey getSecretKey() {
        return secretKey;
    }

    private static byte[] keyMaterial(String secret) {
        try {
            return Base64.getDecoder().decode(secret);
        } catch (IllegalArgumentException notBase64) {
            return secret.getBytes(StandardCharsets.UTF_8);
        }
    }
}
