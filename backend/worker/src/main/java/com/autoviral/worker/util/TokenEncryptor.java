package com.autoviral.worker.util;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;

/**
 * 소셜 계정 액세스 토큰 암복호화 (AES-256-GCM)
 * 저장 형식: Base64(IV 12바이트 + 암호문)
 */
@Slf4j
@Component
public class TokenEncryptor {

    private static final String ALGORITHM = "AES/GCM/NoPadding";
    private static final int GCM_IV_LENGTH = 12;
    private static final int GCM_TAG_LENGTH = 128;
    private static final int MIN_KEY_LENGTH = 32;

    private final SecretKeySpec secretKey;
    private final SecureRandom random = new SecureRandom();

    public TokenEncryptor(@Value("${social-token.encryption-secret:}") String encryptionSecret) {
        if (encryptionSecret == null || encryptionSecret.length() < MIN_KEY_LENGTH) {
            log.error("[TokenEncryptor] TOKEN_ENCRYPTION_SECRET 가 없거나 {}자 미만입니다", MIN_KEY_LENGTH);
            throw new IllegalStateException(
                    "TOKEN_ENCRYPTION_SECRET 환경변수를 설정해주세요 (최소 " + MIN_KEY_LENGTH + "자)");
        }
        byte[] keyBytes = Arrays.copyOf(encryptionSecret.getBytes(StandardCharsets.UTF_8), 32);
        this.secretKey = new SecretKeySpec(keyBytes, "AES");
    }

    public String encrypt(String plainToken) {
        if (plainToken == null || plainToken.isEmpty()) {
            return null;
        }
        try {
            byte[] iv = new byte[GCM_IV_LENGTH];
            random.nextBytes(iv);

            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, secretKey, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
            byte[] encrypted = cipher.doFinal(plainToken.getBytes(StandardCharsets.UTF_8));

            byte[] combined = new byte[iv.length + encrypted.length];
            System.arraycopy(iv, 0, combined, 0, iv.length);
            System.arraycopy(encrypted, 0, combined, iv.length, encrypted.length);
            return Base64.getEncoder().encodeToString(combined);
        } catch (Exception e) {
            throw new IllegalStateException("토큰 암호화 실패", e);
        }
    }

    /**
     * 복호화 실패(키 변경, 손상된 값) 시 null
     * 호출 측은 null 을 "유효한 토큰 없음"으로 처리한다.
     */
    public String decrypt(String encryptedToken) {
        if (encryptedToken == null || encryptedToken.isEmpty()) {
            return null;
        }
        try {
            byte[] combined = Base64.getDecoder().decode(encryptedToken);
            if (combined.length <= GCM_IV_LENGTH) {
                return null;
            }
            byte[] iv = Arrays.copyOfRange(combined, 0, GCM_IV_LENGTH);
            byte[] encrypted = Arrays.copyOfRange(combined, GCM_IV_LENGTH, combined.length);

            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, secretKey, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
            return new String(cipher.doFinal(encrypted), StandardCharsets.UTF_8);
        } catch (Exception e) {
            log.warn("[TokenEncryptor] Decryption failed (key mismatch?): {}", e.getMessage());
            return null;
        }
    }
}
