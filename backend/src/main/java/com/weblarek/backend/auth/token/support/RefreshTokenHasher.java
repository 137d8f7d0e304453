package com.weblarek.backend.auth.token.support;

import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

import org.springframework.stereotype.Component;

import com.weblarek.backend.auth.config.AuthProperties;

/**
 * refresh 토큰 해시기 (HMAC-SHA256, hex 64)
 *
 * - DB에는 raw 대신 이 값만 저장하고, 조회도 이 값으로 한다.
 *   : incoming raw -> hash(raw) -> refresh_tokens.token_hash 와 비교
 * - 키(hashSecret)가 서버에만 있으므로 DB 덤프만으로는 원문 대조가 불가능하다.
 */
@Component
public class RefreshTokenHasher {

    private static final String ALGORITHM = "HmacSHA256";
    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private final SecretKeySpec key;

    public RefreshTokenHasher(AuthProperties props) {
        this.key = new SecretKeySpec(
                props.refresh().hashSecret().getBytes(StandardCharsets.UTF_8),
                ALGORITHM
        );
    }

    public String hash(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("raw token must not be null/blank");
        }
        return toHex(mac().doFinal(raw.getBytes(StandardCharsets.UTF_8)));
    }

    // Mac은 thread-safe가 아니라서 매번 새로 만든다.
    private Mac mac() {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(key);
            return mac;
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            throw new IllegalStateException("HMAC-SHA256 not available", e);
        }
    }

    private static String toHex(byte[] bytes) {
        char[] out = new char[bytes.length * 2];
        for (int i = 0; i < bytes.length; i++) {
            int v = bytes[i] & 0xFF;
            out[i * 2] = HEX[v >>> 4];
            out[i * 2 + 1] = HEX[v & 0x0F];
        }
        return new String(out);
    }
}
