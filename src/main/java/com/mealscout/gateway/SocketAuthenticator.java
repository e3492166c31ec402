package com.mealscout.gateway;

import com.mealscout.config.ChatProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Checks client tokens against the shared secret {@code chat.socket.token}. With no secret
 * configured every token is rejected.
 */
@Component
@Slf4j
public class SocketAuthenticator {

    private final byte[] expected;

    public SocketAuthenticator(ChatProperties properties) {
        String token = properties.getSocket().getToken();
        this.expected = StringUtils.hasText(token) ? token.getBytes(StandardCharsets.UTF_8) : null;
        if (expected == null) {
            log.warn("chat.socket.token is not set; all connections will be rejected");
        }
    }

    public boolean isValid(String token) {
        if (expected == null || !StringUtils.hasText(token)) {
            return false;
        }
        return MessageDigest.isEqual(expected, token.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Token from an {@code Authorization: Bearer ...} header value, or null.
     */
    public static String bearerToken(String authorization) {
        if (authorization != null && authorization.startsWith("Bearer ")) {
            return authorization.substring(7).trim();
        }
        return null;
    }
}
