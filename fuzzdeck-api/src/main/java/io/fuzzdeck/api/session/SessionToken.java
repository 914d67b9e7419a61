package io.fuzzdeck.api.session;

import java.security.SecureRandom;

/**
 * Opaque correlation identifier binding one session's engine events together.
 */
public record SessionToken(String value) {

    private static final String ALPHABET = "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    private static final int DEFAULT_LENGTH = 60;
    private static final SecureRandom RANDOM = new SecureRandom();

    public SessionToken {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Session token must not be blank");
        }
    }

    /**
     * @return a fresh random token
     */
    public static SessionToken generate() {
        return generate(DEFAULT_LENGTH);
    }

    public static SessionToken generate(int length) {
        if (length <= 0) {
            throw new IllegalArgumentException("Token length must be positive");
        }
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(ALPHABET.charAt(RANDOM.nextInt(ALPHABET.length())));
        }
        return new SessionToken(sb.toString());
    }

    @Override
    public String toString() {
        return value;
    }
}
