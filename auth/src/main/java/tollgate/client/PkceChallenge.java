package tollgate.client;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * A PKCE verifier and its S256 challenge, generated fresh for each login attempt.
 */
public record PkceChallenge(String verifier, String challenge) {

    public static final String METHOD = "S256";
    private static final int VERIFIER_LENGTH = 64;
    private static final int STATE_LENGTH = 32;
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    public PkceChallenge {
        if (verifier == null || verifier.length() < 43 || verifier.length() > 128) {
            throw new IllegalArgumentException("PKCE verifier must be 43 to 128 characters");
        }
        if (challenge == null || challenge.isBlank()) {
            throw new IllegalArgumentException("PKCE challenge is required");
        }
    }

    public static PkceChallenge generate() {
        final var verifier = randomUrlSafe(VERIFIER_LENGTH);
        return new PkceChallenge(verifier, challengeFor(verifier));
    }

    /**
     * BASE64URL(SHA-256(ASCII(verifier))) without padding.
     */
    public static String challengeFor(String verifier) {
        try {
            final var hash = MessageDigest.getInstance("SHA-256").digest(verifier.getBytes(StandardCharsets.US_ASCII));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }

    /**
     * Random anti-forgery value for the {@code state} parameter.
     */
    public static String randomState() {
        return randomUrlSafe(STATE_LENGTH);
    }

    private static String randomUrlSafe(int bytes) {
        final var randomBytes = new byte[bytes];
        SECURE_RANDOM.nextBytes(randomBytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(randomBytes);
    }

    @Override
    public String toString() {
        return "PkceChallenge[challenge=" + challenge + "]";
    }
}
