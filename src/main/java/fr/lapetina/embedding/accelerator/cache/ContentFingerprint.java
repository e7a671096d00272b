package fr.lapetina.embedding.accelerator.cache;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * Cache keys derived from text content.
 *
 * The key is the SHA-256 hex digest of the backend name followed by the
 * whitespace-normalized text, so vectors from different backends never collide.
 */
public final class ContentFingerprint {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private ContentFingerprint() {
    }

    /**
     * Collapses whitespace runs into single spaces and trims both ends.
     */
    public static String normalize(String text) {
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    public static String of(String backendName, String text) {
        MessageDigest digest = sha256();
        digest.update(backendName.getBytes(StandardCharsets.UTF_8));
        digest.update((byte) 0);
        digest.update(normalize(text).getBytes(StandardCharsets.UTF_8));
        return HexFormat.of().formatHex(digest.digest());
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
