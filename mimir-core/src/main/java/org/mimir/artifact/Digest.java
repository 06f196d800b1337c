package org.mimir.artifact;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;

/**
 * Content address of a blob: algorithm tag plus lower-case hex, rendered as {@code sha256:<hex>}.
 */
public record Digest(String algorithm, String hex) implements Comparable<Digest> {

    public static final String SHA256 = "sha256";
    private static final int SHA256_HEX_LENGTH = 64;

    public Digest {
        if (!SHA256.equals(algorithm)) {
            throw new IllegalArgumentException("Unsupported digest algorithm: " + algorithm);
        }
        if (hex == null || hex.length() != SHA256_HEX_LENGTH) {
            throw new IllegalArgumentException("Digest hex must be " + SHA256_HEX_LENGTH + " characters: " + hex);
        }
        hex = hex.toLowerCase(Locale.ROOT);
        for (int i = 0; i < hex.length(); i++) {
            char c = hex.charAt(i);
            if ((c < '0' || c > '9') && (c < 'a' || c > 'f')) {
                throw new IllegalArgumentException("Digest is not hex: " + hex);
            }
        }
    }

    /** Accepts {@code sha256:<hex>} or bare hex. */
    public static Digest parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Digest is blank");
        }
        String s = text.strip();
        int colon = s.indexOf(':');
        if (colon < 0) {
            return new Digest(SHA256, s);
        }
        return new Digest(s.substring(0, colon).toLowerCase(Locale.ROOT), s.substring(colon + 1));
    }

    public static Digest of(byte[] bytes) {
        return new Digest(SHA256, toHex(newSha256().digest(bytes)));
    }

    public static Digest of(String text) {
        return of(text.getBytes(StandardCharsets.UTF_8));
    }

    public static Digest of(InputStream in) throws IOException {
        MessageDigest md = newSha256();
        byte[] buf = new byte[64 * 1024];
        int r;
        while ((r = in.read(buf)) != -1) {
            md.update(buf, 0, r);
        }
        return new Digest(SHA256, toHex(md.digest()));
    }

    public static Digest of(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return of(in);
        }
    }

    public boolean matches(byte[] bytes) {
        return equals(of(bytes));
    }

    /** First two hex chars, used for directory fan-out. */
    public String prefix() {
        return hex.substring(0, 2);
    }

    public String shortHex() {
        return hex.substring(0, 12);
    }

    @Override
    public int compareTo(Digest o) {
        return toString().compareTo(o.toString());
    }

    @Override
    public String toString() {
        return algorithm + ":" + hex;
    }

    private static MessageDigest newSha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    private static String toHex(byte[] dig) {
        StringBuilder sb = new StringBuilder(dig.length * 2);
        for (byte b : dig) sb.append(String.format("%02x", b));
        return sb.toString();
    }
}
