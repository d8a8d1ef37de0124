package com.z254.bulwark.governance.state;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.List;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

/**
 * Deterministic SHA-256 fingerprints used for tamper evidence, and HMAC-derived
 * uniform values used wherever a keyed pseudo-random draw is needed.
 * <p>
 * These are integrity checksums only; they carry no proof semantics.
 */
public final class Fingerprints {

    private static final String DIGEST_ALGORITHM = "SHA-256";
    private static final String MAC_ALGORITHM = "HmacSHA256";
    private static final String SEPARATOR = "|";
    private static final double UNIT = 0x1.0p-53;

    private Fingerprints() {
    }

    /**
     * Hex SHA-256 of the parts joined by {@code |}.
     */
    public static String fingerprint(Object... parts) {
        try {
            MessageDigest digest = MessageDigest.getInstance(DIGEST_ALGORITHM);
            byte[] hash = digest.digest(join(parts).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Canonical text of an amplitude sequence. {@link Double#toString(double)} round-trips
     * exactly, so a deserialized state fingerprints identically.
     */
    public static String canonical(List<Amplitude> amplitudes) {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < amplitudes.size(); i++) {
            if (i > 0) {
                sb.append(',');
            }
            Amplitude a = amplitudes.get(i);
            sb.append(Double.toString(a.getReal())).append(':').append(Double.toString(a.getImaginary()));
        }
        return sb.append(']').toString();
    }

    /**
     * Fresh random HMAC key.
     */
    public static byte[] newKey(SecureRandom random) {
        byte[] key = new byte[32];
        random.nextBytes(key);
        return key;
    }

    /**
     * Uniform value in {@code [0, 1)} derived from HMAC-SHA256 of the parts.
     */
    public static double keyedUniform(byte[] key, Object... parts) {
        try {
            Mac mac = Mac.getInstance(MAC_ALGORITHM);
            mac.init(new SecretKeySpec(key, MAC_ALGORITHM));
            byte[] out = mac.doFinal(join(parts).getBytes(StandardCharsets.UTF_8));
            long bits = ByteBuffer.wrap(out, 0, Long.BYTES).getLong() >>> 11;
            return bits * UNIT;
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            throw new IllegalStateException("HmacSHA256 not available", e);
        }
    }

    private static String join(Object... parts) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) {
                sb.append(SEPARATOR);
            }
            sb.append(parts[i]);
        }
        return sb.toString();
    }
}
