package com.example.blockalert.util;

import com.example.blockalert.exception.ValidationException;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * One-way plate identifiers. Raw plate text is normalized (trimmed, upper-cased, all whitespace
 * removed) and hashed with SHA-256; only the lowercase hex digest is ever stored or compared.
 */
public final class PlateFingerprints {

    private static final Pattern WELL_FORMED = Pattern.compile("^[0-9a-f]{64}$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private PlateFingerprints() {}

    public static String normalize(String rawPlate) {
        if (rawPlate == null) {
            return "";
        }
        return WHITESPACE.matcher(rawPlate.trim().toUpperCase(Locale.ROOT)).replaceAll("");
    }

    public static String fingerprint(String rawPlate) {
        String normalized = normalize(rawPlate);
        if (normalized.isEmpty()) {
            throw new ValidationException("Plate must not be blank");
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(normalized.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static boolean isWellFormed(String plateHash) {
        return plateHash != null && WELL_FORMED.matcher(plateHash).matches();
    }

    public static String requireWellFormed(String plateHash) {
        if (!isWellFormed(plateHash)) {
            throw new ValidationException("Plate fingerprint must be 64 lowercase hex characters");
        }
        return plateHash;
    }
}
