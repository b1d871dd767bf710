package com.telesync.shared.model;

import java.time.Instant;
import java.util.regex.Pattern;

public record Credentials(
    String apiId,
    String apiHash,
    String phone,
    Instant savedAt
) {
    private static final Pattern API_ID = Pattern.compile("\\d{3,12}");
    private static final Pattern API_HASH = Pattern.compile("[0-9a-fA-F]{16,64}");
    private static final Pattern PHONE = Pattern.compile("\\+?\\d{7,15}");
    private static final Pattern MASK = Pattern.compile("(\\d{3})\\d{4}(\\d{3})");

    public Credentials(String apiId, String apiHash, String phone) {
        this(apiId, apiHash, phone, Instant.now());
    }

    /** Returns the first shape problem found, or null when the credentials look plausible. */
    public String shapeProblem() {
        if (apiId == null || apiId.isBlank()) return "apiId is required";
        if (apiHash == null || apiHash.isBlank()) return "apiHash is required";
        if (phone == null || phone.isBlank()) return "phone is required";
        if (!API_ID.matcher(apiId.trim()).matches()) return "apiId must be numeric";
        if (!API_HASH.matcher(apiHash.trim()).matches()) return "apiHash must be a hex string";
        if (!PHONE.matcher(normalizedPhone()).matches()) return "phone is not a valid number";
        return null;
    }

    public String normalizedPhone() {
        return phone == null ? "" : phone.replaceAll("[\\s()-]", "");
    }

    public static String mask(String phone) {
        if (phone == null) return null;
        return MASK.matcher(phone).replaceFirst("$1****$2");
    }
}
