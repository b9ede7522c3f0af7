package com.chatintel.group.source;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Helpers for serialized chat identifiers of the form {@code <user>@<server>}.
 *
 * Phone-bearing ids use the c.us (or s.whatsapp.net) server and carry the phone
 * number as user part, e.g. 94772147755@c.us. Linked ids (@lid) carry an opaque
 * number that only looks like a phone.
 */
public final class ChatIds {

    private static final Pattern PLAUSIBLE_PHONE = Pattern.compile("^\\d{10,15}$");
    private static final Pattern NON_DIGITS = Pattern.compile("\\D");

    private ChatIds() {
    }

    public static String localPart(String id) {
        if (id == null) return null;
        int at = id.indexOf('@');
        return at < 0 ? id : id.substring(0, at);
    }

    public static boolean isPhoneBearing(String id) {
        return id != null && (id.endsWith("@c.us") || id.endsWith("@s.whatsapp.net"));
    }

    /** Digits of a phone-bearing id, empty for any other id. */
    public static Optional<String> phoneOf(String id) {
        if (!isPhoneBearing(id)) return Optional.empty();
        return digitsOf(localPart(id));
    }

    public static boolean looksLikePhone(String localPart) {
        return localPart != null && PLAUSIBLE_PHONE.matcher(localPart).matches();
    }

    /** Strips everything but digits; empty when nothing is left. */
    public static Optional<String> digitsOf(String raw) {
        if (raw == null) return Optional.empty();
        String digits = NON_DIGITS.matcher(raw).replaceAll("");
        return digits.isEmpty() ? Optional.empty() : Optional.of(digits);
    }

    /** Canonical phone format: '+' followed by digits only. */
    public static Optional<String> canonicalPhone(String raw) {
        return digitsOf(raw).map(d -> "+" + d);
    }
}
