package com.ai.screening.utils;

import org.apache.commons.lang3.StringUtils;

import java.util.Optional;

/**
 * WhatsApp contact helpers. A JID looks like 5511999999999@s.whatsapp.net.
 */
public final class PhoneNumbers {

    public static final int MIN_DIGITS = 10;
    public static final int MAX_DIGITS = 15;

    private PhoneNumbers() {
    }

    /**
     * Canonical phone (digits only) for a contact key, or empty if it is not phone-like.
     */
    public static Optional<String> fromContactKey(String contactKey) {
        if (StringUtils.isBlank(contactKey)) {
            return Optional.empty();
        }
        String local = StringUtils.substringBefore(contactKey.trim(), "@");
        String digits = StringUtils.getDigits(local);
        return isValid(digits) ? Optional.of(digits) : Optional.empty();
    }

    public static boolean isValid(String phone) {
        if (phone == null) return false;
        String digits = StringUtils.getDigits(phone);
        if (digits.length() < MIN_DIGITS || digits.length() > MAX_DIGITS) {
            return false;
        }
        return StringUtils.containsAny(digits, "123456789");
    }

    /** 5511999999999 -> 55119****9999, for log lines. */
    public static String mask(String phone) {
        if (phone == null || phone.length() < 8) return "****";
        return phone.substring(0, phone.length() - 8) + "****" + phone.substring(phone.length() - 4);
    }
}
