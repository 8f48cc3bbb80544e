package com.treasurylens.common;

import java.util.regex.Pattern;

/**
 * EVM address helpers. Addresses are compared lower-cased.
 */
public final class Addresses {

    public static final String ZERO = "0x0000000000000000000000000000000000000000";

    private static final Pattern EVM_ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{40}$");

    private Addresses() {
    }

    public static boolean isValid(String address) {
        return address != null && EVM_ADDRESS.matcher(address.strip()).matches();
    }

    /**
     * Lower-cased, stripped form; null stays null.
     */
    public static String normalize(String address) {
        return address != null ? address.strip().toLowerCase() : null;
    }

    public static boolean isZero(String address) {
        return address == null || address.isBlank() || ZERO.equals(normalize(address));
    }

    public static boolean same(String a, String b) {
        return a != null && b != null && normalize(a).equals(normalize(b));
    }
}
