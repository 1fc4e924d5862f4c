package com.cgi.dataprofiler.detector.service;

/**
 * Luhn (mod 10) checksum used to confirm credit card candidates.
 */
public final class LuhnValidator {

    private LuhnValidator() {
    }

    /**
     * Checks a card number. Spaces and dashes are ignored; any other
     * non-digit character makes the number invalid.
     *
     * @param number Card number
     * @return true if the checksum holds
     */
    public static boolean isValid(String number) {
        if (number == null) {
            return false;
        }
        String digits = stripSeparators(number);
        if (digits.isEmpty()) {
            return false;
        }

        int sum = 0;
        boolean doubleIt = false;
        for (int i = digits.length() - 1; i >= 0; i--) {
            char c = digits.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
            int digit = c - '0';
            if (doubleIt) {
                digit *= 2;
                if (digit > 9) {
                    digit -= 9;
                }
            }
            sum += digit;
            doubleIt = !doubleIt;
        }
        return sum % 10 == 0;
    }

    /**
     * Removes spaces and dashes.
     */
    public static String stripSeparators(String number) {
        StringBuilder sb = new StringBuilder(number.length());
        for (int i = 0; i < number.length(); i++) {
            char c = number.charAt(i);
            if (c != ' ' && c != '-') {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
