package io.hearthwarrio.locatium.core;

/**
 * UID helpers.
 */
public final class Uids {

    private Uids() {
    }

    /**
     * Canonical identifier form: every character other than an ASCII letter or digit
     * becomes '_', runs of '_' collapse to one, boundary '_' are trimmed. Case is kept.
     * <p>
     * Idempotent.
     *
     * @param raw any text
     * @return canonical form (possibly empty)
     */
    public static String canonicalize(String raw) {
        if (raw == null || raw.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder(raw.length());
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (isAsciiAlphanumeric(c)) {
                sb.append(c);
            } else if (sb.length() == 0 || sb.charAt(sb.length() - 1) != '_') {
                sb.append('_');
            }
        }
        int start = sb.length() > 0 && sb.charAt(0) == '_' ? 1 : 0;
        int end = sb.length() > start && sb.charAt(sb.length() - 1) == '_' ? sb.length() - 1 : sb.length();
        return sb.substring(start, end);
    }

    private static boolean isAsciiAlphanumeric(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
    }
}
