package io.taskmesh.util;

/**
 * Maps caller-chosen identities onto safe file name fragments.
 */
public final class FileNames {
    private FileNames() {
    }

    public static String safeFragment(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("identity must not be blank");
        }
        String value = raw.trim();
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            boolean ok = (ch >= 'a' && ch <= 'z')
                    || (ch >= 'A' && ch <= 'Z')
                    || (ch >= '0' && ch <= '9')
                    || ch == '_' || ch == '-' || ch == '.';
            sb.append(ok ? ch : '_');
        }
        String out = sb.toString();
        if (out.startsWith(".")) {
            out = "_" + out;
        }
        // Distinct raw ids that sanitize to the same text must not share a file.
        if (!out.equals(value)) {
            out = out + "-" + Hashing.sha256Hex(value).substring(0, 8);
        }
        return out;
    }
}
