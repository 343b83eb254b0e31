package com.enterprise.bulkload.sql.core;

/**
 * Three-part engine version as reported by the database itself.
 */
public record EngineVersion(int major, int minor, int patch) implements Comparable<EngineVersion> {

    public static final EngineVersion ZERO = new EngineVersion(0, 0, 0);

    /**
     * Lenient parse: missing or non-numeric components become 0, extra ones are ignored.
     * {@code "3.35"} is 3.35.0, {@code "3.x.1"} is 3.0.1, {@code null} is 0.0.0.
     */
    public static EngineVersion parse(String text) {
        if (text == null || text.isBlank()) {
            return ZERO;
        }
        String[] parts = text.trim().split("\\.");
        int[] v = new int[3];
        for (int i = 0; i < 3 && i < parts.length; i++) {
            v[i] = leadingInt(parts[i]);
        }
        return new EngineVersion(v[0], v[1], v[2]);
    }

    public boolean isAtLeast(EngineVersion other) {
        return compareTo(other) >= 0;
    }

    @Override
    public int compareTo(EngineVersion o) {
        if (major != o.major) return Integer.compare(major, o.major);
        if (minor != o.minor) return Integer.compare(minor, o.minor);
        return Integer.compare(patch, o.patch);
    }

    @Override
    public String toString() {
        return major + "." + minor + "." + patch;
    }

    // "35rc1" -> 35, "rc" -> 0
    private static int leadingInt(String part) {
        int end = 0;
        while (end < part.length() && Character.isDigit(part.charAt(end))) {
            end++;
        }
        if (end == 0 || end > 9) {
            return 0;
        }
        return Integer.parseInt(part.substring(0, end));
    }
}
