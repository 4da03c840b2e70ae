package model;

import java.util.Objects;

/**
 * Semantic version of the solver (major, minor, patch).
 */
public final class SolverVersion implements Comparable<SolverVersion> {
    private final int major;
    private final int minor;
    private final int patch;

    public SolverVersion(int major, int minor, int patch) {
        if (major < 0 || minor < 0 || patch < 0) {
            throw new IllegalArgumentException(
                "Version components must be non-negative: " + major + "." + minor + "." + patch);
        }
        this.major = major;
        this.minor = minor;
        this.patch = patch;
    }

    /**
     * Parses a dotted version string such as {@code "9.10.4025"} or {@code "v9.8"}.
     * Missing minor and patch components are read as 0; anything after the third
     * component is ignored.
     *
     * @param raw the version string
     * @return the parsed version
     * @throws IllegalArgumentException if the string is blank or a component is not a number
     */
    public static SolverVersion parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Version string is empty");
        }
        String trimmed = raw.trim();
        if (trimmed.startsWith("v") || trimmed.startsWith("V")) {
            trimmed = trimmed.substring(1);
        }

        String[] parts = trimmed.split("\\.");
        int[] components = new int[3];
        for (int i = 0; i < Math.min(parts.length, 3); i++) {
            try {
                components[i] = Integer.parseInt(parts[i]);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Malformed version string: '" + raw + "'", e);
            }
        }
        return new SolverVersion(components[0], components[1], components[2]);
    }

    public int getMajor() {
        return major;
    }

    public int getMinor() {
        return minor;
    }

    public int getPatch() {
        return patch;
    }

    public boolean isOlderThan(SolverVersion other) {
        return compareTo(other) < 0;
    }

    @Override
    public int compareTo(SolverVersion other) {
        if (major != other.major) {
            return Integer.compare(major, other.major);
        }
        if (minor != other.minor) {
            return Integer.compare(minor, other.minor);
        }
        return Integer.compare(patch, other.patch);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SolverVersion that = (SolverVersion) o;
        return major == that.major && minor == that.minor && patch == that.patch;
    }

    @Override
    public int hashCode() {
        return Objects.hash(major, minor, patch);
    }

    @Override
    public String toString() {
        return major + "." + minor + "." + patch;
    }
}
