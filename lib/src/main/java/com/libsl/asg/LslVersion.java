package com.libsl.asg;

/** Version of the specification language a library is written against. */
public final class LslVersion {
    private final int major;
    private final int minor;
    private final int patch;

    public LslVersion(int major, int minor, int patch) {
        if (major < 0 || minor < 0 || patch < 0) {
            throw new IllegalArgumentException("version components must be non-negative");
        }
        this.major = major;
        this.minor = minor;
        this.patch = patch;
    }

    /**
     * Parses {@code major.minor.patch}.
     *
     * @throws IllegalArgumentException if the text is not three dot-separated non-negative integers
     */
    public static LslVersion parse(String text) {
        String[] parts = text.split("\\.", -1);
        if (parts.length != 3) {
            throw new IllegalArgumentException("malformed libsl version: " + text);
        }
        try {
            return new LslVersion(Integer.parseInt(parts[0]), Integer.parseInt(parts[1]), Integer.parseInt(parts[2]));
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("malformed libsl version: " + text, ex);
        }
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

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof LslVersion)) {
            return false;
        }
        LslVersion other = (LslVersion) obj;
        return major == other.major && minor == other.minor && patch == other.patch;
    }

    @Override
    public int hashCode() {
        return (major * 31 + minor) * 31 + patch;
    }

    @Override
    public String toString() {
        return major + "." + minor + "." + patch;
    }
}
