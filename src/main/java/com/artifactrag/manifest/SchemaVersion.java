package com.artifactrag.manifest;

public record SchemaVersion(int major, int minor) implements Comparable<SchemaVersion> {
    public static SchemaVersion parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("schema version is missing");
        }
        String[] parts = value.trim().split("\\.");
        if (parts.length < 1 || parts.length > 2) {
            throw new IllegalArgumentException("schema version must follow major[.minor], was '" + value + "'");
        }
        try {
            int major = Integer.parseInt(parts[0]);
            int minor = parts.length == 2 ? Integer.parseInt(parts[1]) : 0;
            if (major < 0 || minor < 0) {
                throw new IllegalArgumentException("schema version components must be non-negative, was '" + value + "'");
            }
            return new SchemaVersion(major, minor);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("schema version must follow major[.minor], was '" + value + "'", e);
        }
    }

    @Override
    public int compareTo(SchemaVersion other) {
        if (major != other.major) {
            return Integer.compare(major, other.major);
        }
        return Integer.compare(minor, other.minor);
    }

    @Override
    public String toString() {
        return major + "." + minor;
    }
}
