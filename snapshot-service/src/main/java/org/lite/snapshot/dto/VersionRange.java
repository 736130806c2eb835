package org.lite.snapshot.dto;

/**
 * Inclusive version range; null bounds are open
 */
public record VersionRange(Integer fromVersion, Integer toVersion) {

    public static VersionRange all() {
        return new VersionRange(null, null);
    }

    public int lowerBound() {
        return fromVersion != null ? Math.max(1, fromVersion) : 1;
    }

    public int upperBound() {
        return toVersion != null ? toVersion : Integer.MAX_VALUE;
    }
}
