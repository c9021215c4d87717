package com.dingdangmaoup.contentpool.manifest;

import java.util.Comparator;
import java.util.regex.Pattern;

/**
 * Loose ordering for publisher version strings.
 * Dotted numeric versions ("1.08", "v2.0.1") compare segment by segment with missing
 * segments treated as zero; anything else falls back to ordinal comparison.
 * Blank versions sort first.
 */
public final class VersionComparer implements Comparator<String> {

    public static final VersionComparer INSTANCE = new VersionComparer();

    private static final Pattern NUMERIC_VERSION = Pattern.compile("\\d+(\\.\\d+)*");

    private VersionComparer() {
    }

    public static int compareVersions(String version1, String version2) {
        return INSTANCE.compare(version1, version2);
    }

    @Override
    public int compare(String version1, String version2) {
        boolean blank1 = version1 == null || version1.isBlank();
        boolean blank2 = version2 == null || version2.isBlank();
        if (blank1 && blank2) return 0;
        if (blank1) return -1;
        if (blank2) return 1;

        String numeric1 = stripPrefix(version1.trim());
        String numeric2 = stripPrefix(version2.trim());
        if (NUMERIC_VERSION.matcher(numeric1).matches() && NUMERIC_VERSION.matcher(numeric2).matches()) {
            return compareNumeric(numeric1.split("\\."), numeric2.split("\\."));
        }

        return version1.compareTo(version2);
    }

    private static int compareNumeric(String[] parts1, String[] parts2) {
        int length = Math.max(parts1.length, parts2.length);
        for (int i = 0; i < length; i++) {
            long a = i < parts1.length ? parseSegment(parts1[i]) : 0L;
            long b = i < parts2.length ? parseSegment(parts2[i]) : 0L;
            if (a != b) {
                return Long.compare(a, b);
            }
        }
        return 0;
    }

    private static long parseSegment(String segment) {
        // very long date stamps still fit; anything longer saturates
        return segment.length() > 18 ? Long.MAX_VALUE : Long.parseLong(segment);
    }

    private static String stripPrefix(String version) {
        return version.startsWith("v") || version.startsWith("V") ? version.substring(1) : version;
    }
}
