package com.reelpilot.publisher.util;

/**
 * Video type labels as they appear in record ids and archive paths:
 * {@code long} for the primary video and {@code short_N} for the N-th derived short.
 */
public final class VideoTypes {
    public static final String LONG = "long";
    public static final String SHORT_PREFIX = "short";

    private VideoTypes() {
    }

    public static String shortAt(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("Short index must not be negative: " + index);
        }
        return SHORT_PREFIX + "_" + index;
    }

    public static boolean isLong(String videoType) {
        return LONG.equals(videoType);
    }

    public static boolean isShort(String videoType) {
        return videoType != null && (videoType.equals(SHORT_PREFIX) || videoType.startsWith(SHORT_PREFIX + "_"));
    }
}
