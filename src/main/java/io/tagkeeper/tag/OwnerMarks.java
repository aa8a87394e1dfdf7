package io.tagkeeper.tag;

import java.util.Locale;

/**
 * Owner string helpers shared by the tag schemes.
 */
final class OwnerMarks {
    static final String WATERMARK_PREFIX = "wm-";

    private final String slug;
    private final String fragment;

    OwnerMarks(String owner) {
        String normalized = owner == null ? "" : owner.trim().toLowerCase(Locale.ROOT);
        StringBuilder sb = new StringBuilder(normalized.length());
        for (int i = 0; i < normalized.length(); i++) {
            char ch = normalized.charAt(i);
            if ((ch >= 'a' && ch <= 'z') || (ch >= '0' && ch <= '9')) {
                sb.append(ch);
            }
        }
        if (sb.length() == 0) {
            throw new IllegalArgumentException("Owner must contain at least one letter or digit: " + owner);
        }
        this.slug = sb.toString();
        this.fragment = slug.length() <= 5 ? slug : slug.substring(0, 5);
    }

    String slug() {
        return slug;
    }

    /** First five characters of the slug; embedded in every tag. */
    String fragment() {
        return fragment;
    }

    String watermark(long epochMs) {
        return WATERMARK_PREFIX + slug + "-" + Long.toString(epochMs, 36);
    }

    boolean validWatermark(String watermark) {
        return watermark != null
                && watermark.startsWith(WATERMARK_PREFIX)
                && watermark.contains(slug);
    }

    static boolean isBase36(String value, boolean allowSign) {
        if (value == null || value.isEmpty()) {
            return false;
        }
        int start = 0;
        if (allowSign && value.charAt(0) == '-') {
            if (value.length() == 1) {
                return false;
            }
            start = 1;
        }
        for (int i = start; i < value.length(); i++) {
            if (Character.digit(value.charAt(i), 36) < 0) {
                return false;
            }
        }
        return true;
    }
}
