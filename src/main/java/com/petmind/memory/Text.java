package com.petmind.memory;

final class Text {

    private Text() {}

    /** Cuts to at most {@code max} code points, never splitting a surrogate pair. */
    static String truncate(String value, int max) {
        if (value == null) return "";
        if (value.codePointCount(0, value.length()) <= max) return value;
        return value.substring(0, value.offsetByCodePoints(0, max));
    }
}
