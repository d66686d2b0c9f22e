package com.deepansh.collab.model;

/**
 * Cursor sample as a percentage of the viewport.
 */
public record CursorPosition(double x, double y, String element) {

    public static CursorPosition clamped(double x, double y, String element) {
        return new CursorPosition(clamp(x), clamp(y), element);
    }

    private static double clamp(double v) {
        if (Double.isNaN(v)) return 0;
        return Math.max(0, Math.min(100, v));
    }
}
