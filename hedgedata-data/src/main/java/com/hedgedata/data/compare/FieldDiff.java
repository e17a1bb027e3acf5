package com.hedgedata.data.compare;

/**
 * One field as reported by two providers. Either side may be missing.
 */
public record FieldDiff(String field, Double left, Double right) {

    /**
     * Relative differences above this (0.01%) are flagged.
     */
    public static final double TOLERANCE = 0.0001;

    public boolean isComparable() {
        return left != null && right != null;
    }

    /**
     * |left - right| relative to the larger magnitude; NaN when a side is missing.
     */
    public double relativeDifference() {
        if (!isComparable()) {
            return Double.NaN;
        }
        double scale = Math.max(Math.abs(left), Math.abs(right));
        return scale == 0 ? 0.0 : Math.abs(left - right) / scale;
    }

    public boolean isSignificant() {
        return isComparable() && relativeDifference() > TOLERANCE;
    }
}
