package com.lux032.yearresolver.model;

import lombok.Value;

/**
 * Outcome of the fallback decision for one proposed year.
 * <ul>
 *   <li>APPLY: write {@code year} to the album</li>
 *   <li>REJECT: keep the existing library state</li>
 *   <li>MARK_AND_SKIP: keep {@code preservedYear}, the album was queued for verification</li>
 * </ul>
 */
@Value
public class YearDecision {

    public enum Type {
        APPLY,
        REJECT,
        MARK_AND_SKIP
    }

    Type type;
    String year;
    String preservedYear;
    boolean markedForVerification;

    public static YearDecision apply(String year) {
        return new YearDecision(Type.APPLY, year, null, false);
    }

    public static YearDecision applyAndMark(String year) {
        return new YearDecision(Type.APPLY, year, null, true);
    }

    public static YearDecision reject(boolean marked) {
        return new YearDecision(Type.REJECT, null, null, marked);
    }

    public static YearDecision markAndSkip(String preservedYear) {
        return new YearDecision(Type.MARK_AND_SKIP, null, preservedYear, true);
    }

    public boolean isApply() {
        return type == Type.APPLY;
    }
}
