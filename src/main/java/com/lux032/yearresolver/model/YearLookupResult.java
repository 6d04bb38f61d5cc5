package com.lux032.yearresolver.model;

import lombok.Value;

import java.util.Optional;

/**
 * Year returned by an external lookup, with the source's confidence flag.
 */
@Value
public class YearLookupResult {

    String year;
    boolean definitive;

    public static YearLookupResult notFound() {
        return new YearLookupResult(null, false);
    }

    public Optional<String> getYear() {
        return Optional.ofNullable(year);
    }
}
