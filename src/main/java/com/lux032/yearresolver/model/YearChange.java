package com.lux032.yearresolver.model;

import lombok.Value;

import java.time.LocalDateTime;

/**
 * One applied track year change.
 */
@Value
public class YearChange {
    String trackId;
    String artist;
    String album;
    String oldYear;
    String newYear;
    LocalDateTime timestamp;
}
