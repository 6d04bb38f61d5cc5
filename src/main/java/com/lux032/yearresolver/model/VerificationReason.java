package com.lux032.yearresolver.model;

/**
 * Why an album sits in the pending verification queue.
 */
public enum VerificationReason {
    NO_YEAR_FOUND("no_year_found"),
    PRERELEASE("prerelease"),
    ABSURD_YEAR_NO_EXISTING("absurd_year_no_existing"),
    SUSPICIOUS_YEAR_CHANGE("suspicious_year_change"),
    SUSPICIOUS_ALBUM_NAME("suspicious_album_name"),
    SPECIAL_ALBUM_SPECIAL("special_album_special"),
    SPECIAL_ALBUM_COMPILATION("special_album_compilation"),
    SPECIAL_ALBUM_REISSUE("special_album_reissue");

    private final String value;

    VerificationReason(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Reason for a non-normal album type, {@code special_album_<type>}.
     */
    public static VerificationReason forAlbumType(AlbumType type) {
        switch (type) {
            case SPECIAL:
                return SPECIAL_ALBUM_SPECIAL;
            case COMPILATION:
                return SPECIAL_ALBUM_COMPILATION;
            case REISSUE:
                return SPECIAL_ALBUM_REISSUE;
            default:
                throw new IllegalArgumentException("No verification reason for album type " + type);
        }
    }

    /**
     * Parse a stored reason. Unknown values fall back to {@link #NO_YEAR_FOUND}.
     */
    public static VerificationReason fromString(String value) {
        if (value == null) {
            return NO_YEAR_FOUND;
        }
        String normalized = value.trim().toLowerCase();
        for (VerificationReason reason : values()) {
            if (reason.value.equals(normalized)) {
                return reason;
            }
        }
        return NO_YEAR_FOUND;
    }

    @Override
    public String toString() {
        return value;
    }
}
