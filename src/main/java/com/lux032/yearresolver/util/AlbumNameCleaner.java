package com.lux032.yearresolver.util;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Strips remaster parentheticals and store suffixes from album names,
 * e.g. "Abbey Road (Remastered 2009)" becomes "Abbey Road" and "Hello - EP" becomes "Hello".
 */
@Slf4j
public class AlbumNameCleaner {

    private final List<String> remasterKeywords;
    private final List<String> albumSuffixes;

    public AlbumNameCleaner(List<String> remasterKeywords, List<String> albumSuffixes) {
        this.remasterKeywords = new ArrayList<>();
        for (String keyword : remasterKeywords) {
            this.remasterKeywords.add(keyword.toLowerCase(Locale.ROOT));
        }
        this.albumSuffixes = new ArrayList<>(albumSuffixes);
        this.albumSuffixes.sort(Comparator.comparingInt(String::length).reversed());
    }

    public String clean(String album) {
        if (album == null) {
            return "";
        }
        String cleaned = removeSegments(album, '(', ')');
        cleaned = removeSegments(cleaned, '[', ']');
        cleaned = cleaned.replaceAll("\\s+", " ").trim();

        boolean removed = true;
        while (removed) {
            removed = false;
            for (String suffix : albumSuffixes) {
                if (!suffix.isEmpty() && cleaned.toLowerCase(Locale.ROOT).endsWith(suffix.toLowerCase(Locale.ROOT))) {
                    cleaned = stripTrailing(cleaned.substring(0, cleaned.length() - suffix.length()));
                    removed = true;
                    break;
                }
            }
        }

        if (cleaned.isEmpty()) {
            // never clean a name away entirely
            return album.trim();
        }
        if (!cleaned.equals(album)) {
            log.debug("Cleaned album name: '{}' -> '{}'", album, cleaned);
        }
        return cleaned;
    }

    private String removeSegments(String text, char open, char close) {
        StringBuilder result = new StringBuilder(text);
        int position = 0;
        while (position < result.length()) {
            if (result.charAt(position) == open) {
                int end = findMatching(result, position, open, close);
                if (end != -1 && containsKeyword(result.substring(position, end + 1))) {
                    result.delete(position, end + 1);
                    continue;
                }
            }
            position++;
        }
        return result.toString();
    }

    private static int findMatching(CharSequence text, int start, char open, char close) {
        int depth = 0;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == open) {
                depth++;
            } else if (c == close) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private boolean containsKeyword(String segment) {
        String lower = segment.toLowerCase(Locale.ROOT);
        for (String keyword : remasterKeywords) {
            if (lower.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    private static String stripTrailing(String text) {
        int end = text.length();
        while (end > 0) {
            char c = text.charAt(end - 1);
            if (c == ' ' || c == '\t' || c == '-' || c == '–' || c == '—') {
                end--;
            } else {
                break;
            }
        }
        return text.substring(0, end);
    }
}
