package com.lux032.yearresolver.service;

import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;

/**
 * Sets a track's year in Music.app by running {@code osascript}.
 */
@Slf4j
public class AppleScriptTrackYearUpdater implements TrackYearUpdater {

    private static final long TIMEOUT_SECONDS = 30;

    private static final String SCRIPT =
        "on run argv\n" +
        "  set trackId to item 1 of argv\n" +
        "  set newYear to (item 2 of argv) as integer\n" +
        "  tell application \"Music\"\n" +
        "    set matches to (every track of library playlist 1 whose persistent ID is trackId)\n" +
        "    if (count of matches) is 0 then return \"not_found\"\n" +
        "    set theTrack to item 1 of matches\n" +
        "    if year of theTrack is newYear then return \"unchanged\"\n" +
        "    set year of theTrack to newYear\n" +
        "    return \"ok\"\n" +
        "  end tell\n" +
        "end run";

    private final String osascriptCommand;

    public AppleScriptTrackYearUpdater() {
        this("osascript");
    }

    public AppleScriptTrackYearUpdater(String osascriptCommand) {
        this.osascriptCommand = osascriptCommand;
    }

    @Override
    public boolean updateTrackYear(String trackId, String year) throws IOException, InterruptedException {
        ProcessBuilder pb = new ProcessBuilder(osascriptCommand, "-e", SCRIPT, trackId, year);
        pb.redirectErrorStream(true);
        Process process = pb.start();

        String output;
        try (InputStream is = process.getInputStream()) {
            ByteArrayOutputStream buffer = new ByteArrayOutputStream();
            is.transferTo(buffer);
            output = buffer.toString(StandardCharsets.UTF_8).trim();
        }

        if (!process.waitFor(TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
            process.destroyForcibly();
            throw new IOException("osascript timed out updating track " + trackId);
        }
        if (process.exitValue() != 0) {
            throw new IOException("osascript exited with " + process.exitValue() + ": " + output);
        }

        switch (output) {
            case "ok":
            case "unchanged":
                return true;
            case "not_found":
                log.warn("Track {} not found in Music library", trackId);
                return false;
            default:
                log.warn("Unexpected osascript output for track {}: {}", trackId, output);
                return false;
        }
    }
}
