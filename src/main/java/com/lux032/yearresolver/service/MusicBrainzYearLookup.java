package com.lux032.yearresolver.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lux032.yearresolver.config.YearResolverConfig;
import com.lux032.yearresolver.model.YearLookupResult;
import com.lux032.yearresolver.util.AlbumNameCleaner;
import com.lux032.yearresolver.util.I18nUtil;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.CloseableHttpResponse;
import org.apache.hc.client5.http.impl.classic.HttpClientBuilder;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.core5.http.HttpHost;
import org.apache.hc.core5.http.ParseException;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.util.Timeout;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Album year lookup against the MusicBrainz release-group search.
 * <p>
 * Picks the earliest first release year among well scored matches. The result is definitive
 * when the best match scores at least {@code musicbrainz.definitiveScore} and its title equals
 * the cleaned album name.
 */
@Slf4j
public class MusicBrainzYearLookup implements AlbumYearLookup {

    private static final long REQUEST_INTERVAL = 1000; // MusicBrainz allows one request per second
    static final int MIN_CANDIDATE_SCORE = 80;
    private static final int SEARCH_LIMIT = 10;

    private final YearResolverConfig config;
    private final AlbumNameCleaner albumNameCleaner;
    private final CloseableHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private long lastRequestTime = 0;

    public MusicBrainzYearLookup(YearResolverConfig config, AlbumNameCleaner albumNameCleaner) {
        this.config = config;
        this.albumNameCleaner = albumNameCleaner;
        this.httpClient = createHttpClient(config);
        this.objectMapper = new ObjectMapper();
    }

    private CloseableHttpClient createHttpClient(YearResolverConfig config) {
        HttpClientBuilder builder = HttpClients.custom();

        RequestConfig requestConfig = RequestConfig.custom()
            .setConnectionRequestTimeout(Timeout.ofSeconds(30))
            .setResponseTimeout(Timeout.ofSeconds(30))
            .build();
        builder.setDefaultRequestConfig(requestConfig);

        if (config.isProxyEnabled() && config.getProxyHost() != null && !config.getProxyHost().isEmpty()) {
            builder.setProxy(new HttpHost(config.getProxyHost(), config.getProxyPort()));
            log.info(I18nUtil.getMessage("proxy.musicbrainz.enabled", config.getProxyHost(), config.getProxyPort()));
        } else if (config.isProxyEnabled()) {
            log.warn(I18nUtil.getMessage("proxy.enabled.no.host"));
        }

        return builder.build();
    }

    @Override
    public YearLookupResult lookupAlbumYear(String artist, String album) throws IOException, InterruptedException {
        String cleanedAlbum = albumNameCleaner.clean(album);
        String query = "releasegroup:\"" + escape(cleanedAlbum) + "\" AND artist:\"" + escape(artist) + "\"";
        String url = String.format("%s/release-group/?query=%s&fmt=json&limit=%d",
            config.getMusicBrainzApiUrl(), URLEncoder.encode(query, StandardCharsets.UTF_8), SEARCH_LIMIT);

        rateLimit();
        String response = executeRequest(url);
        return parseSearchResponse(response, cleanedAlbum);
    }

    YearLookupResult parseSearchResponse(String response, String cleanedAlbum) throws IOException {
        JsonNode root = objectMapper.readTree(response);
        JsonNode groups = root.path("release-groups");
        if (!groups.isArray() || groups.size() == 0) {
            log.debug("No MusicBrainz release groups for '{}'", cleanedAlbum);
            return YearLookupResult.notFound();
        }

        JsonNode best = null;
        String earliestYear = null;
        for (JsonNode group : groups) {
            int score = group.path("score").asInt(0);
            if (best == null || score > best.path("score").asInt(0)) {
                best = group;
            }
            if (score < MIN_CANDIDATE_SCORE) {
                continue;
            }
            String date = group.path("first-release-date").asText("");
            if (date.length() < 4 || !date.substring(0, 4).matches("\\d{4}")) {
                continue;
            }
            String year = date.substring(0, 4);
            if (earliestYear == null || year.compareTo(earliestYear) < 0) {
                earliestYear = year;
            }
        }

        if (earliestYear == null) {
            return YearLookupResult.notFound();
        }

        boolean definitive = best.path("score").asInt(0) >= config.getDefinitiveScore()
            && best.path("title").asText("").equalsIgnoreCase(cleanedAlbum);
        log.debug("MusicBrainz year {} for '{}' (best score {}, definitive={})",
            earliestYear, cleanedAlbum, best.path("score").asInt(0), definitive);
        return new YearLookupResult(earliestYear, definitive);
    }

    private String executeRequest(String url) throws IOException {
        HttpGet httpGet = new HttpGet(url);
        httpGet.setHeader("User-Agent", config.getUserAgent());
        httpGet.setHeader("Accept", "application/json");

        try (CloseableHttpResponse response = httpClient.execute(httpGet)) {
            int statusCode = response.getCode();
            String responseBody = EntityUtils.toString(response.getEntity());
            if (statusCode != 200) {
                log.error("MusicBrainz request failed: {} - {}", statusCode, responseBody);
                throw new IOException("MusicBrainz request failed: " + statusCode);
            }
            return responseBody;
        } catch (ParseException e) {
            throw new IOException("Failed to read MusicBrainz response", e);
        }
    }

    private synchronized void rateLimit() throws InterruptedException {
        long timeSinceLastRequest = System.currentTimeMillis() - lastRequestTime;
        if (timeSinceLastRequest < REQUEST_INTERVAL) {
            Thread.sleep(REQUEST_INTERVAL - timeSinceLastRequest);
        }
        lastRequestTime = System.currentTimeMillis();
    }

    private static String escape(String value) {
        return value.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    @Override
    public void close() {
        try {
            httpClient.close();
        } catch (IOException e) {
            log.warn("Failed to close MusicBrainz HTTP client: {}", e.getMessage());
        }
    }
}
