package com.example.shorts_backend.util;

import java.net.URI;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognises YouTube video links and extracts their 11-character video id.
 */
public final class YoutubeUrls {

    private static final String ID = "([a-zA-Z0-9_-]{11})";

    private static final List<Pattern> PATTERNS = List.of(
            Pattern.compile("^(?:https?://)?(?:www\\.|m\\.)?youtube\\.com/watch\\?v=" + ID),
            Pattern.compile("^(?:https?://)?(?:www\\.)?youtube\\.com/embed/" + ID),
            Pattern.compile("^(?:https?://)?(?:www\\.)?youtube\\.com/v/" + ID),
            Pattern.compile("^(?:https?://)?youtu\\.be/" + ID),
            Pattern.compile("^(?:https?://)?(?:www\\.)?youtube\\.com/shorts/" + ID)
    );

    private YoutubeUrls() {
    }

    public static boolean isValid(String url) {
        return extractVideoId(url).isPresent();
    }

    public static Optional<String> extractVideoId(String url) {
        if (url == null || url.isBlank()) {
            return Optional.empty();
        }
        String trimmed = url.trim();
        for (Pattern pattern : PATTERNS) {
            Matcher m = pattern.matcher(trimmed);
            if (m.find()) {
                return Optional.of(m.group(1));
            }
        }
        return fromQueryParameter(trimmed);
    }

    // watch URLs where v= is not the first query parameter
    private static Optional<String> fromQueryParameter(String url) {
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
        String host = uri.getHost();
        String query = uri.getRawQuery();
        if (host == null || query == null || !host.toLowerCase(Locale.ROOT).endsWith("youtube.com")) {
            return Optional.empty();
        }
        for (String pair : query.split("&")) {
            if (pair.startsWith("v=")) {
                String id = pair.substring(2);
                if (id.matches("[a-zA-Z0-9_-]{11}")) {
                    return Optional.of(id);
                }
            }
        }
        return Optional.empty();
    }
}
