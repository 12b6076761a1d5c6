package cadence.source;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Locale;
import java.util.Set;

/**
 * Normalizes song identifiers and search queries into cache keys, so trivially different inputs
 * pointing at the same media share cache entries and in-flight fetches.
 */
public class SongKeys {
    private static final Set<String> TRACKING_PARAMS = Set.of("si", "feature", "pp", "utm_source",
            "utm_medium", "utm_campaign");
    //only meaningful when a single video is requested
    private static final Set<String> YOUTUBE_PLAYLIST_PARAMS = Set.of("list", "index", "start_radio");
    
    private SongKeys() {}
    
    /**
     * Normalizes a song identifier. Urls get a lower case scheme and host, lose the
     * {@code www.} prefix, the fragment and tracking parameters, and {@code youtu.be} links
     * become {@code youtube.com/watch} links. Anything else (local paths, source specific
     * identifiers) is only stripped, since it may be case sensitive.
     *
     * @param input Song identifier.
     *
     * @return The normalized key.
     */
    @Nonnull
    @CheckReturnValue
    public static String normalize(@Nonnull String input) {
        var trimmed = input.strip();
        if(!looksLikeUrl(trimmed)) {
            return trimmed;
        }
        URI uri;
        try {
            uri = new URI(trimmed);
        } catch(URISyntaxException e) {
            return trimmed;
        }
        if(uri.getHost() == null) {
            return trimmed;
        }
        var scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        var host = uri.getHost().toLowerCase(Locale.ROOT);
        if(host.startsWith("www.")) {
            host = host.substring(4);
        }
        var path = uri.getRawPath() == null ? "" : uri.getRawPath();
        var params = new ArrayList<String>();
        if(host.equals("youtu.be") && path.length() > 1) {
            params.add("v=" + path.substring(1));
            host = "youtube.com";
            path = "/watch";
        }
        if(uri.getRawQuery() != null) {
            for(var param : uri.getRawQuery().split("&")) {
                if(param.isEmpty()) continue;
                var name = param.split("=", 2)[0];
                if(TRACKING_PARAMS.contains(name)) continue;
                params.add(param);
            }
        }
        if(isYoutubeVideo(host, path, params)) {
            params.removeIf(p -> YOUTUBE_PLAYLIST_PARAMS.contains(p.split("=", 2)[0]));
        }
        if(path.endsWith("/") && path.length() > 1) {
            path = path.substring(0, path.length() - 1);
        }
        var sb = new StringBuilder(scheme).append("://").append(host);
        if(uri.getPort() != -1) {
            sb.append(':').append(uri.getPort());
        }
        sb.append(path);
        if(!params.isEmpty()) {
            sb.append('?').append(String.join("&", params));
        }
        return sb.toString();
    }
    
    /**
     * Normalizes user input passed to a lookup. Urls are normalized like
     * {@link #normalize(String)}, search queries are lower cased with whitespace collapsed.
     *
     * @param input Url or search query.
     *
     * @return The normalized key.
     */
    @Nonnull
    @CheckReturnValue
    public static String query(@Nonnull String input) {
        var trimmed = input.strip();
        if(looksLikeUrl(trimmed)) {
            return normalize(trimmed);
        }
        return trimmed.replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }
    
    private static boolean isYoutubeVideo(String host, String path, ArrayList<String> params) {
        if(!host.equals("youtube.com") && !host.equals("m.youtube.com") && !host.equals("music.youtube.com")) {
            return false;
        }
        return path.equals("/watch") && params.stream().anyMatch(p -> p.startsWith("v="));
    }
    
    private static boolean looksLikeUrl(String s) {
        var lower = s.toLowerCase(Locale.ROOT);
        return lower.startsWith("http://") || lower.startsWith("https://");
    }
}
