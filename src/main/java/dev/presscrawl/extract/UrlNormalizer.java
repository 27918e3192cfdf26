package dev.presscrawl.extract;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Canonicalizes article URLs so that the same article always yields the same dedup key.
 * Drops fragments, tracking query params and default ports, and lowercases scheme and host.
 * Paths, including trailing slashes, are kept as published.
 */
public final class UrlNormalizer {

    private static final Logger log = LoggerFactory.getLogger(UrlNormalizer.class);

    private static final Set<String> TRACKING_PARAMS = Set.of(
            "utm_source", "utm_medium", "utm_campaign", "utm_term", "utm_content",
            "fbclid", "gclid", "ref", "source"
    );

    private UrlNormalizer() {
        // utility class
    }

    /**
     * @param url        absolute URL
     * @param stripQuery drop the whole query string rather than only tracking params
     * @return normalized URL, or the input unchanged if it is malformed
     */
    public static String normalize(String url, boolean stripQuery) {
        if (url == null || url.isBlank()) {
            return url;
        }

        URI uri;
        try {
            uri = new URI(url.trim());
        } catch (URISyntaxException e) {
            log.debug("Malformed URL, returning unchanged: {}", url);
            return url;
        }
        if (uri.getScheme() == null || uri.getHost() == null) {
            log.debug("URL missing scheme or host, returning unchanged: {}", url);
            return url;
        }

        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        int port = uri.getPort();
        String path = uri.getRawPath();
        if (path == null || path.isEmpty()) {
            path = "/";
        }
        String query = stripQuery ? null : filterQueryParams(uri.getRawQuery());

        StringBuilder sb = new StringBuilder();
        sb.append(scheme).append("://").append(host);
        if (port != -1 && !isDefaultPort(scheme, port)) {
            sb.append(':').append(port);
        }
        sb.append(path);
        if (query != null) {
            sb.append('?').append(query);
        }
        return sb.toString();
    }

    /**
     * Resolves {@code href} against {@code baseUrl}.
     *
     * @return the absolute http(s) URL, or null if {@code href} is not a usable web link
     */
    public static @Nullable String resolve(String baseUrl, @Nullable String href) {
        if (href == null || href.isBlank()) {
            return null;
        }
        try {
            URI resolved = new URI(baseUrl).resolve(href.trim());
            String scheme = resolved.getScheme();
            if (resolved.getHost() == null || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
                return null;
            }
            return resolved.toString();
        } catch (URISyntaxException | IllegalArgumentException e) {
            log.debug("Cannot resolve {} against {}: {}", href, baseUrl, e.getMessage());
            return null;
        }
    }

    /**
     * Whether both URLs point at the same host, ignoring a leading {@code www.}.
     */
    public static boolean isSameSite(String rootUrl, String candidateUrl) {
        String rootHost = hostOf(rootUrl);
        String candidateHost = hostOf(candidateUrl);
        return rootHost != null && rootHost.equals(candidateHost);
    }

    private static @Nullable String hostOf(String url) {
        try {
            String host = new URI(url).getHost();
            if (host == null) {
                return null;
            }
            host = host.toLowerCase(Locale.ROOT);
            return host.startsWith("www.") ? host.substring(4) : host;
        } catch (URISyntaxException e) {
            return null;
        }
    }

    private static @Nullable String filterQueryParams(@Nullable String query) {
        if (query == null || query.isEmpty()) {
            return null;
        }
        String filtered = Arrays.stream(query.split("&"))
                .filter(param -> !param.isEmpty())
                .filter(param -> {
                    String key = param.contains("=") ? param.substring(0, param.indexOf('=')) : param;
                    return !TRACKING_PARAMS.contains(key.toLowerCase(Locale.ROOT));
                })
                .sorted()
                .collect(Collectors.joining("&"));
        return filtered.isEmpty() ? null : filtered;
    }

    private static boolean isDefaultPort(String scheme, int port) {
        return ("http".equals(scheme) && port == 80)
                || ("https".equals(scheme) && port == 443);
    }
}
