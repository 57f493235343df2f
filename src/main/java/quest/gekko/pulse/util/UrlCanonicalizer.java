package quest.gekko.pulse.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Reduces an article url to the key used for duplicate clustering.
 * {@code canonicalize(canonicalize(u)) == canonicalize(u)} holds for every input.
 */
public final class UrlCanonicalizer {
    private static final Set<String> TRACKING_PARAMS = Set.of("fbclid", "gclid", "igshid", "ref", "ref_src");
    private static final Pattern TRACKING_FALLBACK =
            Pattern.compile("([?&])(utm_[^=&]+|fbclid|gclid|igshid|ref|ref_src)=[^&]*");
    private static final Pattern LEADING_WWW = Pattern.compile("^(www\\.)+");
    private static final Pattern FALLBACK_WWW = Pattern.compile("(^|://)(www\\.)+");

    private UrlCanonicalizer() {}

    public static String canonicalize(String url) {
        if (url == null) return "";
        String trimmed = url.trim();
        if (trimmed.isEmpty()) return "";
        try {
            URI uri = new URI(trimmed);
            if (uri.getScheme() == null || uri.getHost() == null) return fallback(trimmed);

            String host = LEADING_WWW.matcher(uri.getHost().toLowerCase(Locale.ROOT)).replaceFirst("");
            String path = uri.getRawPath() == null ? "" : stripTrailingSlashes(uri.getRawPath());
            String query = filterQuery(uri.getRawQuery());

            StringBuilder sb = new StringBuilder()
                    .append(uri.getScheme().toLowerCase(Locale.ROOT)).append("://").append(host);
            if (uri.getPort() != -1) sb.append(':').append(uri.getPort());
            sb.append(path);
            if (!query.isEmpty()) sb.append('?').append(query);
            return sb.toString();
        } catch (URISyntaxException e) {
            return fallback(trimmed);
        }
    }

    private static String filterQuery(String rawQuery) {
        if (rawQuery == null || rawQuery.isEmpty()) return "";
        List<String> kept = new ArrayList<>();
        for (String pair : rawQuery.split("&")) {
            if (pair.isEmpty()) continue;
            int eq = pair.indexOf('=');
            String key = (eq < 0 ? pair : pair.substring(0, eq)).toLowerCase(Locale.ROOT);
            if (key.startsWith("utm_") || TRACKING_PARAMS.contains(key)) continue;
            kept.add(pair);
        }
        return String.join("&", kept);
    }

    static String fallback(String url) {
        String s = url.toLowerCase(Locale.ROOT);
        int hash = s.indexOf('#');
        if (hash >= 0) s = s.substring(0, hash);
        s = TRACKING_FALLBACK.matcher(s).replaceAll("");
        s = FALLBACK_WWW.matcher(s).replaceFirst("$1");
        return stripTrailingSlashes(s);
    }

    private static String stripTrailingSlashes(String s) {
        int end = s.length();
        while (end > 0 && s.charAt(end - 1) == '/') end--;
        return s.substring(0, end);
    }
}
