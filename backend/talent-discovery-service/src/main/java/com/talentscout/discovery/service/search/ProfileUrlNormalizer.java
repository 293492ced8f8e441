package com.talentscout.discovery.service.search;

import com.talentscout.discovery.config.DiscoveryProperties;
import com.talentscout.discovery.dto.ProfileUrl;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonicalizes raw search-result links and keeps only public profile URLs.
 *
 * <p>Canonical form is {@code scheme://host/path} with lower-case scheme and host,
 * no query, no fragment and no trailing slash. A link is a profile when its host is
 * the profile domain (or a subdomain of it), its path starts with the profile prefix
 * and the rest of the path is a single identifier of at least two
 * {@code [A-Za-z0-9_-]} characters.
 *
 * <p>Rejection is a normal outcome and returns {@code null}.
 */
@Component
@Slf4j
public class ProfileUrlNormalizer {

    static final String REDIRECT_MARKER = "/url?q=";

    private static final Pattern PROFILE_ID = Pattern.compile("^[A-Za-z0-9\\-_]{2,}$");

    private final String profileDomain;
    private final String pathPrefix;

    @Autowired
    public ProfileUrlNormalizer(DiscoveryProperties properties) {
        this(properties.getProfile().getDomain(), properties.getProfile().getPathPrefix());
    }

    public ProfileUrlNormalizer(String profileDomain, String pathPrefix) {
        this.profileDomain = profileDomain.toLowerCase(Locale.ROOT);
        this.pathPrefix = pathPrefix.endsWith("/") ? pathPrefix : pathPrefix + "/";
    }

    public ProfileUrl normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }

        String candidate = unwrapRedirect(raw.trim());
        if (candidate == null) {
            return null;
        }

        URI uri;
        try {
            uri = new URI(candidate);
        } catch (URISyntaxException e) {
            log.debug("Unparseable link {}: {}", raw, e.getMessage());
            return null;
        }

        String scheme = uri.getScheme();
        String host = uri.getHost();
        String path = uri.getRawPath();
        if (scheme == null || host == null || path == null) {
            return null;
        }

        scheme = scheme.toLowerCase(Locale.ROOT);
        host = host.toLowerCase(Locale.ROOT);
        if (!"http".equals(scheme) && !"https".equals(scheme)) {
            return null;
        }
        if (!isProfileHost(host)) {
            return null;
        }

        path = stripTrailingSlashes(path);
        if (!path.startsWith(pathPrefix)) {
            return null;
        }

        String profileId = path.substring(pathPrefix.length());
        if (!PROFILE_ID.matcher(profileId).matches()) {
            return null;
        }

        String authority = uri.getPort() == -1 ? host : host + ":" + uri.getPort();
        return new ProfileUrl(scheme + "://" + authority + path, profileId);
    }

    public boolean isValid(String raw) {
        return normalize(raw) != null;
    }

    /**
     * Extracts the target of a {@code /url?q=<target>&...} search redirect.
     * Other links are returned unchanged.
     */
    public static String unwrapRedirect(String link) {
        int marker = link.indexOf(REDIRECT_MARKER);
        if (marker < 0) {
            return link;
        }
        String target = link.substring(marker + REDIRECT_MARKER.length());
        int end = target.indexOf('&');
        if (end >= 0) {
            target = target.substring(0, end);
        }
        return percentDecode(target);
    }

    /**
     * Percent-decodes without turning {@code +} into a space.
     */
    public static String percentDecode(String value) {
        try {
            return URLDecoder.decode(value.replace("+", "%2B"), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            log.debug("Malformed percent-encoding in {}", value);
            return null;
        }
    }

    private boolean isProfileHost(String host) {
        return host.equals(profileDomain) || host.endsWith("." + profileDomain);
    }

    private static String stripTrailingSlashes(String path) {
        int end = path.length();
        while (end > 0 && path.charAt(end - 1) == '/') {
            end--;
        }
        return path.substring(0, end);
    }
}
