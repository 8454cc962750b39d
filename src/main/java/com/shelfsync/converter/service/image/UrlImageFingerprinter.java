package com.shelfsync.converter.service.image;

import com.shelfsync.converter.util.HashUtils;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * Fingerprints by URL rather than by downloaded bytes: SHA-256 of the URL with the scheme and
 * host lower-cased, query and fragment dropped and repeated slashes in the path collapsed.
 */
public class UrlImageFingerprinter implements ImageFingerprinter {

    @Override
    public String fingerprint(String imageUrl) {
        return HashUtils.sha256Hex(normalize(imageUrl));
    }

    static String normalize(String imageUrl) {
        String token = imageUrl.trim();
        try {
            URI uri = new URI(token);
            if (uri.getScheme() == null || uri.getRawAuthority() == null) {
                return stripQuery(token);
            }
            String path = uri.getRawPath() == null ? "" : uri.getRawPath().replaceAll("/{2,}", "/");
            return uri.getScheme().toLowerCase(Locale.ROOT) + "://" + uri.getRawAuthority().toLowerCase(Locale.ROOT) + path;
        } catch (URISyntaxException e) {
            return stripQuery(token);
        }
    }

    private static String stripQuery(String token) {
        int cut = token.length();
        int q = token.indexOf('?');
        int h = token.indexOf('#');
        if (q >= 0) cut = Math.min(cut, q);
        if (h >= 0) cut = Math.min(cut, h);
        return token.substring(0, cut);
    }
}
