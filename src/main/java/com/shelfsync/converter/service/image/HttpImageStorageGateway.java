package com.shelfsync.converter.service.image;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;

/**
 * Deletes images through {@code DELETE {base}/api/images/{name}} with the storage bearer token.
 *
 * <p>Only absolute URLs on the storage origin, or relative {@code images/...} paths, whose path
 * is {@code /api/images/<name>} or {@code /images/<name>} are eligible. The name must be a single
 * segment without {@code ..}.
 */
public class HttpImageStorageGateway implements ImageStorageGateway {
    private static final Logger log = LoggerFactory.getLogger(HttpImageStorageGateway.class);

    private final WebClient storageClient;
    private final String origin;
    private final Duration timeout;

    public HttpImageStorageGateway(WebClient storageClient, String baseUrl, Duration timeout) {
        this.storageClient = storageClient;
        this.origin = originOf(baseUrl);
        this.timeout = timeout;
    }

    static String originOf(String baseUrl) {
        try {
            URI uri = new URI(baseUrl.trim());
            String scheme = uri.getScheme();
            if (scheme == null || uri.getRawAuthority() == null
                    || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
                throw new IllegalArgumentException("storage base-url must be an http(s) URL: " + baseUrl);
            }
            return scheme.toLowerCase() + "://" + uri.getRawAuthority().toLowerCase();
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("storage base-url must be an http(s) URL: " + baseUrl, e);
        }
    }

    @Override
    public boolean isManaged(String url) {
        return imageName(url).isPresent();
    }

    @Override
    public Optional<String> assetName(String url) {
        return imageName(url);
    }

    Optional<String> imageName(String url) {
        if (url == null || url.isBlank()) return Optional.empty();
        String token = url.trim();
        String path;
        try {
            URI uri = new URI(token);
            if (uri.getScheme() != null || uri.getRawAuthority() != null) {
                if (uri.getScheme() == null || uri.getRawAuthority() == null) return Optional.empty();
                String urlOrigin = uri.getScheme().toLowerCase() + "://" + uri.getRawAuthority().toLowerCase();
                if (!urlOrigin.equals(origin)) return Optional.empty();
                path = uri.getRawPath();
            } else {
                path = uri.getRawPath();
            }
        } catch (URISyntaxException e) {
            return Optional.empty();
        }
        if (path == null) return Optional.empty();

        String name;
        if (path.startsWith("/api/images/")) name = path.substring("/api/images/".length());
        else if (path.startsWith("/images/")) name = path.substring("/images/".length());
        else if (path.startsWith("images/")) name = path.substring("images/".length());
        else return Optional.empty();

        name = URLDecoder.decode(name.replace("+", "%2B"), StandardCharsets.UTF_8).trim();
        if (name.isEmpty() || name.contains("/") || name.contains("\\") || name.contains("..")) {
            return Optional.empty();
        }
        return Optional.of(name);
    }

    @Override
    public void delete(String url) {
        String name = imageName(url)
                .orElseThrow(() -> new IllegalArgumentException("Not a managed storage URL: " + url));
        try {
            storageClient.delete()
                    .uri(builder -> builder.path("/api/images/{name}").build(name))
                    .retrieve()
                    .toBodilessEntity()
                    .then()
                    .onErrorResume(WebClientResponseException.NotFound.class, e -> {
                        log.debug("Image {} already absent from storage", name);
                        return Mono.empty();
                    })
                    .timeout(timeout)
                    .block();
            log.debug("Deleted duplicate image {} from storage", name);
        } catch (RuntimeException e) {
            throw new ImageDeleteException(url, "Storage delete failed for " + name + ": " + e.getMessage(), e);
        }
    }
}
