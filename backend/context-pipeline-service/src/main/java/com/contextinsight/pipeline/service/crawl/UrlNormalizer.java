package com.contextinsight.pipeline.service.crawl;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Optional;

/**
 * URL 정규화.
 *
 * scheme/host 소문자, 기본 포트 제거, fragment 제거, 빈 경로는 "/".
 * http/https 외 스킴은 버린다.
 */
public final class UrlNormalizer {

    private UrlNormalizer() {
    }

    public static Optional<String> normalize(String url) {
        if (url == null || url.isBlank()) {
            return Optional.empty();
        }
        try {
            URI uri = new URI(url.trim()).normalize();
            String scheme = uri.getScheme();
            String host = uri.getHost();
            if (scheme == null || host == null) {
                return Optional.empty();
            }
            scheme = scheme.toLowerCase(Locale.ROOT);
            if (!scheme.equals("http") && !scheme.equals("https")) {
                return Optional.empty();
            }

            StringBuilder sb = new StringBuilder()
                    .append(scheme)
                    .append("://")
                    .append(host.toLowerCase(Locale.ROOT));

            int port = uri.getPort();
            if (port != -1 && !isDefaultPort(scheme, port)) {
                sb.append(':').append(port);
            }

            String path = uri.getRawPath();
            sb.append(path == null || path.isEmpty() ? "/" : path);

            if (uri.getRawQuery() != null && !uri.getRawQuery().isEmpty()) {
                sb.append('?').append(uri.getRawQuery());
            }
            return Optional.of(sb.toString());
        } catch (URISyntaxException e) {
            return Optional.empty();
        }
    }

    /**
     * scheme + host + port 동일 여부
     */
    public static boolean sameOrigin(String a, String b) {
        String originA = originOf(a);
        return originA != null && originA.equals(originOf(b));
    }

    public static String hostOf(String url) {
        try {
            String host = new URI(url).getHost();
            return host != null ? host.toLowerCase(Locale.ROOT) : "";
        } catch (URISyntaxException e) {
            return "";
        }
    }

    private static String originOf(String url) {
        Optional<String> normalized = normalize(url);
        if (normalized.isEmpty()) {
            return null;
        }
        URI uri = URI.create(normalized.get());
        return uri.getScheme() + "://" + uri.getHost() + (uri.getPort() != -1 ? ":" + uri.getPort() : "");
    }

    private static boolean isDefaultPort(String scheme, int port) {
        return (scheme.equals("http") && port == 80) || (scheme.equals("https") && port == 443);
    }
}
