package com.contextinsight.pipeline.service.crawl;

import org.springframework.util.AntPathMatcher;

import java.net.URI;
import java.util.List;
import java.util.Locale;

/**
 * 크롤 제외 패턴 매칭 (대소문자 무시)
 *
 * <ul>
 *   <li>와일드카드 없음: URL 부분 문자열 (예: "/news/")</li>
 *   <li>'/' 없는 와일드카드: 마지막 경로 세그먼트 (예: "*.pdf")</li>
 *   <li>그 외: Ant 스타일 경로 패턴 (예: "/docs/**&#47;*.zip")</li>
 * </ul>
 */
public class UrlExclusionFilter {

    private final List<String> patterns;
    private final AntPathMatcher matcher = new AntPathMatcher();

    public UrlExclusionFilter(List<String> patterns) {
        this.patterns = patterns == null ? List.of() : patterns.stream()
                .filter(p -> p != null && !p.isBlank())
                .map(p -> p.trim().toLowerCase(Locale.ROOT))
                .toList();
    }

    public boolean isExcluded(String url) {
        if (patterns.isEmpty() || url == null) {
            return false;
        }
        String lowerUrl = url.toLowerCase(Locale.ROOT);
        String path = pathOf(lowerUrl);
        String lastSegment = path.substring(path.lastIndexOf('/') + 1);

        for (String pattern : patterns) {
            boolean wildcard = pattern.indexOf('*') >= 0 || pattern.indexOf('?') >= 0;
            if (!wildcard) {
                if (lowerUrl.contains(pattern)) {
                    return true;
                }
            } else if (pattern.indexOf('/') < 0) {
                if (matcher.match(pattern, lastSegment)) {
                    return true;
                }
            } else if (matcher.match(stripLeadingSlash(pattern), stripLeadingSlash(path))) {
                return true;
            }
        }
        return false;
    }

    private static String pathOf(String url) {
        try {
            String path = URI.create(url).getRawPath();
            return path == null || path.isEmpty() ? "/" : path;
        } catch (IllegalArgumentException e) {
            return url;
        }
    }

    private static String stripLeadingSlash(String value) {
        return value.startsWith("/") ? value.substring(1) : value;
    }
}
