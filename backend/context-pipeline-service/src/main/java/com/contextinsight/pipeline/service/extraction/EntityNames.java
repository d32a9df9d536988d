package com.contextinsight.pipeline.service.extraction;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 문서 제목 → 엔티티 이름 / 논리 키
 */
public final class EntityNames {

    private static final Pattern SITE_SUFFIX = Pattern.compile("\\s+(?:\\||-|–|—)\\s+");
    private static final Pattern SECTION_SUFFIX = Pattern.compile(":\\s+");
    private static final Pattern NON_ALNUM = Pattern.compile("[^\\p{L}\\p{N}]+");

    private EntityNames() {
    }

    /**
     * 사이트 접미사(" | Site", " - Site")와 섹션 접미사(": Eligibility") 제거
     */
    public static String displayName(String title) {
        if (title == null) {
            return "";
        }
        String name = SITE_SUFFIX.split(title.trim(), 2)[0];
        name = SECTION_SUFFIX.split(name, 2)[0];
        return name.trim();
    }

    public static String normalize(String name) {
        if (name == null) {
            return "";
        }
        return NON_ALNUM.matcher(name.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
    }

    public static String logicalKey(String topic, String normalizedName) {
        return topic + "::" + normalizedName;
    }
}
