package com.contextinsight.pipeline.service.extraction;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 엔티티 문서의 구조화 필드 추출 규칙.
 *
 * 필드마다 규칙 목록을 순서대로 적용해 처음 유효한 값을 쓴다.
 * 범위를 벗어난 숫자는 버리고 다음 매치/규칙으로 넘어간다.
 */
@Component
public class FieldExtractionRules {

    public static final String AGE_MIN = "ageMin";
    public static final String AGE_MAX = "ageMax";
    public static final String EDUCATION = "education";
    public static final String EXPERIENCE_YEARS = "experienceYears";
    public static final String FEE = "fee";
    public static final String PROCESSING_TIME = "processingTime";
    public static final String LANGUAGE_TEST = "languageTest";

    public static final List<String> FIELD_ORDER = List.of(
            AGE_MIN, AGE_MAX, EDUCATION, EXPERIENCE_YEARS, FEE, PROCESSING_TIME, LANGUAGE_TEST);

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private static final String AGE_RANGE_AGED = "\\bage[sd]?\\s+(?:between\\s+|from\\s+)?(\\d{1,3})\\s*(?:and|to|-|–)\\s*(\\d{1,3})\\b";
    private static final String AGE_RANGE_BETWEEN = "\\bbetween\\s+(\\d{1,3})\\s+and\\s+(\\d{1,3})\\s+years?\\s+(?:old|of\\s+age)";
    private static final String AGE_RANGE_DASH = "\\b(\\d{1,3})\\s*(?:-|–|to)\\s*(\\d{1,3})\\s+years?\\s+(?:old|of\\s+age)";

    private static final String UPPER_BOUND = "(?:under|below|younger\\s+than|less\\s+than|no\\s+older\\s+than|not\\s+older\\s+than)";
    private static final String LOWER_BOUND = "(?:at\\s+least|over|above|older\\s+than|a\\s+minimum\\s+of)";

    private static final String CURRENCY_SYMBOL = "(US\\$|CA\\$|C\\$|A\\$|AU\\$|NZ\\$|\\$|€|£)";
    private static final String CURRENCY_CODE = "(USD|CAD|AUD|EUR|GBP|NZD|AED|SGD)";
    private static final String AMOUNT = "(\\d[\\d,]*(?:\\.\\d{1,2})?)";
    private static final String FEE_WORD = "\\b(?:fee|fees|cost|costs|charge|charges|price)\\b";
    private static final String TIME_UNIT = "(business\\s+days|working\\s+days|days|weeks|months)";

    private static final BigDecimal MAX_FEE = new BigDecimal("1000000");

    private static final Pattern FEE_VALUE = Pattern.compile(
            "^\\s*(?:" + CURRENCY_SYMBOL + "|" + CURRENCY_CODE + ")?\\s?" + AMOUNT + "\\s?" + CURRENCY_CODE + "?\\s*$", FLAGS);
    private static final Pattern PROCESSING_VALUE = Pattern.compile(
            "^\\s*(\\d{1,3})(?:\\s*(?:-|–|to)\\s*(\\d{1,3}))?\\s+" + TIME_UNIT + "\\s*$", FLAGS);
    private static final Pattern LANGUAGE_VALUE = Pattern.compile(
            "\\b(IELTS|TOEFL(?:\\s+iBT)?|PTE(?:\\s+Academic)?)\\b[^.\\d]{0,40}?(\\d{1,3}(?:\\.\\d)?)", FLAGS);

    /** 학력 우선순위 (높은 순) */
    private static final Map<String, Pattern> EDUCATION_LEVELS = new LinkedHashMap<>();

    static {
        EDUCATION_LEVELS.put("phd", Pattern.compile("\\b(?:ph\\.?\\s?d|doctorate|doctoral\\s+degree)\\b", FLAGS));
        EDUCATION_LEVELS.put("masters", Pattern.compile("\\bmaster(?:'s|s|’s)?(?:\\s+degree)?\\b", FLAGS));
        EDUCATION_LEVELS.put("bachelors", Pattern.compile("\\b(?:bachelor(?:'s|s|’s)?|undergraduate\\s+degree)\\b", FLAGS));
        EDUCATION_LEVELS.put("diploma", Pattern.compile("\\b(?:diploma|associate\\s+degree|trade\\s+certificate)\\b", FLAGS));
        EDUCATION_LEVELS.put("secondary", Pattern.compile("\\b(?:high\\s+school|secondary\\s+(?:school|education)|year\\s+12)\\b", FLAGS));
    }

    @FunctionalInterface
    interface FieldRule {
        Optional<String> apply(String text);
    }

    private final Map<String, List<FieldRule>> rules = new LinkedHashMap<>();

    public FieldExtractionRules() {
        rules.put(AGE_MIN, List.of(
                numeric(AGE_RANGE_AGED, 1, 10, 100),
                numeric(AGE_RANGE_BETWEEN, 1, 10, 100),
                numeric(AGE_RANGE_DASH, 1, 10, 100),
                numeric("\\b" + LOWER_BOUND + "\\s+the\\s+age\\s+of\\s+(\\d{1,3})\\b", 1, 10, 100),
                numeric("\\b" + LOWER_BOUND + "\\s+(\\d{1,3})\\s+years?\\s+(?:old|of\\s+age)", 1, 10, 100),
                numeric("\\bminimum\\s+age\\s*(?:of|is|:)?\\s*(\\d{1,3})\\b", 1, 10, 100),
                numeric("\\baged?\\s+(\\d{1,3})\\s+or\\s+(?:older|over|above)", 1, 10, 100),
                numeric("\\b(\\d{1,3})\\s+years?\\s+(?:old|of\\s+age)\\s+or\\s+(?:older|over|more)", 1, 10, 100)));

        rules.put(AGE_MAX, List.of(
                numeric(AGE_RANGE_AGED, 2, 10, 100),
                numeric(AGE_RANGE_BETWEEN, 2, 10, 100),
                numeric(AGE_RANGE_DASH, 2, 10, 100),
                numeric("\\b" + UPPER_BOUND + "\\s+the\\s+age\\s+of\\s+(\\d{1,3})\\b", 1, 10, 100),
                numeric("\\b" + UPPER_BOUND + "\\s+(\\d{1,3})\\s+years?\\s+(?:old|of\\s+age)", 1, 10, 100),
                numeric("\\bmaximum\\s+age\\s*(?:of|is|:)?\\s*(\\d{1,3})\\b", 1, 10, 100),
                numeric("\\b(\\d{1,3})\\s+years?\\s+(?:old|of\\s+age)\\s+or\\s+(?:younger|under|less)", 1, 10, 100)));

        rules.put(EDUCATION, List.of(FieldExtractionRules::education));

        rules.put(EXPERIENCE_YEARS, List.of(
                numeric("\\b(\\d{1,2})\\+?\\s+years?(?:'|’)?\\s+(?:of\\s+)?(?:[a-z-]+\\s+){0,3}?experience", 1, 0, 50),
                numeric("\\bexperience\\s+of\\s+(?:at\\s+least\\s+)?(\\d{1,2})\\s+years?", 1, 0, 50)));

        rules.put(FEE, List.of(
                fee(FEE_WORD + "[^.$€£\\d]{0,40}?" + CURRENCY_SYMBOL + "\\s?" + AMOUNT, 1, 2, false),
                fee(CURRENCY_SYMBOL + "\\s?" + AMOUNT + "\\s+(?:[a-z]+\\s+)?(?:fee|fees|charge)\\b", 1, 2, false),
                fee(FEE_WORD + "[^.\\d]{0,40}?" + AMOUNT + "\\s?" + CURRENCY_CODE + "\\b", 2, 1, true)));

        rules.put(PROCESSING_TIME, List.of(
                processingTime("\\bprocess\\w*(?:\\s+times?)?[\\s:]+(?:(?:is|are|of|takes?|will\\s+take)\\s+)?"
                        + "(?:(?:usually|about|approximately|around|up\\s+to|within)\\s+)?"
                        + "(\\d{1,3})(?:\\s*(?:-|–|to)\\s*(\\d{1,3}))?\\s+" + TIME_UNIT + "\\b"),
                processingTime("\\b(\\d{1,3})(?:\\s*(?:-|–|to)\\s*(\\d{1,3}))?\\s+" + TIME_UNIT + "\\s+(?:to\\s+)?process")));

        rules.put(LANGUAGE_TEST, List.of(
                languageTest(LANGUAGE_VALUE, 1, 2),
                languageTest(Pattern.compile("\\b(\\d{1,3}(?:\\.\\d)?)\\s+(?:overall\\s+)?(?:band\\s+)?(?:score\\s+)?"
                        + "(?:in|on|for)?\\s*(?:the\\s+)?(IELTS|TOEFL|PTE)\\b", FLAGS), 2, 1)));
    }

    /**
     * 필드 추출. 결과는 FIELD_ORDER 순서의 맵.
     */
    public Map<String, String> extract(String text) {
        Map<String, String> fields = new LinkedHashMap<>();
        if (text == null || text.isBlank()) {
            return fields;
        }
        String normalized = text.replaceAll("\\s+", " ");

        rules.forEach((field, fieldRules) -> {
            for (FieldRule rule : fieldRules) {
                Optional<String> value = rule.apply(normalized);
                if (value.isPresent()) {
                    fields.put(field, value.get());
                    break;
                }
            }
        });

        dropInvertedAgeRange(fields);
        return fields;
    }

    /**
     * 외부(LLM) 추출 값에 같은 검증 적용. 정규화된 값 또는 빈 Optional.
     */
    public Optional<String> validate(String field, String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        return switch (field) {
            case AGE_MIN, AGE_MAX -> integerInRange(trimmed, 10, 100);
            case EXPERIENCE_YEARS -> integerInRange(trimmed, 0, 50);
            case EDUCATION -> EDUCATION_LEVELS.containsKey(trimmed.toLowerCase(Locale.ROOT))
                    ? Optional.of(trimmed.toLowerCase(Locale.ROOT))
                    : education(trimmed);
            case FEE -> validateFee(trimmed);
            case PROCESSING_TIME -> matchProcessingTime(PROCESSING_VALUE.matcher(trimmed));
            case LANGUAGE_TEST -> matchLanguageTest(LANGUAGE_VALUE.matcher(trimmed), 1, 2);
            default -> Optional.empty();
        };
    }

    /**
     * ageMin &gt; ageMax 이면 둘 다 버린다
     */
    void dropInvertedAgeRange(Map<String, String> fields) {
        if (fields.containsKey(AGE_MIN) && fields.containsKey(AGE_MAX)
                && Integer.parseInt(fields.get(AGE_MIN)) > Integer.parseInt(fields.get(AGE_MAX))) {
            fields.remove(AGE_MIN);
            fields.remove(AGE_MAX);
        }
    }

    // ========== rule factories ==========

    private static FieldRule numeric(String regex, int group, int min, int max) {
        Pattern pattern = Pattern.compile(regex, FLAGS);
        return text -> {
            Matcher m = pattern.matcher(text);
            while (m.find()) {
                Optional<String> value = integerInRange(m.group(group), min, max);
                if (value.isPresent()) {
                    return value;
                }
            }
            return Optional.empty();
        };
    }

    private static Optional<String> education(String text) {
        for (Map.Entry<String, Pattern> level : EDUCATION_LEVELS.entrySet()) {
            if (level.getValue().matcher(text).find()) {
                return Optional.of(level.getKey());
            }
        }
        return Optional.empty();
    }

    private static FieldRule fee(String regex, int currencyGroup, int amountGroup, boolean codeSuffix) {
        Pattern pattern = Pattern.compile(regex, FLAGS);
        return text -> {
            Matcher m = pattern.matcher(text);
            while (m.find()) {
                Optional<String> value = renderFee(m.group(currencyGroup), m.group(amountGroup), codeSuffix);
                if (value.isPresent()) {
                    return value;
                }
            }
            return Optional.empty();
        };
    }

    private static FieldRule processingTime(String regex) {
        Pattern pattern = Pattern.compile(regex, FLAGS);
        return text -> matchProcessingTime(pattern.matcher(text));
    }

    private static FieldRule languageTest(Pattern pattern, int testGroup, int scoreGroup) {
        return text -> matchLanguageTest(pattern.matcher(text), testGroup, scoreGroup);
    }

    // ========== validation ==========

    private static Optional<String> integerInRange(String raw, int min, int max) {
        try {
            int value = Integer.parseInt(raw.trim());
            return value >= min && value <= max ? Optional.of(String.valueOf(value)) : Optional.empty();
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static Optional<String> validateFee(String value) {
        Matcher m = FEE_VALUE.matcher(value);
        if (!m.matches()) {
            return Optional.empty();
        }
        if (m.group(1) != null) {
            return renderFee(m.group(1), m.group(3), false);
        }
        String code = m.group(2) != null ? m.group(2) : m.group(4);
        return code != null ? renderFee(code, m.group(3), true) : Optional.empty();
    }

    private static Optional<String> renderFee(String currency, String rawAmount, boolean code) {
        if (currency == null || rawAmount == null) {
            return Optional.empty();
        }
        BigDecimal amount;
        try {
            amount = new BigDecimal(rawAmount.replace(",", ""));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
        if (amount.signum() <= 0 || amount.compareTo(MAX_FEE) >= 0) {
            return Optional.empty();
        }
        String plain = amount.stripTrailingZeros().scale() <= 0
                ? amount.setScale(0, RoundingMode.UNNECESSARY).toPlainString()
                : amount.setScale(2, RoundingMode.HALF_UP).toPlainString();
        return Optional.of(code
                ? currency.toUpperCase(Locale.ROOT) + " " + plain
                : currency.toUpperCase(Locale.ROOT) + plain);
    }

    private static Optional<String> matchProcessingTime(Matcher m) {
        while (m.find()) {
            int from = Integer.parseInt(m.group(1));
            Integer to = m.group(2) != null ? Integer.parseInt(m.group(2)) : null;
            if (from <= 0 || (to != null && to < from)) {
                continue;
            }
            String unit = m.group(3).toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
            return Optional.of(to != null ? from + "-" + to + " " + unit : from + " " + unit);
        }
        return Optional.empty();
    }

    private static Optional<String> matchLanguageTest(Matcher m, int testGroup, int scoreGroup) {
        while (m.find()) {
            String test = m.group(testGroup).trim().split("\\s+")[0].toUpperCase(Locale.ROOT);
            BigDecimal score;
            try {
                score = new BigDecimal(m.group(scoreGroup));
            } catch (NumberFormatException e) {
                continue;
            }
            if (inLanguageRange(test, score)) {
                return Optional.of(test + " " + score.stripTrailingZeros().toPlainString());
            }
        }
        return Optional.empty();
    }

    private static boolean inLanguageRange(String test, BigDecimal score) {
        return switch (test) {
            case "IELTS" -> score.compareTo(BigDecimal.ZERO) >= 0 && score.compareTo(new BigDecimal("9")) <= 0;
            case "TOEFL" -> score.compareTo(BigDecimal.ZERO) >= 0 && score.compareTo(new BigDecimal("120")) <= 0;
            case "PTE" -> score.compareTo(BigDecimal.TEN) >= 0 && score.compareTo(new BigDecimal("90")) <= 0;
            default -> false;
        };
    }
}
