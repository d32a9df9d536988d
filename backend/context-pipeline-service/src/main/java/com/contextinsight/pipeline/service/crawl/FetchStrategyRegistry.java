package com.contextinsight.pipeline.service.crawl;

import com.contextinsight.pipeline.exception.PipelineException;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 설정 이름 → FetchStrategy
 */
@Component
public class FetchStrategyRegistry {

    private final Map<String, FetchStrategy> strategies = new LinkedHashMap<>();

    public FetchStrategyRegistry(List<FetchStrategy> strategies) {
        strategies.forEach(s -> this.strategies.put(s.name().toLowerCase(Locale.ROOT), s));
    }

    /**
     * 이름이 비어 있으면 lightweight.
     *
     * @throws PipelineException 알 수 없는 전략 이름
     */
    public FetchStrategy resolve(String name) {
        String key = name == null || name.isBlank()
                ? LightweightFetchStrategy.NAME
                : name.trim().toLowerCase(Locale.ROOT);
        FetchStrategy strategy = strategies.get(key);
        if (strategy == null) {
            throw PipelineException.invalidConfiguration(
                    "Unknown fetch strategy '" + name + "', available: " + strategies.keySet());
        }
        return strategy;
    }
}
