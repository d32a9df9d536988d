package com.contextinsight.pipeline.exception;

/**
 * 랭킹 단계(임베딩/리랭크)를 이번 요청에서 사용할 수 없음.
 * 오류가 아니라 더 저렴한 단계로의 자동 강등 신호다.
 */
public class RankingTierUnavailableException extends PipelineException {

    private final String tierName;

    public RankingTierUnavailableException(String tierName, String message, Throwable cause) {
        super("RANKING_TIER_UNAVAILABLE", message, cause);
        this.tierName = tierName;
    }

    public String getTierName() {
        return tierName;
    }

    public static RankingTierUnavailableException disabled(String tierName) {
        return new RankingTierUnavailableException(tierName, tierName + " is disabled", null);
    }

    public static RankingTierUnavailableException callFailed(String tierName, Throwable cause) {
        return new RankingTierUnavailableException(tierName, tierName + " call failed: " + cause.getMessage(), cause);
    }
}
