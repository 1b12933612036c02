package com.kmesh.fusion.pipeline;

/**
 * Composite ranking weights. Construction fails unless the weights sum to 1.0.
 */
public record RankingWeights(
    double normalizedScore,
    double corroboration,
    double recency,
    double domainRelevance,
    double length,
    double recencyDecayDays
) {
    private static final double SUM_TOLERANCE = 1e-9;

    public RankingWeights {
        double[] weights = {normalizedScore, corroboration, recency, domainRelevance, length};
        double sum = 0.0;
        for (double weight : weights) {
            if (weight < 0.0 || Double.isNaN(weight)) {
                throw new IllegalStateException("ranking weights must be non-negative, got " + weight);
            }
            sum += weight;
        }
        if (Math.abs(sum - 1.0) > SUM_TOLERANCE) {
            throw new IllegalStateException("ranking weights must sum to 1.0, got " + sum);
        }
        if (!(recencyDecayDays > 0.0)) {
            throw new IllegalStateException("recency decay days must be positive, got " + recencyDecayDays);
        }
    }

    public static RankingWeights from(FusionProperties.Ranking ranking) {
        return new RankingWeights(
            ranking.getNormalizedScoreWeight(),
            ranking.getCorroborationWeight(),
            ranking.getRecencyWeight(),
            ranking.getDomainRelevanceWeight(),
            ranking.getLengthWeight(),
            ranking.getRecencyDecayDays()
        );
    }
}
