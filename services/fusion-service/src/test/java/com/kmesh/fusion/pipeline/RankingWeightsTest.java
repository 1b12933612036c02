package com.kmesh.fusion.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class RankingWeightsTest {

    @Test
    void defaultsAreValid() {
        RankingWeights weights = RankingWeights.from(new FusionProperties().getRanking());

        assertThat(weights.normalizedScore()).isEqualTo(0.50);
        assertThat(weights.corroboration()).isEqualTo(0.15);
        assertThat(weights.recency()).isEqualTo(0.15);
        assertThat(weights.domainRelevance()).isEqualTo(0.10);
        assertThat(weights.length()).isEqualTo(0.10);
        assertThat(weights.recencyDecayDays()).isEqualTo(90.0);
    }

    @Test
    void rejectsWeightsThatDoNotSumToOne() {
        FusionProperties.Ranking ranking = new FusionProperties().getRanking();
        ranking.setRecencyWeight(0.30);

        assertThatThrownBy(() -> RankingWeights.from(ranking))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("sum to 1.0");
    }

    @Test
    void rejectsNegativeWeightsAndDecay() {
        assertThatThrownBy(() -> new RankingWeights(0.7, -0.1, 0.2, 0.1, 0.1, 90.0))
            .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> new RankingWeights(0.5, 0.15, 0.15, 0.1, 0.1, 0.0))
            .isInstanceOf(IllegalStateException.class);
    }
}
