package com.kmesh.fusion.pipeline;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Stage 2. Per-agent min-max normalization. An agent whose items all share one score
 * normalizes every item to 0.5.
 */
@Component
public class ScoreNormalizer {
    static final double TIED_SCORE = 0.5;

    public List<TaggedItem> normalize(List<TaggedItem> items) {
        Map<String, double[]> rangeByAgent = new LinkedHashMap<>();
        for (TaggedItem item : items) {
            double score = item.rawScore();
            double[] range = rangeByAgent.get(item.agentId());
            if (range == null) {
                rangeByAgent.put(item.agentId(), new double[] {score, score});
            } else {
                range[0] = Math.min(range[0], score);
                range[1] = Math.max(range[1], score);
            }
        }

        List<TaggedItem> normalized = new ArrayList<>(items.size());
        for (TaggedItem item : items) {
            double[] range = rangeByAgent.get(item.agentId());
            double min = range[0];
            double max = range[1];
            double value = max == min ? TIED_SCORE : (item.rawScore() - min) / (max - min);
            normalized.add(item.withNormalizedScore(value));
        }
        return normalized;
    }
}
