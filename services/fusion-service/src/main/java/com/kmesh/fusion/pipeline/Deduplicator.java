package com.kmesh.fusion.pipeline;

import com.kmesh.fusion.text.TextSimilarity;
import com.kmesh.fusion.text.TextTokens;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.springframework.stereotype.Component;

/**
 * Stage 3. Merges near-identical answers. Candidates are visited strongest first and compared
 * against accepted survivors only; a merged candidate's citation is kept on the survivor.
 *
 * <p>Above {@code bucketingMinItems} candidates are only compared with survivors that share one
 * of their signature terms.
 *
 * <p>Two answers whose negation polarity differs are never merged, however similar they read:
 * "X is deprecated" and "X is not deprecated" can clear the similarity threshold yet disagree.
 * Both stay in the output and the pair is left to the negation rule of
 * {@link com.kmesh.fusion.pipeline.conflict.ConflictDetector}.
 * This is the one case where two items at or above the threshold both survive deduplication.
 */
@Component
public class Deduplicator {
    private static final int SIGNATURE_TERMS = 4;

    private final FusionProperties properties;

    public Deduplicator(FusionProperties properties) {
        this.properties = properties;
    }

    public DedupResult deduplicate(List<TaggedItem> items) {
        double threshold = properties.getDedup().getThreshold();
        List<TaggedItem> ordered = new ArrayList<>(items);
        ordered.sort(TaggedItem.STRONGEST_FIRST);

        boolean bucketing = ordered.size() >= Math.max(1, properties.getDedup().getBucketingMinItems());
        Map<String, List<Integer>> buckets = new HashMap<>();
        List<TaggedItem> survivors = new ArrayList<>();
        List<Boolean> survivorNegated = new ArrayList<>();
        int removed = 0;

        for (TaggedItem candidate : ordered) {
            boolean negated = TextTokens.isNegated(candidate.content());
            Set<String> signature = bucketing ? signature(candidate.content()) : Set.of();
            Integer match = null;
            for (int index : candidateSurvivors(bucketing, signature, buckets, survivors.size())) {
                if (survivorNegated.get(index) != negated) {
                    continue;
                }
                double similarity = TextSimilarity.similarity(survivors.get(index).content(), candidate.content(), threshold);
                if (similarity >= threshold) {
                    match = index;
                    break;
                }
            }
            if (match != null) {
                survivors.set(match, survivors.get(match).withCorroboration(candidate.item().getCitation()));
                removed++;
                continue;
            }
            int position = survivors.size();
            survivors.add(candidate);
            survivorNegated.add(negated);
            for (String term : signature) {
                buckets.computeIfAbsent(term, key -> new ArrayList<>()).add(position);
            }
        }
        return new DedupResult(survivors, removed);
    }

    private Iterable<Integer> candidateSurvivors(
        boolean bucketing,
        Set<String> signature,
        Map<String, List<Integer>> buckets,
        int survivorCount
    ) {
        if (!bucketing) {
            List<Integer> all = new ArrayList<>(survivorCount);
            for (int i = 0; i < survivorCount; i++) {
                all.add(i);
            }
            return all;
        }
        TreeSet<Integer> indices = new TreeSet<>();
        for (String term : signature) {
            List<Integer> bucket = buckets.get(term);
            if (bucket != null) {
                indices.addAll(bucket);
            }
        }
        return indices;
    }

    static Set<String> signature(String content) {
        List<String> terms = new ArrayList<>(TextTokens.contentTerms(content));
        terms.sort(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()));
        return new TreeSet<>(terms.subList(0, Math.min(SIGNATURE_TERMS, terms.size())));
    }
}
