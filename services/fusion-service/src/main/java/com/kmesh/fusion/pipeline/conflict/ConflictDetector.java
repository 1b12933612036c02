package com.kmesh.fusion.pipeline.conflict;

import com.kmesh.fusion.api.dto.SourceCitation;
import com.kmesh.fusion.pipeline.FusionProperties;
import com.kmesh.fusion.pipeline.TaggedItem;
import com.kmesh.fusion.text.TermVectorEmbedder;
import com.kmesh.fusion.text.TextSimilarity;
import com.kmesh.fusion.text.TextTokens;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import org.springframework.stereotype.Component;

/**
 * Finds contradicting cross-domain pairs and closes them transitively into groups.
 *
 * <p>Rules: same cited entity with different content, the same event with incompatible dates,
 * one side negating the other, and (when enabled) two query-relevant answers whose term
 * vectors are nearly orthogonal.
 */
@Component
public class ConflictDetector {
    public static final String SAME_ENTITY = "same_entity";
    public static final String TEMPORAL_MISMATCH = "temporal_mismatch";
    public static final String NEGATION = "negation";
    public static final String SEMANTIC_OPPOSITION = "semantic_opposition";

    private static final List<String> ENTITY_KEYS = List.of("entity", "symbol");

    private final FusionProperties properties;
    private final TermVectorEmbedder embedder;

    public ConflictDetector(FusionProperties properties, TermVectorEmbedder embedder) {
        this.properties = properties;
        this.embedder = embedder;
    }

    public List<ConflictGroup> detect(List<TaggedItem> items, String queryText) {
        int n = items.size();
        if (n < 2) {
            return List.of();
        }
        FusionProperties.Conflict config = properties.getConflict();
        Set<String> queryTerms = TextTokens.contentTerms(queryText);
        List<Features> features = new ArrayList<>(n);
        for (TaggedItem item : items) {
            features.add(new Features(item, queryTerms, embedder));
        }

        int[] parent = new int[n];
        for (int i = 0; i < n; i++) {
            parent[i] = i;
        }
        Map<Integer, Set<String>> reasonsByRoot = new TreeMap<>();
        List<int[]> pairs = new ArrayList<>();
        List<Set<String>> pairReasons = new ArrayList<>();

        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                Features a = features.get(i);
                Features b = features.get(j);
                if (a.item.domainId().equals(b.item.domainId())) {
                    continue;
                }
                Set<String> reasons = reasons(a, b, queryTerms, config);
                if (!reasons.isEmpty()) {
                    union(parent, i, j);
                    pairs.add(new int[] {i, j});
                    pairReasons.add(reasons);
                }
            }
        }
        if (pairs.isEmpty()) {
            return List.of();
        }

        for (int p = 0; p < pairs.size(); p++) {
            int root = find(parent, pairs.get(p)[0]);
            reasonsByRoot.computeIfAbsent(root, key -> new TreeSet<>()).addAll(pairReasons.get(p));
        }

        Map<Integer, List<Integer>> membersByRoot = new TreeMap<>();
        for (int i = 0; i < n; i++) {
            int root = find(parent, i);
            if (reasonsByRoot.containsKey(root)) {
                membersByRoot.computeIfAbsent(root, key -> new ArrayList<>()).add(i);
            }
        }

        List<ConflictGroup> groups = new ArrayList<>();
        for (Map.Entry<Integer, List<Integer>> entry : membersByRoot.entrySet()) {
            List<Integer> members = entry.getValue();
            Collections.sort(members);
            groups.add(new ConflictGroup(members, new ArrayList<>(reasonsByRoot.get(entry.getKey()))));
        }
        groups.sort((left, right) -> Integer.compare(left.members().get(0), right.members().get(0)));
        return groups;
    }

    private Set<String> reasons(Features a, Features b, Set<String> queryTerms, FusionProperties.Conflict config) {
        Set<String> reasons = new TreeSet<>();
        if (sameEntity(a, b) && !a.tokens.equals(b.tokens)) {
            reasons.add(SAME_ENTITY);
        }
        if (temporalMismatch(a, b, config.getTemporalOverlap())) {
            reasons.add(TEMPORAL_MISMATCH);
        }
        if (a.negated != b.negated && TextSimilarity.jaccard(a.terms, b.terms) >= config.getNegationOverlap()) {
            reasons.add(NEGATION);
        }
        if (config.isSemanticOppositionEnabled()
            && !queryTerms.isEmpty()
            && a.queryCoverage >= config.getQueryCoverage()
            && b.queryCoverage >= config.getQueryCoverage()
            && TermVectorEmbedder.cosine(a.vector, b.vector) < config.getUnrelatedFloor()) {
            reasons.add(SEMANTIC_OPPOSITION);
        }
        return reasons;
    }

    private boolean sameEntity(Features a, Features b) {
        SourceCitation citationA = a.item.item().getCitation();
        SourceCitation citationB = b.item.item().getCitation();
        String pathA = citationA.getSourcePath();
        if (pathA != null && !pathA.isBlank() && pathA.equals(citationB.getSourcePath())) {
            return true;
        }
        for (String key : ENTITY_KEYS) {
            String valueA = metadataText(a.item, key);
            if (valueA != null && valueA.equals(metadataText(b.item, key))) {
                return true;
            }
        }
        return false;
    }

    private boolean temporalMismatch(Features a, Features b, double minOverlap) {
        String eventA = metadataText(a.item, "event");
        if (eventA != null && eventA.equals(metadataText(b.item, "event"))) {
            String timeA = metadataText(a.item, "event_time");
            String timeB = metadataText(b.item, "event_time");
            if (timeA != null && timeB != null && !timeA.equals(timeB)) {
                return true;
            }
        }
        if (a.dates.isEmpty() || b.dates.isEmpty()) {
            return false;
        }
        for (String date : a.dates) {
            if (b.dates.contains(date)) {
                return false;
            }
        }
        return TextSimilarity.jaccard(a.terms, b.terms) >= minOverlap;
    }

    private static String metadataText(TaggedItem item, String key) {
        Map<String, Object> metadata = item.item().getMetadata();
        if (metadata == null) {
            return null;
        }
        Object value = metadata.get(key);
        if (value == null) {
            return null;
        }
        String text = Objects.toString(value).trim();
        return text.isEmpty() ? null : text;
    }

    private static int find(int[] parent, int index) {
        while (parent[index] != index) {
            parent[index] = parent[parent[index]];
            index = parent[index];
        }
        return index;
    }

    private static void union(int[] parent, int a, int b) {
        int rootA = find(parent, a);
        int rootB = find(parent, b);
        if (rootA == rootB) {
            return;
        }
        if (rootA < rootB) {
            parent[rootB] = rootA;
        } else {
            parent[rootA] = rootB;
        }
    }

    private static final class Features {
        private final TaggedItem item;
        private final List<String> tokens;
        private final Set<String> terms;
        private final Set<String> dates;
        private final boolean negated;
        private final double[] vector;
        private final double queryCoverage;

        private Features(TaggedItem item, Set<String> queryTerms, TermVectorEmbedder embedder) {
            this.item = item;
            this.tokens = TextTokens.tokenize(item.content());
            this.terms = TextTokens.contentTerms(item.content());
            this.dates = TextTokens.isoDates(item.content());
            this.negated = TextTokens.isNegated(item.content());
            this.vector = embedder.embed(item.content());
            this.queryCoverage = TermVectorEmbedder.coverage(queryTerms, terms);
        }
    }
}
