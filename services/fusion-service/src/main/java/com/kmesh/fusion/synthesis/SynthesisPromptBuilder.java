package com.kmesh.fusion.synthesis;

import com.kmesh.fusion.api.dto.ConflictRecord;
import com.kmesh.fusion.api.dto.CoverageGap;
import com.kmesh.fusion.api.dto.FusedItem;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

@Component
public class SynthesisPromptBuilder {

    public String build(
        String queryText,
        List<FusedItem> items,
        List<ConflictRecord> conflicts,
        List<CoverageGap> gaps,
        int topN,
        int maxTokens
    ) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Answer the question using only the numbered sources below.\n")
            .append("Cite sources inline as [n]. Acknowledge any unresolved conflicts and mention missing domains.\n")
            .append("Keep the answer under ").append(maxTokens).append(" tokens.\n\n")
            .append("Question: ").append(queryText == null ? "" : queryText.trim()).append("\n\n")
            .append("Sources:\n");

        int limit = Math.min(Math.max(0, topN), items.size());
        for (int i = 0; i < limit; i++) {
            FusedItem item = items.get(i);
            prompt.append('[').append(i + 1).append("] domain=").append(item.getDomainId())
                .append(" score=").append(String.format(Locale.ROOT, "%.3f", item.getRankScore()));
            if (item.getCitation() != null) {
                if (item.getCitation().getSourcePath() != null) {
                    prompt.append(" source=").append(item.getCitation().getSourcePath());
                }
                if (item.getCitation().getTimestamp() != null) {
                    prompt.append(" at=").append(item.getCitation().getTimestamp());
                }
            }
            prompt.append('\n').append(item.getContent()).append("\n\n");
        }

        long unresolved = conflicts.stream().filter(conflict -> conflict.getResolvedTo() == null).count();
        if (unresolved > 0) {
            prompt.append("Unresolved conflicts:\n");
            for (ConflictRecord conflict : conflicts) {
                if (conflict.getResolvedTo() != null) {
                    continue;
                }
                prompt.append("- ");
                for (int i = 0; i < conflict.getItems().size(); i++) {
                    ConflictRecord.Item item = conflict.getItems().get(i);
                    if (i > 0) {
                        prompt.append(" vs ");
                    }
                    prompt.append(item.getDomainId()).append(':').append(item.getChunkId());
                }
                prompt.append('\n');
            }
            prompt.append('\n');
        }

        if (!gaps.isEmpty()) {
            prompt.append("Domains that did not answer:\n");
            for (CoverageGap gap : gaps) {
                prompt.append("- ").append(gap.getDomainId()).append(" (").append(gap.getReason()).append(")\n");
            }
        }
        return prompt.toString();
    }
}
