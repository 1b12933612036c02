package com.kmesh.fusion.synthesis;

import static org.assertj.core.api.Assertions.assertThat;

import com.kmesh.fusion.api.dto.ConflictRecord;
import com.kmesh.fusion.api.dto.ConflictStrategy;
import com.kmesh.fusion.api.dto.CoverageGap;
import com.kmesh.fusion.api.dto.FusedItem;
import com.kmesh.fusion.api.dto.SourceCitation;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class SynthesisPromptBuilderTest {

    @Test
    void listsTopSourcesFlaggedConflictsAndGaps() {
        FusedItem first = fused("code-1", "code", "src/auth.py", "refresh happens in middleware");
        FusedItem second = fused("docs-1", "docs", "docs/auth.md", "refresh is configured per tenant");
        FusedItem third = fused("research-1", "research", "papers/tokens.pdf", "token rotation survey");

        ConflictRecord flagged = new ConflictRecord();
        flagged.setResolution(ConflictStrategy.FLAG);
        flagged.setItems(List.of(recordItem("code", "code-1"), recordItem("docs", "docs-1")));

        String prompt = new SynthesisPromptBuilder().build(
            "  how does refresh work ",
            List.of(first, second, third),
            List.of(flagged),
            List.of(new CoverageGap("conversations", "conversations-agent", "circuit open")),
            2,
            128
        );

        assertThat(prompt).contains("Question: how does refresh work\n");
        assertThat(prompt).contains("under 128 tokens");
        assertThat(prompt).contains("[1] domain=code score=0.500 source=src/auth.py");
        assertThat(prompt).contains("[2] domain=docs");
        assertThat(prompt).doesNotContain("[3]").doesNotContain("token rotation survey");
        assertThat(prompt).contains("- code:code-1 vs docs:docs-1");
        assertThat(prompt).contains("- conversations (circuit open)");
    }

    private static FusedItem fused(String chunkId, String domainId, String sourcePath, String content) {
        FusedItem item = new FusedItem();
        item.setChunkId(chunkId);
        item.setDomainId(domainId);
        item.setContent(content);
        item.setRankScore(0.5);
        item.setCitation(new SourceCitation("doc-" + chunkId, chunkId, domainId, sourcePath, Instant.parse("2024-05-01T00:00:00Z")));
        return item;
    }

    private static ConflictRecord.Item recordItem(String domainId, String chunkId) {
        ConflictRecord.Item item = new ConflictRecord.Item();
        item.setDomainId(domainId);
        item.setChunkId(chunkId);
        return item;
    }
}
