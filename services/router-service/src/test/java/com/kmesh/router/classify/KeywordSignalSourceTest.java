package com.kmesh.router.classify;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.kmesh.router.registry.DomainDescriptor;
import java.util.List;
import org.junit.jupiter.api.Test;

class KeywordSignalSourceTest {

    private final KeywordSignalSource source = new KeywordSignalSource();

    private final List<DomainDescriptor> domains = List.of(
        new DomainDescriptor("code", "Source code", "Repositories", List.of("function", "module", "stack trace")),
        new DomainDescriptor("docs", "Documentation", "Guides", List.of("design", "guide")),
        new DomainDescriptor("ops", null, null, List.of())
    );

    @Test
    void scoresShareOfMatchedKeywords() {
        ClassificationResult result = source.classify("Which module defines the retry function?", domains, "t");

        DomainSignal code = signal(result, "code");
        assertThat(code.getScore()).isCloseTo(2.0 / 3.0, within(1e-9));
        assertThat(code.getKeywords()).containsExactly("function", "module");
        assertThat(signal(result, "docs").getScore()).isZero();
        assertThat(result.rewrites()).isEmpty();
    }

    @Test
    void saturatesAfterThreeHits() {
        ClassificationResult result = source.classify(
            "code module function stack trace", domains, "t");

        assertThat(signal(result, "code").getScore()).isEqualTo(1.0);
    }

    @Test
    void multiWordKeywordsMatchAsPhrases() {
        ClassificationResult split = source.classify("trace the stack", domains, "t");
        ClassificationResult phrase = source.classify("paste the stack trace", domains, "t");

        assertThat(signal(split, "code").getScore()).isZero();
        assertThat(signal(phrase, "code").getKeywords()).containsExactly("stack trace");
    }

    @Test
    void domainIdAloneCanSaturateASmallDomain() {
        ClassificationResult result = source.classify("ops runbook for the pager", domains, "t");

        assertThat(signal(result, "ops").getScore()).isEqualTo(1.0);
    }

    private static DomainSignal signal(ClassificationResult result, String domainId) {
        return result.signals().stream()
            .filter(signal -> signal.getDomainId().equals(domainId))
            .findFirst()
            .orElseThrow();
    }
}
