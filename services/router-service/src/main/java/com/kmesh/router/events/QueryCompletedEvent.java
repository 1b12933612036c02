package com.kmesh.router.events;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.kmesh.router.agent.dto.CoverageGap;
import com.kmesh.router.fusion.dto.FusedItem;
import com.kmesh.router.fusion.dto.FusionResult;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Advisory feedback describing which domains contributed to a finished query.
 */
public class QueryCompletedEvent {
    @JsonProperty("query_id")
    private String queryId;

    @JsonProperty("trace_id")
    private String traceId;

    @JsonProperty("domains_queried")
    private List<String> domainsQueried = new ArrayList<>();

    @JsonProperty("contributing_domains")
    private List<String> contributingDomains = new ArrayList<>();

    @JsonProperty("gap_domains")
    private List<String> gapDomains = new ArrayList<>();

    @JsonProperty("item_count")
    private int itemCount;

    @JsonProperty("conflict_count")
    private int conflictCount;

    @JsonProperty("emitted_at")
    private Instant emittedAt;

    public static QueryCompletedEvent from(FusionResult result, List<CoverageGap> gaps, Instant emittedAt) {
        QueryCompletedEvent event = new QueryCompletedEvent();
        event.setQueryId(result.getQueryId());
        event.setTraceId(result.getTraceId());
        if (result.getDomainsQueried() != null) {
            event.setDomainsQueried(new ArrayList<>(result.getDomainsQueried()));
        }
        Set<String> contributing = new LinkedHashSet<>();
        List<FusedItem> items = result.getItems() == null ? List.of() : result.getItems();
        for (FusedItem item : items) {
            if (item.getDomainId() != null) {
                contributing.add(item.getDomainId());
            }
        }
        event.setContributingDomains(new ArrayList<>(contributing));
        Set<String> gapDomains = new LinkedHashSet<>();
        for (CoverageGap gap : gaps) {
            gapDomains.add(gap.getDomainId());
        }
        event.setGapDomains(new ArrayList<>(gapDomains));
        event.setItemCount(items.size());
        event.setConflictCount(result.getConflicts() == null ? 0 : result.getConflicts().size());
        event.setEmittedAt(emittedAt);
        return event;
    }

    public String getQueryId() {
        return queryId;
    }

    public void setQueryId(String queryId) {
        this.queryId = queryId;
    }

    public String getTraceId() {
        return traceId;
    }

    public void setTraceId(String traceId) {
        this.traceId = traceId;
    }

    public List<String> getDomainsQueried() {
        return domainsQueried;
    }

    public void setDomainsQueried(List<String> domainsQueried) {
        this.domainsQueried = domainsQueried;
    }

    public List<String> getContributingDomains() {
        return contributingDomains;
    }

    public void setContributingDomains(List<String> contributingDomains) {
        this.contributingDomains = contributingDomains;
    }

    public List<String> getGapDomains() {
        return gapDomains;
    }

    public void setGapDomains(List<String> gapDomains) {
        this.gapDomains = gapDomains;
    }

    public int getItemCount() {
        return itemCount;
    }

    public void setItemCount(int itemCount) {
        this.itemCount = itemCount;
    }

    public int getConflictCount() {
        return conflictCount;
    }

    public void setConflictCount(int conflictCount) {
        this.conflictCount = conflictCount;
    }

    public Instant getEmittedAt() {
        return emittedAt;
    }

    public void setEmittedAt(Instant emittedAt) {
        this.emittedAt = emittedAt;
    }
}
