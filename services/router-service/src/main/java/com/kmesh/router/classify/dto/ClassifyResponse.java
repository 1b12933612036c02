package com.kmesh.router.classify.dto;

import com.kmesh.router.classify.DomainSignal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class ClassifyResponse {
    private List<DomainSignal> signals = new ArrayList<>();
    private Map<String, String> rewrites = new LinkedHashMap<>();

    public List<DomainSignal> getSignals() {
        return signals;
    }

    public void setSignals(List<DomainSignal> signals) {
        this.signals = signals;
    }

    public Map<String, String> getRewrites() {
        return rewrites;
    }

    public void setRewrites(Map<String, String> rewrites) {
        this.rewrites = rewrites;
    }
}
