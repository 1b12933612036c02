package com.kmesh.fusion.synthesis.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public class GenerateRequest {
    private String prompt;

    @JsonProperty("max_tokens")
    private int maxTokens;

    public GenerateRequest() {
    }

    public GenerateRequest(String prompt, int maxTokens) {
        this.prompt = prompt;
        this.maxTokens = maxTokens;
    }

    public String getPrompt() {
        return prompt;
    }

    public void setPrompt(String prompt) {
        this.prompt = prompt;
    }

    public int getMaxTokens() {
        return maxTokens;
    }

    public void setMaxTokens(int maxTokens) {
        this.maxTokens = maxTokens;
    }
}
