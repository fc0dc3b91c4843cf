package com.deepansh.orchestrator.llm;

import lombok.Data;

/**
 * Holds config for a single OpenAI-compatible provider.
 * Populated from application.yml under llm.providers.{name}.
 */
@Data
public class LlmProviderProperties {
    private String apiKey = "";
    private String baseUrl;
    private String model;
    private int maxTokens = 4096;
    private double temperature = 0.2;

    public LlmProviderProperties withModel(String overrideModel) {
        LlmProviderProperties p = new LlmProviderProperties();
        p.setApiKey(apiKey); p.setBaseUrl(baseUrl);
        p.setModel(overrideModel != null && !overrideModel.isBlank() ? overrideModel : model);
        p.setMaxTokens(maxTokens); p.setTemperature(temperature);
        return p;
    }
}
