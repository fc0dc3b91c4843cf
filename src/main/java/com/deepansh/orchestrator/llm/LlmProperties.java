package com.deepansh.orchestrator.llm;

import com.deepansh.orchestrator.exception.AgentConfigurationException;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Provider selection and per-role model overrides, bound under "llm".
 */
@ConfigurationProperties(prefix = "llm")
@Data
public class LlmProperties {

    /** Key into {@link #providers}; selected by LLM_PROVIDER. */
    private String provider = "groq";

    private Map<String, LlmProviderProperties> providers = new LinkedHashMap<>();

    /** Optional model name per {@link ModelRole#key()}; falls back to the provider model. */
    private Map<String, String> roleModels = new LinkedHashMap<>();

    public LlmProviderProperties activeProvider() {
        LlmProviderProperties active = providers.get(provider);
        if (active == null) {
            throw new AgentConfigurationException(
                    "No configuration for llm.providers." + provider + " (LLM_PROVIDER=" + provider + ")");
        }
        if (active.getBaseUrl() == null || active.getBaseUrl().isBlank()) {
            throw new AgentConfigurationException("llm.providers." + provider + ".base-url is not set");
        }
        return active;
    }

    public LlmProviderProperties propertiesFor(ModelRole role) {
        return activeProvider().withModel(roleModels.get(role.key()));
    }
}
