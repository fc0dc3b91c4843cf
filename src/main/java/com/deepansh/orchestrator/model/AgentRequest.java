package com.deepansh.orchestrator.model;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.util.Map;

@Data
public class AgentRequest {

    /**
     * Plain text, or a JSON object carrying {input|query, metadata, attachments}
     * or the legacy fault-report fields.
     */
    @NotBlank(message = "input must not be blank")
    private String input;

    /**
     * Optional. If provided, the run resumes conversation memory from this session.
     * If null, a new session is created.
     */
    private String sessionId;

    /** Defaults to "default" if not provided. */
    private String userId;

    /** Extra metadata merged over anything parsed out of the input. */
    private Map<String, Object> metadata;
}
