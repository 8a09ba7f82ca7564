package com.guidestore.tools;

/**
 * Who is calling. The agent id is recorded as {@code archivedBy} in archive audits.
 */
public class ToolExecutionContext {
    private final String sessionId;
    private final String agentId;

    public ToolExecutionContext(String sessionId, String agentId) {
        this.sessionId = sessionId;
        this.agentId = agentId;
    }

    public static ToolExecutionContext anonymous() {
        return new ToolExecutionContext(null, null);
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getAgentId() {
        return agentId;
    }
}
