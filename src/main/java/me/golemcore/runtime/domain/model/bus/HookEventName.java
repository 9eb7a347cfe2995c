package me.golemcore.runtime.domain.model.bus;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle points at which hooks run. Serialized with the external hook
 * protocol names.
 */
public enum HookEventName {

    BEFORE_TOOL("BeforeTool"), AFTER_TOOL("AfterTool"), BEFORE_SUB_AGENT("BeforeSubAgent"), AFTER_SUB_AGENT(
            "AfterSubAgent");

    private final String wireName;

    HookEventName(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
