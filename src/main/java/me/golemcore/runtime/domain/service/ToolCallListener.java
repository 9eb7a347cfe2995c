package me.golemcore.runtime.domain.service;

import me.golemcore.runtime.domain.model.ToolCallUpdateEvent;

/**
 * Per-batch observer of tool call progress. Invoked on scheduler threads.
 */
@FunctionalInterface
public interface ToolCallListener {

    ToolCallListener NONE = update -> {
    };

    void onUpdate(ToolCallUpdateEvent update);
}
