package me.golemcore.runtime.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

/**
 * Lifecycle of a single {@link ToolCall}. Declaration order is the forward
 * order of the state machine.
 */
public enum ToolCallStatus {

    VALIDATING, SCHEDULED, AWAITING_APPROVAL, EXECUTING, SUCCESS, ERROR, CANCELLED;

    public boolean isTerminal() {
        return this == SUCCESS || this == ERROR || this == CANCELLED;
    }

    /**
     * Transitions only move forward. Any non-terminal state may be cancelled;
     * terminal states never change.
     */
    public boolean canTransitionTo(ToolCallStatus next) {
        if (next == null || isTerminal()) {
            return false;
        }
        if (next == CANCELLED) {
            return true;
        }
        return next.ordinal() > ordinal();
    }
}
