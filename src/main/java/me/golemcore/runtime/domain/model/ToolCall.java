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

import me.golemcore.runtime.domain.component.ToolComponent;

import java.time.Instant;

/**
 * Mutable state of one scheduled tool call. All mutators are synchronized and
 * the status only moves along {@link ToolCallStatus#canTransitionTo}.
 */
public class ToolCall {

    private final ToolCallRequest request;
    private ToolComponent tool;
    private ToolCallStatus status = ToolCallStatus.VALIDATING;
    private Instant startTime;
    private Instant endTime;
    private String confirmationCorrelationId;
    private ApprovalMode approvalMode;
    private ToolCallResponse response;

    public ToolCall(ToolCallRequest request) {
        this.request = request;
    }

    public ToolCallRequest getRequest() {
        return request;
    }

    public String getCallId() {
        return request.getCallId();
    }

    public String getName() {
        return request.getName();
    }

    public synchronized ToolComponent getTool() {
        return tool;
    }

    public synchronized void setTool(ToolComponent tool) {
        this.tool = tool;
    }

    public synchronized ToolCallStatus getStatus() {
        return status;
    }

    public synchronized boolean isTerminal() {
        return status.isTerminal();
    }

    /**
     * Moves to {@code next} if the transition is legal.
     *
     * @return {@code false} when the transition was rejected and nothing changed
     */
    public synchronized boolean transitionTo(ToolCallStatus next) {
        if (!status.canTransitionTo(next)) {
            return false;
        }
        if (next == ToolCallStatus.EXECUTING && startTime == null) {
            startTime = Instant.now();
        }
        status = next;
        return true;
    }

    /**
     * Moves to the response's terminal status and records the response. The first
     * terminal outcome wins.
     */
    public synchronized boolean complete(ToolCallResponse terminal) {
        if (!transitionTo(terminal.getStatus())) {
            return false;
        }
        endTime = Instant.now();
        if (startTime != null) {
            terminal.setDurationMillis(endTime.toEpochMilli() - startTime.toEpochMilli());
        }
        response = terminal;
        return true;
    }

    public synchronized ToolCallResponse getResponse() {
        return response;
    }

    public synchronized Instant getStartTime() {
        return startTime;
    }

    public synchronized Instant getEndTime() {
        return endTime;
    }

    public synchronized String getConfirmationCorrelationId() {
        return confirmationCorrelationId;
    }

    public synchronized void setConfirmationCorrelationId(String confirmationCorrelationId) {
        this.confirmationCorrelationId = confirmationCorrelationId;
    }

    /**
     * Approval mode of the batch this call belongs to.
     */
    public synchronized ApprovalMode getApprovalMode() {
        return approvalMode;
    }

    public synchronized void setApprovalMode(ApprovalMode approvalMode) {
        this.approvalMode = approvalMode;
    }

    @Override
    public synchronized String toString() {
        return "ToolCall{" + getCallId() + ", " + getName() + ", " + status + "}";
    }
}
