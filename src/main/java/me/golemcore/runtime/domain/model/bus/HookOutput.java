package me.golemcore.runtime.domain.model.bus;

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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Aggregated hook answer. Absent fields mean "no opinion".
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HookOutput {

    private static final String DENY = "deny";
    private static final String BLOCK = "block";

    @JsonProperty("continue")
    private Boolean continueExecution;
    private String stopReason;
    private String decision;
    private String reason;
    private HookSpecificOutput hookSpecificOutput;

    @JsonIgnore
    public boolean shouldStopExecution() {
        return Boolean.FALSE.equals(continueExecution);
    }

    @JsonIgnore
    public boolean isBlockingDecision() {
        return DENY.equalsIgnoreCase(decision) || BLOCK.equalsIgnoreCase(decision);
    }

    /**
     * Reason to surface for a stop or block: {@code stopReason} for stops,
     * otherwise {@code reason}.
     */
    @JsonIgnore
    public String getEffectiveReason() {
        if (shouldStopExecution() && stopReason != null && !stopReason.isBlank()) {
            return stopReason;
        }
        if (reason != null && !reason.isBlank()) {
            return reason;
        }
        return stopReason;
    }

    @JsonIgnore
    public String getAdditionalContext() {
        return hookSpecificOutput != null ? hookSpecificOutput.getAdditionalContext() : null;
    }

    public static HookOutput deny(String reason) {
        return HookOutput.builder().decision(DENY).reason(reason).build();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class HookSpecificOutput {
        private String hookEventName;
        private String additionalContext;
    }
}
