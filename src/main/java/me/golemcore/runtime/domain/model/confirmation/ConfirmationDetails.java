package me.golemcore.runtime.domain.model.confirmation;

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

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.Data;
import lombok.experimental.SuperBuilder;
import lombok.NoArgsConstructor;

/**
 * What a user is asked to approve. Only UI-safe fields are serialized; the
 * {@code type} property selects the concrete variant.
 */
@Data
@SuperBuilder
@NoArgsConstructor
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = EditConfirmationDetails.class, name = "edit"),
        @JsonSubTypes.Type(value = ExecConfirmationDetails.class, name = "exec"),
        @JsonSubTypes.Type(value = McpConfirmationDetails.class, name = "mcp"),
        @JsonSubTypes.Type(value = InfoConfirmationDetails.class, name = "info")
})
public abstract class ConfirmationDetails {

    private String title;
}
