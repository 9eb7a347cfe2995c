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
 * Coarse classification of what a tool does to the workspace. Drives the
 * approval-mode defaults of the policy engine and the scheduler's
 * serialization of mutating calls.
 */
public enum ToolKind {

    READ, SEARCH, FETCH, THINK, EDIT, DELETE, MOVE, EXECUTE, OTHER;

    public boolean isMutating() {
        return switch (this) {
        case EDIT, DELETE, MOVE, EXECUTE, OTHER -> true;
        default -> false;
        };
    }

    public boolean isEdit() {
        return this == EDIT || this == MOVE;
    }
}
