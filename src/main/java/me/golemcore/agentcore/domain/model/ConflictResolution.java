package me.golemcore.agentcore.domain.model;

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
 * Rule for picking one agent when several expose the requested capability.
 */
public enum ConflictResolution {

    /**
     * Highest priority wins; equal priorities fall back to the greater name.
     */
    HIGHEST_PRIORITY,

    /**
     * Greatest semantic version wins; non-numeric components count as 0.
     */
    NEWEST_VERSION,

    /**
     * First matching agent in the given order wins.
     */
    FIRST_REGISTERED,

    /**
     * Ambiguity is an error.
     */
    FAIL_ON_CONFLICT
}
