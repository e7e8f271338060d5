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

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * A named, versioned prompt body with {{var}} placeholders. Several versions
 * may share a name; the registry decides which one is served.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class PromptTemplate {

    String name;
    int version;
    String template;
    String description;

    @Builder.Default
    List<String> tags = List.of();

    Instant createdAt;

    @Builder.Default
    boolean active = true;
}
