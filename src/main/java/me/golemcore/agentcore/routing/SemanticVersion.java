package me.golemcore.agentcore.routing;

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
 * Lenient ordering key for {@code major.minor.patch} version strings. Missing
 * components and non-numeric text count as 0; leading digits of a component
 * are used ({@code "2rc1"} reads as 2).
 */
final class SemanticVersion {

    private SemanticVersion() {
    }

    static long score(String version) {
        if (version == null || version.isBlank()) {
            return 0L;
        }
        String[] parts = version.trim().split("\\.");
        long major = component(parts, 0);
        long minor = component(parts, 1);
        long patch = component(parts, 2);
        return major * 1_000_000L + minor * 1_000L + patch;
    }

    private static long component(String[] parts, int index) {
        if (index >= parts.length) {
            return 0L;
        }
        String part = parts[index];
        int end = 0;
        while (end < part.length() && Character.isDigit(part.charAt(end))) {
            end++;
        }
        if (end == 0) {
            return 0L;
        }
        try {
            return Long.parseLong(part.substring(0, end));
        } catch (NumberFormatException e) {
            // more digits than a long holds
            return Long.MAX_VALUE / 1_000_000L;
        }
    }
}
