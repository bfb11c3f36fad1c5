package me.golemcore.chorus.domain.service;

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

import java.util.regex.Pattern;

/**
 * Strips machine markup from oracle output before it is shown in a chat: a
 * leading {@code [skill:...]} marker, paired XML-like tags with their content
 * (reasoning blocks and the like) and stray single tags.
 */
public final class ReplySanitizer {

    private static final Pattern SKILL_MARKER = Pattern.compile("^\\s*\\[skill:[^\\]\\n]*]\\s*");
    private static final Pattern PAIRED_TAG = Pattern
            .compile("<([a-zA-Z_][a-zA-Z0-9_-]*)(\\s+[^>]*)?>[\\s\\S]*?</\\1\\s*>");
    private static final Pattern SINGLE_TAG = Pattern.compile("</?[a-zA-Z_][a-zA-Z0-9_-]*(\\s+[^>]*)?/?>");
    private static final Pattern EXCESS_BLANK_LINES = Pattern.compile("\\n{3,}");

    private ReplySanitizer() {
    }

    public static String sanitize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String cleaned = SKILL_MARKER.matcher(text).replaceFirst("");
        cleaned = PAIRED_TAG.matcher(cleaned).replaceAll("");
        cleaned = SINGLE_TAG.matcher(cleaned).replaceAll("");
        cleaned = EXCESS_BLANK_LINES.matcher(cleaned).replaceAll("\n\n");
        return cleaned.trim();
    }
}
