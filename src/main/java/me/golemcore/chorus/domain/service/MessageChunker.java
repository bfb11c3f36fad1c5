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

import java.util.ArrayList;
import java.util.List;

/**
 * Splits long text into platform-sized chunks, preferring paragraph breaks,
 * then line breaks, then spaces. A break is only used if it keeps at least
 * {@value #MIN_SPLIT_RATIO} of the limit in the chunk; otherwise the text is
 * cut hard at the limit.
 */
public final class MessageChunker {

    static final double MIN_SPLIT_RATIO = 0.6;

    private static final String[] SEPARATORS = { "\n\n", "\n", " " };

    private MessageChunker() {
    }

    public static List<String> split(String text, int maxLength) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        if (maxLength <= 0 || text.length() <= maxLength) {
            return List.of(text);
        }

        int minSplit = Math.max(1, (int) (maxLength * MIN_SPLIT_RATIO));
        List<String> chunks = new ArrayList<>();
        String remaining = text;
        while (remaining.length() > maxLength) {
            int cut = findBreak(remaining, maxLength, minSplit);
            String head = remaining.substring(0, cut).stripTrailing();
            if (!head.isEmpty()) {
                chunks.add(head);
            }
            remaining = remaining.substring(cut).stripLeading();
        }
        if (!remaining.isEmpty()) {
            chunks.add(remaining);
        }
        return chunks;
    }

    private static int findBreak(String text, int maxLength, int minSplit) {
        for (String separator : SEPARATORS) {
            int index = text.lastIndexOf(separator, maxLength);
            if (index >= minSplit && index <= maxLength) {
                return index;
            }
        }
        return maxLength;
    }
}
