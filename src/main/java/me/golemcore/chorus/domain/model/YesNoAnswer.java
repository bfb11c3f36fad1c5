package me.golemcore.chorus.domain.model;

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

import java.util.Locale;

/**
 * Tri-state reading of an oracle YES/NO answer.
 *
 * <p>
 * The answer is trimmed and upper-cased, then matched exactly or as a leading
 * word ("Yes, because..." is {@link #YES}). Anything else, including "maybe",
 * is {@link #AMBIGUOUS}.
 */
public enum YesNoAnswer {
    YES, NO, AMBIGUOUS;

    public static YesNoAnswer parse(String raw) {
        if (raw == null) {
            return AMBIGUOUS;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        if (startsWithWord(normalized, "YES")) {
            return YES;
        }
        if (startsWithWord(normalized, "NO")) {
            return NO;
        }
        return AMBIGUOUS;
    }

    public boolean isDecisive() {
        return this != AMBIGUOUS;
    }

    private static boolean startsWithWord(String text, String word) {
        if (!text.startsWith(word)) {
            return false;
        }
        return text.length() == word.length() || !Character.isLetter(text.charAt(word.length()));
    }
}
