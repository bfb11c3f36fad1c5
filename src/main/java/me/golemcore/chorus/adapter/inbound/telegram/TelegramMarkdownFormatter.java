package me.golemcore.chorus.adapter.inbound.telegram;

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
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts the small Markdown subset personas produce to Telegram HTML:
 * fenced and inline code, bold, italic and links. Everything else is
 * HTML-escaped.
 */
public final class TelegramMarkdownFormatter {

    private TelegramMarkdownFormatter() {
    }

    // ```lang\ncode\n``` or ```code```
    private static final Pattern CODE_BLOCK_PATTERN = Pattern.compile("```(?:\\w*\\n)?([\\s\\S]*?)```");

    private static final Pattern INLINE_CODE_PATTERN = Pattern.compile("`([^`\n]+)`");

    private static final Pattern LINK_PATTERN = Pattern.compile("\\[([^]]+)]\\(([^)\\s]+)\\)");

    private static final Pattern BOLD_PATTERN = Pattern.compile("\\*\\*(.+?)\\*\\*");

    // *italic*, not part of a word or of **bold**
    private static final Pattern ITALIC_PATTERN = Pattern.compile("(?<![\\w*])\\*([^*\n]+?)\\*(?![\\w*])");

    private static final String CODE_BLOCK_PLACEHOLDER = "\uE000CB";
    private static final String INLINE_CODE_PLACEHOLDER = "\uE000IC";
    private static final String PLACEHOLDER_END = "\uE001";

    public static String format(String text) {
        if (text == null || text.isBlank()) {
            return text;
        }

        List<String> codeBlocks = new ArrayList<>();
        String result = extract(CODE_BLOCK_PATTERN, text, CODE_BLOCK_PLACEHOLDER, codeBlocks);
        List<String> inlineCode = new ArrayList<>();
        result = extract(INLINE_CODE_PATTERN, result, INLINE_CODE_PLACEHOLDER, inlineCode);

        result = escapeHtml(result);
        result = LINK_PATTERN.matcher(result).replaceAll("<a href=\"$2\">$1</a>");
        result = BOLD_PATTERN.matcher(result).replaceAll("<b>$1</b>");
        result = ITALIC_PATTERN.matcher(result).replaceAll("<i>$1</i>");

        for (int i = 0; i < inlineCode.size(); i++) {
            result = result.replace(INLINE_CODE_PLACEHOLDER + i + PLACEHOLDER_END,
                    "<code>" + escapeHtml(inlineCode.get(i)) + "</code>");
        }
        for (int i = 0; i < codeBlocks.size(); i++) {
            result = result.replace(CODE_BLOCK_PLACEHOLDER + i + PLACEHOLDER_END,
                    "<pre>" + escapeHtml(codeBlocks.get(i).strip()) + "</pre>");
        }
        return result;
    }

    static String escapeHtml(String text) {
        return text.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }

    private static String extract(Pattern pattern, String text, String placeholder, List<String> sink) {
        Matcher matcher = pattern.matcher(text);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            sink.add(matcher.group(1));
            String marker = placeholder + (sink.size() - 1) + PLACEHOLDER_END;
            matcher.appendReplacement(out, Matcher.quoteReplacement(marker));
        }
        matcher.appendTail(out);
        return out.toString();
    }
}
