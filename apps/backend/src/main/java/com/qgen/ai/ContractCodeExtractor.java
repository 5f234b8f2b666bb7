package com.qgen.ai;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls contract code out of a model reply: the {@code [C++ START]}/{@code [C++ END]} markers
 * first, a fenced code block as fallback.
 */
public final class ContractCodeExtractor {
    private ContractCodeExtractor() {}

    public static final String START_MARKER = "[C++ START]";
    public static final String END_MARKER = "[C++ END]";

    private static final Pattern FENCE = Pattern.compile("```(?:cpp|c\\+\\+|c)?[ \\t]*\\r?\\n(.*?)```",
            Pattern.DOTALL | Pattern.CASE_INSENSITIVE);

    public static Optional<String> extract(String reply) {
        if (reply == null || reply.isBlank()) return Optional.empty();

        int start = reply.indexOf(START_MARKER);
        if (start >= 0) {
            int from = start + START_MARKER.length();
            int end = reply.indexOf(END_MARKER, from);
            if (end > from) {
                return nonBlank(stripFence(reply.substring(from, end)));
            }
        }
        Matcher m = FENCE.matcher(reply);
        if (m.find()) {
            return nonBlank(m.group(1));
        }
        return Optional.empty();
    }

    // 标记内部有时还会再包一层 ```cpp
    private static String stripFence(String s) {
        Matcher m = FENCE.matcher(s);
        return m.find() ? m.group(1) : s;
    }

    private static Optional<String> nonBlank(String s) {
        String t = s.strip();
        return t.isEmpty() ? Optional.empty() : Optional.of(t);
    }
}
