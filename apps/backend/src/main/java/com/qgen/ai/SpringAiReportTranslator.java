package com.qgen.ai;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.qgen.detector.Finding;
import com.qgen.report.AuditReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.prompt.Prompt;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Translates rationales through the chat model as one JSON array. Any failure falls back to the
 * English report; the canonical report is never affected.
 */
@Slf4j
@RequiredArgsConstructor
public class SpringAiReportTranslator implements ReportTranslator {

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    private static final String SYSTEM = """
            You translate security audit findings. The user sends a JSON array of English sentences.
            Reply with a JSON array of the same length containing the translations, in the same order.
            Keep code identifiers, function names and quoted expressions unchanged. Output only the array.""";

    private final ChatModel chatModel;
    private final ObjectMapper objectMapper;

    @Override
    public LocalizedReport translate(AuditReport report, String language) {
        String lang = language == null ? DEFAULT_LANGUAGE : language.toLowerCase(Locale.ROOT);
        if (DEFAULT_LANGUAGE.equals(lang) || report.findings().isEmpty()) {
            return new LocalizedReport(lang, report.findings(), false);
        }
        try {
            List<String> source = report.findings().stream().map(Finding::rationale).toList();
            Prompt prompt = new Prompt(List.of(
                    new SystemMessage(SYSTEM),
                    new UserMessage("Target language: " + lang + "\n" + objectMapper.writeValueAsString(source))));
            String reply = SpringAiContractSourceGenerator.text(chatModel.call(prompt));
            List<String> translated = objectMapper.readValue(stripFence(reply), STRING_LIST);
            if (translated.size() != source.size()) {
                log.warn("Translation to '{}' returned {} item(s) for {} finding(s); keeping English",
                        lang, translated.size(), source.size());
                return new LocalizedReport(DEFAULT_LANGUAGE, report.findings(), false);
            }
            List<Finding> out = new ArrayList<>(source.size());
            for (int i = 0; i < source.size(); i++) {
                out.add(report.findings().get(i).withRationale(translated.get(i)));
            }
            return new LocalizedReport(lang, out, true);
        } catch (Exception e) {
            log.warn("Translation to '{}' failed, keeping English: {}", lang, e.getMessage());
            return new LocalizedReport(DEFAULT_LANGUAGE, report.findings(), false);
        }
    }

    private static String stripFence(String reply) {
        if (reply == null) return "[]";
        String s = reply.strip();
        if (s.startsWith("```")) {
            int nl = s.indexOf('\n');
            int end = s.lastIndexOf("```");
            if (nl > 0 && end > nl) s = s.substring(nl + 1, end);
        }
        return s.strip();
    }
}
