package com.qgen.ai;

import com.qgen.config.GeneratorProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;

import java.util.List;
import java.util.Optional;

@Slf4j
@RequiredArgsConstructor
public class SpringAiContractSourceGenerator implements ContractSourceGenerator {

    private final ChatModel chatModel;
    private final GeneratorProperties properties;

    @Override
    public GeneratedContract generate(String userPrompt) throws GenerationException {
        Prompt prompt = new Prompt(List.of(
                new SystemMessage(properties.getSystemPrompt()),
                new UserMessage("USER REQUEST: " + userPrompt)));

        int attempts = Math.max(1, properties.getMaxAttempts());
        Exception lastError = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            String reply;
            try {
                reply = text(chatModel.call(prompt));
            } catch (RuntimeException e) {
                lastError = e;
                log.warn("Generation attempt {}/{} failed: {}", attempt, attempts, e.getMessage());
                continue;
            }
            Optional<String> code = ContractCodeExtractor.extract(reply);
            if (code.isPresent()) {
                log.debug("Generated {} chars of contract code on attempt {}", code.get().length(), attempt);
                return new GeneratedContract(code.get(), attempt);
            }
            log.warn("Generation attempt {}/{} returned no code block", attempt, attempts);
        }
        if (lastError != null) {
            throw new GenerationException(GenerationException.Reason.MODEL_ERROR,
                    "model call failed after " + attempts + " attempt(s)", lastError);
        }
        throw new GenerationException(GenerationException.Reason.NO_CODE,
                "no contract code in model reply after " + attempts + " attempt(s)");
    }

    static String text(ChatResponse response) {
        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            return null;
        }
        return response.getResult().getOutput().getText();
    }
}
