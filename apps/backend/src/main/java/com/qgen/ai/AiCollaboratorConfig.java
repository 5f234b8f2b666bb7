package com.qgen.ai;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.qgen.config.GeneratorProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the generation and translation collaborators against whatever {@link ChatModel} the
 * Spring AI auto-configuration produced, if any.
 */
@Slf4j
@Configuration
public class AiCollaboratorConfig {

    @Bean
    public ContractSourceGenerator contractSourceGenerator(ObjectProvider<ChatModel> chatModel, GeneratorProperties props) {
        ChatModel model = chatModel.getIfAvailable();
        if (model == null) {
            log.warn("No ChatModel available; POST /generate with user_prompt will answer 503");
            return new UnavailableContractSourceGenerator();
        }
        return new SpringAiContractSourceGenerator(model, props);
    }

    @Bean
    public ReportTranslator reportTranslator(ObjectProvider<ChatModel> chatModel, GeneratorProperties props, ObjectMapper objectMapper) {
        ChatModel model = chatModel.getIfAvailable();
        if (model == null || !props.isTranslationEnabled()) {
            return new IdentityReportTranslator();
        }
        return new SpringAiReportTranslator(model, objectMapper);
    }
}
