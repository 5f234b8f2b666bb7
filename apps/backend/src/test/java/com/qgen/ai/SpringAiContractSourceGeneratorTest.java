package com.qgen.ai;

import com.qgen.config.GeneratorProperties;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class SpringAiContractSourceGeneratorTest {

    private final ChatModel chatModel = mock(ChatModel.class);
    private final SpringAiContractSourceGenerator generator =
            new SpringAiContractSourceGenerator(chatModel, new GeneratorProperties());

    static ChatResponse reply(String text) {
        return new ChatResponse(List.of(new Generation(new AssistantMessage(text))));
    }

    @Test
    void extractsCodeAndSendsTheUserRequest() throws Exception {
        when(chatModel.call(any(Prompt.class))).thenReturn(reply("[C++ START]\nint a = 1;\n[C++ END]"));

        GeneratedContract out = generator.generate("a counter");

        assertEquals("int a = 1;", out.code());
        assertEquals(1, out.attempts());
        ArgumentCaptor<Prompt> captor = ArgumentCaptor.forClass(Prompt.class);
        verify(chatModel).call(captor.capture());
        assertThat(captor.getValue().getContents()).contains("USER REQUEST: a counter");
    }

    @Test
    void retriesUntilCodeAppears() throws Exception {
        when(chatModel.call(any(Prompt.class)))
                .thenReturn(reply("thinking..."))
                .thenReturn(reply("```cpp\nint b = 2;\n```"));

        GeneratedContract out = generator.generate("x");

        assertEquals("int b = 2;", out.code());
        assertEquals(2, out.attempts());
    }

    @Test
    void noCodeAfterAllAttempts() {
        when(chatModel.call(any(Prompt.class))).thenReturn(reply("no code here"));

        GenerationException e = assertThrows(GenerationException.class, () -> generator.generate("x"));
        assertEquals(GenerationException.Reason.NO_CODE, e.getReason());
        verify(chatModel, times(3)).call(any(Prompt.class));
    }

    @Test
    void modelFailureIsReported() {
        when(chatModel.call(any(Prompt.class))).thenThrow(new IllegalStateException("quota"));

        GenerationException e = assertThrows(GenerationException.class, () -> generator.generate("x"));
        assertEquals(GenerationException.Reason.MODEL_ERROR, e.getReason());
        assertInstanceOf(IllegalStateException.class, e.getCause());
    }
}
