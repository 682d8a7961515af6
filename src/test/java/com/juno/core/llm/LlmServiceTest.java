package com.juno.core.llm;

import com.juno.core.oracle.GradeResult;
import com.juno.core.oracle.RouteDecision;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.client.ChatClient.CallResponseSpec;
import org.springframework.ai.chat.client.ChatClient.ChatClientRequestSpec;
import org.springframework.ai.tool.ToolCallback;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link LlmService}.
 * <p>
 * Mocks the entire {@link ChatClient} chain so no real LLM calls are made.
 */
class LlmServiceTest {

    private ChatClient mockChatClient;
    private ChatClientRequestSpec mockRequestSpec;
    private CallResponseSpec mockCallResponse;
    private LlmService llmService;

    @BeforeEach
    void setUp() {
        mockChatClient = mock(ChatClient.class);
        mockRequestSpec = mock(ChatClientRequestSpec.class);
        mockCallResponse = mock(CallResponseSpec.class);

        // Wire up the fluent API chain
        when(mockChatClient.prompt()).thenReturn(mockRequestSpec);
        when(mockRequestSpec.system(anyString())).thenReturn(mockRequestSpec);
        when(mockRequestSpec.user(anyString())).thenReturn(mockRequestSpec);
        when(mockRequestSpec.toolCallbacks(any(ToolCallback[].class))).thenReturn(mockRequestSpec);
        when(mockRequestSpec.call()).thenReturn(mockCallResponse);

        ChatClient.Builder mockBuilder = mock(ChatClient.Builder.class);
        when(mockBuilder.build()).thenReturn(mockChatClient);

        llmService = new LlmService(mockBuilder, new LlmProperties());
    }

    @Test
    @DisplayName("structuredCall sends the system prompt and the user prompt with format instructions")
    void structuredCallSendsPrompts() {
        when(mockCallResponse.content()).thenReturn("""
                {"next":"search","reasoning":"need sources"}
                """);

        llmService.structuredCall("System prompt", "User prompt", RouteDecision.class);

        verify(mockRequestSpec).system("System prompt");
        ArgumentCaptor<String> userCaptor = ArgumentCaptor.forClass(String.class);
        verify(mockRequestSpec).user(userCaptor.capture());
        String capturedUser = userCaptor.getValue();
        assertTrue(capturedUser.startsWith("User prompt\n\n"), "Should start with user prompt followed by separator");
        assertTrue(capturedUser.length() > "User prompt\n\n".length(), "Should contain format instructions after separator");
    }

    @Test
    @DisplayName("structuredCall deserializes the JSON response into the target type")
    void structuredCallDeserializesResponse() {
        when(mockCallResponse.content()).thenReturn("""
                {"score":0.8,"comments":"Clear and sourced.","issues":["one typo"]}
                """);

        GradeResult result = llmService.structuredCall("Grade", "Output", GradeResult.class);

        assertEquals(0.8, result.score());
        assertEquals("Clear and sourced.", result.comments());
        assertEquals(List.of("one typo"), result.issues());
        verify(mockRequestSpec, never()).toolCallbacks(any(ToolCallback[].class));
    }

    @Test
    @DisplayName("tools are attached only when supplied")
    void toolsAttached() {
        when(mockCallResponse.content()).thenReturn("{\"next\":\"FINISH\",\"reasoning\":\"done\"}");
        var tool = mock(ToolCallback.class);

        llmService.structuredCallWithTools("sys", "usr", RouteDecision.class, tool);

        verify(mockRequestSpec).toolCallbacks(new ToolCallback[]{tool});
    }

    @Test
    @DisplayName("a fenced response with a lone issue string is recovered by the lenient parser")
    void lenientParsing() {
        when(mockCallResponse.content()).thenReturn("""
                ```json
                {"score":0.4,"comments":"Weak.","issues":"no sources","extra":true}
                ```
                """);

        GradeResult result = llmService.structuredCall("Grade", "Output", GradeResult.class);

        assertEquals(0.4, result.score());
        assertEquals(List.of("no sources"), result.issues());
    }

    @Test
    @DisplayName("empty content raises LlmEmptyResponseException")
    void emptyResponse() {
        when(mockCallResponse.content()).thenReturn("  ");
        assertThrows(LlmEmptyResponseException.class,
                () -> llmService.structuredCall("sys", "usr", RouteDecision.class));
    }

    @Test
    @DisplayName("unparseable content raises LlmParseException")
    void unparseable() {
        when(mockCallResponse.content()).thenReturn("I think the search agent should go next.");
        var e = assertThrows(LlmParseException.class,
                () -> llmService.structuredCall("sys", "usr", RouteDecision.class));
        assertEquals("RouteDecision", e.outputType());
        assertEquals("I think the search agent should go next.", e.content());
        assertTrue(e.getMessage().startsWith("Could not read the model output as RouteDecision"));
    }

    @Test
    @DisplayName("LlmParseException keeps only the start of long content")
    void parseExceptionPreview() {
        var e = new LlmParseException(RouteDecision.class, "x".repeat(1000), null);
        assertEquals(LlmParseException.CONTENT_PREVIEW + 3, e.content().length());
        assertTrue(e.content().endsWith("..."));
    }

    @Test
    @DisplayName("stripCodeFence removes markdown fences")
    void stripCodeFence() {
        assertEquals("{\"a\":1}", LlmService.stripCodeFence("```json\n{\"a\":1}\n```"));
        assertEquals("{\"a\":1}", LlmService.stripCodeFence("```\n{\"a\":1}```"));
        assertEquals("{\"a\":1}", LlmService.stripCodeFence("  {\"a\":1} "));
    }
}
