package me.golemcore.operator.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.operator.domain.model.LlmRequest;
import me.golemcore.operator.domain.model.LlmResponse;
import me.golemcore.operator.infrastructure.config.OperatorProperties;
import me.golemcore.operator.port.outbound.LlmPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SuggestionServiceTest {

    private LlmPort llmPort;
    private OperatorProperties properties;
    private SuggestionService service;

    @BeforeEach
    void setUp() {
        llmPort = mock(LlmPort.class);
        properties = new OperatorProperties();
        service = new SuggestionService(llmPort, new ObjectMapper(), properties);
    }

    @Test
    void shouldReturnSuggestionsCappedAtMaximum() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(LlmResponse.builder()
                .content("```json\n[\"Why did CPA rise?\", \"Pause the worst ad set?\", \"Show ROAS\", \"More\"]\n```")
                .build()));

        List<String> suggestions = service.suggest("Spend rose 20% this week.");

        assertEquals(List.of("Why did CPA rise?", "Pause the worst ad set?", "Show ROAS"), suggestions);
        ArgumentCaptor<LlmRequest> request = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort).chat(request.capture());
        assertEquals(properties.getRouter().getLightModel(), request.getValue().getModel());
        assertEquals(200, request.getValue().getMaxTokens());
    }

    @Test
    void shouldTruncateLongAnswers() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(
                LlmResponse.builder().content("[]").build()));

        service.suggest("a".repeat(1500));

        ArgumentCaptor<LlmRequest> request = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort).chat(request.capture());
        String prompt = request.getValue().getMessages().get(0).getContent();
        assertTrue(prompt.endsWith("a".repeat(1000)));
        assertTrue(!prompt.contains("a".repeat(1001)));
    }

    @Test
    void shouldReturnEmptyOnFailure() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("down")));

        assertTrue(service.suggest("answer").isEmpty());
    }

    @Test
    void shouldNotCallOracleWhenDisabledOrBlank() {
        properties.getSuggestions().setEnabled(false);
        assertTrue(service.suggest("answer").isEmpty());

        properties.getSuggestions().setEnabled(true);
        assertTrue(service.suggest(" ").isEmpty());

        verify(llmPort, never()).chat(any());
    }
}
