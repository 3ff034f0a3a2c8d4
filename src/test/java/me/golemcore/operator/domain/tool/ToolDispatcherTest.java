package me.golemcore.operator.domain.tool;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.operator.domain.confirmation.ConfirmationGateway;
import me.golemcore.operator.domain.confirmation.InMemoryPendingActionStore;
import me.golemcore.operator.domain.confirmation.PendingActionHandler;
import me.golemcore.operator.domain.confirmation.WriteActionPolicy;
import me.golemcore.operator.domain.model.EntityDomain;
import me.golemcore.operator.domain.model.Message;
import me.golemcore.operator.domain.model.OwnedEntity;
import me.golemcore.operator.domain.model.PlatformActionResult;
import me.golemcore.operator.domain.model.ToolFailureKind;
import me.golemcore.operator.domain.resolution.EntityDirectory;
import me.golemcore.operator.domain.resolution.EntityResolver;
import me.golemcore.operator.infrastructure.config.OperatorProperties;
import me.golemcore.operator.port.outbound.AdPlatformPort;
import me.golemcore.operator.port.outbound.CheckoutPlatformPort;
import me.golemcore.operator.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ToolDispatcherTest {

    private static final String USER = "alice";
    private static final OwnedEntity SPRING = new OwnedEntity("42", "Spring Launch", EntityDomain.META_AD_SET,
            120.0, "ACTIVE");
    private static final OwnedEntity SUMMER = new OwnedEntity("77", "Summer Sale", EntityDomain.META_AD_SET, 55.0,
            "PAUSED");

    private EntityDirectory directory;
    private PendingActionHandler handler;
    private ToolDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        OperatorProperties properties = new OperatorProperties();
        directory = mock(EntityDirectory.class);
        when(directory.listOwned(eq(USER), eq(EntityDomain.META_AD_SET))).thenReturn(List.of(SUMMER, SPRING));
        handler = mock(PendingActionHandler.class);
        when(handler.execute(any())).thenReturn(CompletableFuture.completedFuture(
                new PlatformActionResult("42", "Meta ad set 42 paused", Map.of("status", "PAUSED"))));
        EntityResolver resolver = new EntityResolver();
        ConfirmationGateway gateway = new ConfirmationGateway(new InMemoryPendingActionStore(), directory, resolver,
                new WriteActionPolicy(), handler, properties,
                new MutableClock(Instant.parse("2026-03-01T10:00:00Z")));
        dispatcher = new ToolDispatcher(new ToolInputParser(), gateway, directory, resolver, new ObjectMapper(),
                properties);
    }

    @Test
    void shouldReportUnknownTool() {
        ToolDispatchResult result = dispatcher.dispatch(USER, call("c1", "delete_everything", Map.of()));

        assertFalse(result.isSuccess());
        assertEquals(ToolFailureKind.UNKNOWN_TOOL, result.toolResult().getFailureKind());
        assertEquals("c1", result.toolCallId());
    }

    @Test
    void shouldReportValidationFailureWithoutTouchingPlatforms() {
        ToolDispatchResult result = dispatcher.dispatch(USER, call("c1", "pause_meta_adset", Map.of()));

        assertFalse(result.isSuccess());
        assertEquals(ToolFailureKind.VALIDATION_FAILED, result.toolResult().getFailureKind());
        verify(directory, never()).listOwned(any(), any());
    }

    @Test
    void shouldListEntitiesRankedBySpend() {
        ToolDispatchResult result = dispatcher.dispatch(USER, call("c1", "list_entities",
                Map.of("domain", "meta_adset")));

        assertTrue(result.isSuccess());
        @SuppressWarnings("unchecked")
        Map<String, Object> data = (Map<String, Object>) result.toolResult().getData();
        assertEquals(2, data.get("count"));
        @SuppressWarnings("unchecked")
        List<Map<String, Object>> rows = (List<Map<String, Object>>) data.get("entities");
        assertEquals("42", rows.get(0).get("id"));
        assertEquals("$120.00", rows.get(0).get("spend"));
        assertEquals("PAUSED", rows.get(1).get("status"));
    }

    @Test
    void shouldStageWriteToolInsteadOfExecuting() {
        ToolDispatchResult result = dispatcher.dispatch(USER, call("c1", "pause_meta_adset",
                Map.of("name", "spring launch")));

        assertTrue(result.isSuccess());
        assertTrue(result.content().contains("\"status\":\"pending_confirmation\""));
        assertTrue(result.summary().startsWith("⏳ Pending confirmation: Pause Meta ad set 42"));
        verify(handler, never()).execute(any());
    }

    @Test
    void shouldExecuteOnlyAfterConfirmAction() {
        ToolDispatchResult staged = dispatcher.dispatch(USER, call("c1", "pause_meta_adset",
                Map.of("adset_id", "42")));
        @SuppressWarnings("unchecked")
        String pendingId = (String) ((Map<String, Object>) staged.toolResult().getData()).get("pending_id");
        assertNotNull(pendingId);

        ToolDispatchResult confirmed = dispatcher.dispatch(USER, call("c2", "confirm_action",
                Map.of("pending_id", pendingId)));

        assertTrue(confirmed.isSuccess());
        assertTrue(confirmed.content().contains("\"status\":\"executed\""));
        assertEquals("✅ Pause Meta ad set 42 \"Spring Launch\"", confirmed.summary());
        verify(handler, times(1)).execute(any());

        ToolDispatchResult again = dispatcher.dispatch(USER, call("c3", "confirm_action",
                Map.of("pending_id", pendingId)));
        assertEquals(ToolFailureKind.ACTION_NOT_FOUND, again.toolResult().getFailureKind());
        verify(handler, times(1)).execute(any());
    }

    @Test
    void shouldReturnSuggestionsWhenTargetIsUnknown() {
        ToolDispatchResult result = dispatcher.dispatch(USER, call("c1", "pause_meta_adset",
                Map.of("name", "Winter")));

        assertTrue(result.isSuccess());
        assertTrue(result.content().contains("\"status\":\"not_found\""));
        assertTrue(result.content().contains("\"option\":1"));
    }

    @Test
    void shouldDisambiguateDuplicateNamesThenPauseChosenAdSetOnce() {
        AdPlatformPort meta = mock(AdPlatformPort.class);
        when(meta.getPlatformId()).thenReturn("meta");
        when(meta.getSupportedDomains()).thenReturn(Set.of(EntityDomain.META_AD_SET));
        when(meta.listEntities(USER, EntityDomain.META_AD_SET)).thenReturn(CompletableFuture.completedFuture(List.of(
                new OwnedEntity("57", "Spring Launch", EntityDomain.META_AD_SET, 200.0, "ACTIVE"),
                new OwnedEntity("42", "Spring Launch", EntityDomain.META_AD_SET, 500.0, "ACTIVE"))));
        when(meta.pause(USER, EntityDomain.META_AD_SET, "42")).thenReturn(CompletableFuture.completedFuture(
                new PlatformActionResult("42", "Meta ad set 42 paused", Map.of("status", "PAUSED"))));
        OperatorProperties properties = new OperatorProperties();
        EntityDirectory realDirectory = new EntityDirectory(List.of(meta), mock(CheckoutPlatformPort.class));
        EntityResolver resolver = new EntityResolver();
        ConfirmationGateway gateway = new ConfirmationGateway(new InMemoryPendingActionStore(), realDirectory,
                resolver, new WriteActionPolicy(), new PlatformActionHandler(realDirectory), properties,
                new MutableClock(Instant.parse("2026-03-01T10:00:00Z")));
        ToolDispatcher endToEnd = new ToolDispatcher(new ToolInputParser(), gateway, realDirectory, resolver,
                new ObjectMapper(), properties);

        ToolDispatchResult ambiguous = endToEnd.dispatch(USER, call("c1", "pause_meta_adset",
                Map.of("name", "Spring Launch")));

        @SuppressWarnings("unchecked")
        Map<String, Object> data = (Map<String, Object>) ambiguous.toolResult().getData();
        assertEquals("not_found", data.get("status"));
        assertEquals(List.of(
                Map.of("option", 1, "id", "42", "name", "Spring Launch", "spend", "$500.00"),
                Map.of("option", 2, "id", "57", "name", "Spring Launch", "spend", "$200.00")),
                data.get("suggestions"));

        ToolDispatchResult staged = endToEnd.dispatch(USER, call("c2", "pause_meta_adset",
                Map.of("adset_id", "42")));
        @SuppressWarnings("unchecked")
        String pendingId = (String) ((Map<String, Object>) staged.toolResult().getData()).get("pending_id");
        assertNotNull(pendingId);
        verify(meta, never()).pause(any(), any(), any());

        ToolDispatchResult confirmed = endToEnd.dispatch(USER, call("c3", "confirm_action",
                Map.of("pending_id", pendingId)));

        assertTrue(confirmed.content().contains("\"status\":\"executed\""));
        verify(meta, times(1)).pause(USER, EntityDomain.META_AD_SET, "42");
        verify(meta, never()).pause(USER, EntityDomain.META_AD_SET, "57");
    }

    @Test
    void shouldReportActionNotFoundForUnknownPendingId() {
        ToolDispatchResult result = dispatcher.dispatch(USER, call("c1", "cancel_action",
                Map.of("pending_id", "nope")));

        assertEquals(ToolFailureKind.ACTION_NOT_FOUND, result.toolResult().getFailureKind());
    }

    @Test
    void shouldConvertPlatformFailuresToExecutionFailed() {
        when(directory.listOwned(eq(USER), eq(EntityDomain.TIKTOK_AD_GROUP)))
                .thenThrow(new CompletionException(new IllegalStateException("No TikTok credentials configured")));

        ToolDispatchResult result = dispatcher.dispatch(USER, call("c1", "list_entities",
                Map.of("domain", "tiktok_adgroup")));

        assertEquals(ToolFailureKind.EXECUTION_FAILED, result.toolResult().getFailureKind());
        assertEquals("No TikTok credentials configured", result.toolResult().getError());
    }

    @Test
    void shouldCarryChartSpec() {
        ToolDispatchResult result = dispatcher.dispatch(USER, call("c1", "render_chart", Map.of(
                "type", "kpi", "title", "ROAS", "value", 3.2)));

        assertTrue(result.isSuccess());
        assertNotNull(result.chart());
        assertEquals("ROAS", result.chart().get("title"));
        assertEquals("📊 Chart: ROAS", result.summary());
    }

    @Test
    void shouldNotCarryChartForOtherTools() {
        ToolDispatchResult result = dispatcher.dispatch(USER, call("c1", "list_entities",
                Map.of("domain", "meta_adset")));

        assertNull(result.chart());
    }

    private static Message.ToolCall call(String id, String name, Map<String, Object> arguments) {
        return Message.ToolCall.builder().id(id).name(name).arguments(arguments).build();
    }
}
