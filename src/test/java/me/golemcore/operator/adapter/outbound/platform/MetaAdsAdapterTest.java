package me.golemcore.operator.adapter.outbound.platform;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.operator.domain.model.BudgetChange;
import me.golemcore.operator.domain.model.EntityDomain;
import me.golemcore.operator.domain.model.OwnedEntity;
import me.golemcore.operator.domain.model.PlatformActionResult;
import me.golemcore.operator.infrastructure.config.OperatorProperties;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MetaAdsAdapterTest {

    private static final String USER = "alice";
    private static final String TOKEN = "meta-token";

    private MockWebServer mockServer;
    private MetaAdsAdapter adapter;

    @BeforeEach
    void setUp() throws IOException {
        mockServer = new MockWebServer();
        mockServer.start();

        OperatorProperties properties = new OperatorProperties();
        OperatorProperties.MetaProperties meta = properties.getPlatforms().getMeta();
        meta.setBaseUrl(mockServer.url("/v21.0").toString());
        OperatorProperties.MetaAccountProperties account = new OperatorProperties.MetaAccountProperties();
        account.setAccessToken(TOKEN);
        account.setAdAccountId("12345");
        meta.getAccounts().put(USER, account);

        adapter = new MetaAdsAdapter(properties, new OkHttpClient(), new ObjectMapper());
    }

    @AfterEach
    void tearDown() throws IOException {
        mockServer.shutdown();
    }

    @Test
    void shouldListAdSetsWithSpend() throws Exception {
        mockServer.enqueue(json("{\"data\":["
                + "{\"id\":\"111\",\"name\":\"Spring Sale\",\"status\":\"ACTIVE\","
                + "\"insights\":{\"data\":[{\"spend\":\"42.50\"}]}},"
                + "{\"id\":\"222\",\"name\":\"Retargeting\",\"status\":\"PAUSED\"}]}"));

        List<OwnedEntity> entities = adapter.listEntities(USER, EntityDomain.META_AD_SET).join();

        assertEquals(2, entities.size());
        assertEquals(new OwnedEntity("111", "Spring Sale", EntityDomain.META_AD_SET, 42.5, "ACTIVE"),
                entities.get(0));
        assertEquals(0.0, entities.get(1).rankingMetric());

        RecordedRequest request = mockServer.takeRequest();
        HttpUrl url = request.getRequestUrl();
        assertEquals("GET", request.getMethod());
        assertEquals("/v21.0/act_12345/adsets", url.encodedPath());
        assertEquals(TOKEN, url.queryParameter("access_token"));
        assertTrue(url.queryParameter("fields").contains("spend"));
    }

    @Test
    void shouldListCampaignsFromCampaignEdge() throws Exception {
        mockServer.enqueue(json("{\"data\":[]}"));

        assertTrue(adapter.listEntities(USER, EntityDomain.META_CAMPAIGN).join().isEmpty());

        assertEquals("/v21.0/act_12345/campaigns", mockServer.takeRequest().getRequestUrl().encodedPath());
    }

    @Test
    void shouldPauseEntity() throws Exception {
        mockServer.enqueue(json("{\"success\":true}"));

        PlatformActionResult result = adapter.pause(USER, EntityDomain.META_AD_SET, "111").join();

        assertEquals("Meta ad set 111 paused", result.message());
        assertEquals("PAUSED", result.details().get("status"));
        RecordedRequest request = mockServer.takeRequest();
        assertEquals("POST", request.getMethod());
        assertEquals("/v21.0/111", request.getRequestUrl().encodedPath());
        assertEquals("PAUSED", request.getRequestUrl().queryParameter("status"));
    }

    @Test
    void shouldEnableEntity() throws Exception {
        mockServer.enqueue(json("{\"success\":true}"));

        PlatformActionResult result = adapter.enable(USER, EntityDomain.META_CAMPAIGN, "333").join();

        assertEquals("Meta campaign 333 enabled", result.message());
        assertEquals("ACTIVE", mockServer.takeRequest().getRequestUrl().queryParameter("status"));
    }

    @Test
    void shouldSetAbsoluteBudgetInCents() throws Exception {
        mockServer.enqueue(json("{\"success\":true}"));

        PlatformActionResult result = adapter.adjustBudget(USER, EntityDomain.META_AD_SET, "111",
                BudgetChange.dailyBudget(75)).join();

        assertEquals("Meta ad set 111 budget set to $75.00/day", result.message());
        assertEquals(7500L, result.details().get("daily_budget_cents"));
        assertEquals("7500", mockServer.takeRequest().getRequestUrl().queryParameter("daily_budget"));
    }

    @Test
    void shouldApplyPercentageToCurrentBudget() throws Exception {
        mockServer.enqueue(json("{\"id\":\"111\",\"daily_budget\":\"5000\"}"));
        mockServer.enqueue(json("{\"success\":true}"));

        PlatformActionResult result = adapter.adjustBudget(USER, EntityDomain.META_AD_SET, "111",
                BudgetChange.increase(20)).join();

        assertEquals(6000L, result.details().get("daily_budget_cents"));
        assertEquals(5000L, result.details().get("previous_daily_budget_cents"));
        RecordedRequest read = mockServer.takeRequest();
        assertEquals("GET", read.getMethod());
        assertEquals("daily_budget", read.getRequestUrl().queryParameter("fields"));
        assertEquals("6000", mockServer.takeRequest().getRequestUrl().queryParameter("daily_budget"));
    }

    @Test
    void shouldRejectBudgetBelowMinimumWithoutCallingApi() {
        CompletionException ex = assertThrows(CompletionException.class,
                () -> adapter.adjustBudget(USER, EntityDomain.META_AD_SET, "111", BudgetChange.dailyBudget(0.5))
                        .join());

        assertInstanceOf(PlatformApiException.class, ex.getCause());
        assertEquals(0, mockServer.getRequestCount());
    }

    @Test
    void shouldSurfaceGraphErrorMessage() {
        mockServer.enqueue(new MockResponse().setResponseCode(400)
                .setHeader("Content-Type", "application/json")
                .setBody("{\"error\":{\"message\":\"Invalid OAuth access token.\",\"code\":190}}"));

        CompletionException ex = assertThrows(CompletionException.class,
                () -> adapter.pause(USER, EntityDomain.META_AD_SET, "111").join());

        assertEquals("Invalid OAuth access token.", ex.getCause().getMessage());
    }

    @Test
    void shouldFailWithoutCredentials() {
        CompletionException ex = assertThrows(CompletionException.class,
                () -> adapter.listEntities("bob", EntityDomain.META_AD_SET).join());

        assertEquals("No Meta access token configured", ex.getCause().getMessage());
    }

    private static MockResponse json(String body) {
        return new MockResponse().setHeader("Content-Type", "application/json").setBody(body);
    }
}
