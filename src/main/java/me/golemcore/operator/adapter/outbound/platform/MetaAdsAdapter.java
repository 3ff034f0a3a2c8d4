package me.golemcore.operator.adapter.outbound.platform;

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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.operator.domain.model.BudgetChange;
import me.golemcore.operator.domain.model.EntityDomain;
import me.golemcore.operator.domain.model.OwnedEntity;
import me.golemcore.operator.domain.model.PlatformActionResult;
import me.golemcore.operator.infrastructure.config.OperatorProperties;
import me.golemcore.operator.port.outbound.AdPlatformPort;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Meta Marketing (Graph) API adapter for ad sets and campaigns.
 *
 * <p>
 * Endpoints:
 * <ul>
 * <li>GET /act_{account}/adsets, /act_{account}/campaigns - owned entities
 * with last-7-day spend
 * <li>POST /{id}?status=PAUSED|ACTIVE - pause or enable
 * <li>GET /{id}?fields=daily_budget, POST /{id}?daily_budget=cents - budget
 * </ul>
 *
 * <p>
 * Credentials per operator user under {@code operator.platforms.meta.accounts}.
 */
@Component
@Slf4j
public class MetaAdsAdapter implements AdPlatformPort {

    static final long MIN_DAILY_BUDGET_CENTS = 100;

    private static final MediaType FORM = MediaType.get("application/x-www-form-urlencoded");
    private static final String LIST_FIELDS = "id,name,status,daily_budget,insights.date_preset(last_7d){spend}";
    private static final int LIST_LIMIT = 200;

    private final OperatorProperties properties;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public MetaAdsAdapter(OperatorProperties properties, OkHttpClient httpClient, ObjectMapper objectMapper) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public String getPlatformId() {
        return "meta";
    }

    @Override
    public Set<EntityDomain> getSupportedDomains() {
        return EnumSet.of(EntityDomain.META_AD_SET, EntityDomain.META_CAMPAIGN);
    }

    @Override
    public CompletableFuture<List<OwnedEntity>> listEntities(String userId, EntityDomain domain) {
        return CompletableFuture.supplyAsync(() -> {
            OperatorProperties.MetaAccountProperties account = account(userId);
            String edge = domain == EntityDomain.META_CAMPAIGN ? "campaigns" : "adsets";
            HttpUrl url = url(accountPath(account.getAdAccountId()) + "/" + edge)
                    .addQueryParameter("fields", LIST_FIELDS)
                    .addQueryParameter("limit", String.valueOf(LIST_LIMIT))
                    .addQueryParameter("access_token", account.getAccessToken())
                    .build();
            JsonNode root = execute(new Request.Builder().url(url).get().build());

            List<OwnedEntity> entities = new ArrayList<>();
            for (JsonNode node : root.path("data")) {
                double spend = node.path("insights").path("data").path(0).path("spend").asDouble(0);
                entities.add(new OwnedEntity(node.path("id").asText(), node.path("name").asText(""), domain, spend,
                        node.path("status").asText(null)));
            }
            log.debug("[Meta] Listed {} {} for {}", entities.size(), edge, userId);
            return entities;
        });
    }

    @Override
    public CompletableFuture<PlatformActionResult> pause(String userId, EntityDomain domain, String entityId) {
        return updateStatus(userId, domain, entityId, "PAUSED");
    }

    @Override
    public CompletableFuture<PlatformActionResult> enable(String userId, EntityDomain domain, String entityId) {
        return updateStatus(userId, domain, entityId, "ACTIVE");
    }

    @Override
    public CompletableFuture<PlatformActionResult> adjustBudget(String userId, EntityDomain domain, String entityId,
            BudgetChange change) {
        return CompletableFuture.supplyAsync(() -> {
            OperatorProperties.MetaAccountProperties account = account(userId);
            Long previousCents = null;
            long newCents;
            if (change.isPercentage()) {
                previousCents = currentBudgetCents(account, entityId);
                newCents = Math.max(MIN_DAILY_BUDGET_CENTS, Math.round(change.applyTo(previousCents)));
            } else {
                newCents = Math.round(change.amount() * 100);
            }
            if (newCents < MIN_DAILY_BUDGET_CENTS) {
                throw new PlatformApiException("Budget cannot be less than $1.00/day");
            }

            HttpUrl url = url(entityId)
                    .addQueryParameter("daily_budget", String.valueOf(newCents))
                    .addQueryParameter("access_token", account.getAccessToken())
                    .build();
            execute(new Request.Builder().url(url).post(RequestBody.create("", FORM)).build());
            log.info("[Meta] {} {} daily budget set to {} cents", domain.getLabel(), entityId, newCents);

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("daily_budget_cents", newCents);
            if (previousCents != null) {
                details.put("previous_daily_budget_cents", previousCents);
            }
            return new PlatformActionResult(entityId, String.format(Locale.ROOT,
                    "%s %s budget set to $%.2f/day", domain.getLabel(), entityId, newCents / 100.0), details);
        });
    }

    private CompletableFuture<PlatformActionResult> updateStatus(String userId, EntityDomain domain, String entityId,
            String status) {
        return CompletableFuture.supplyAsync(() -> {
            OperatorProperties.MetaAccountProperties account = account(userId);
            HttpUrl url = url(entityId)
                    .addQueryParameter("status", status)
                    .addQueryParameter("access_token", account.getAccessToken())
                    .build();
            execute(new Request.Builder().url(url).post(RequestBody.create("", FORM)).build());
            String verb = "PAUSED".equals(status) ? "paused" : "enabled";
            log.info("[Meta] {} {} {}", domain.getLabel(), entityId, verb);
            return new PlatformActionResult(entityId, domain.getLabel() + " " + entityId + " " + verb,
                    Map.of("status", status));
        });
    }

    private long currentBudgetCents(OperatorProperties.MetaAccountProperties account, String entityId) {
        HttpUrl url = url(entityId)
                .addQueryParameter("fields", "daily_budget")
                .addQueryParameter("access_token", account.getAccessToken())
                .build();
        JsonNode root = execute(new Request.Builder().url(url).get().build());
        JsonNode budget = root.path("daily_budget");
        if (budget.isMissingNode() || budget.isNull()) {
            throw new PlatformApiException("Meta entity " + entityId + " has no daily budget");
        }
        return budget.asLong();
    }

    private JsonNode execute(Request request) {
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            String payload = body != null ? body.string() : "";
            JsonNode root;
            try {
                root = objectMapper.readTree(payload.isEmpty() ? "{}" : payload);
            } catch (IOException e) {
                throw new PlatformApiException("Meta API returned invalid JSON: "
                        + payload.substring(0, Math.min(200, payload.length())), e);
            }
            if (!response.isSuccessful()) {
                String message = root.path("error").path("message").asText("Meta API error: " + response.code());
                log.warn("[Meta] HTTP {}: {}", response.code(), message);
                throw new PlatformApiException(message);
            }
            return root;
        } catch (IOException e) {
            throw new PlatformApiException("Meta API request failed: " + e.getMessage(), e);
        }
    }

    private OperatorProperties.MetaAccountProperties account(String userId) {
        OperatorProperties.MetaAccountProperties account = properties.getPlatforms().getMeta().getAccounts()
                .get(userId);
        if (account == null || account.getAccessToken() == null || account.getAccessToken().isBlank()) {
            throw new PlatformApiException("No Meta access token configured");
        }
        return account;
    }

    private HttpUrl.Builder url(String path) {
        return HttpUrl.get(properties.getPlatforms().getMeta().getBaseUrl()).newBuilder().addPathSegments(path);
    }

    private static String accountPath(String adAccountId) {
        if (adAccountId == null || adAccountId.isBlank()) {
            throw new PlatformApiException("No Meta ad account configured");
        }
        return adAccountId.startsWith("act_") ? adAccountId : "act_" + adAccountId;
    }
}
