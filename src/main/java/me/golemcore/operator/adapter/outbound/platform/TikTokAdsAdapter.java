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

import com.fasterxml.jackson.core.JsonProcessingException;
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
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * TikTok Business API adapter for ad groups.
 *
 * <p>
 * Every call carries the {@code Access-Token} header; a response with a
 * non-zero {@code code} is an error. Ad groups are ranked by their daily
 * budget.
 */
@Component
@Slf4j
public class TikTokAdsAdapter implements AdPlatformPort {

    static final double MIN_DAILY_BUDGET = 20.0;

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final String ACCESS_TOKEN_HEADER = "Access-Token";
    private static final String ADVERTISER_ID = "advertiser_id";
    private static final int PAGE_SIZE = 100;

    private final OperatorProperties properties;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public TikTokAdsAdapter(OperatorProperties properties, OkHttpClient httpClient, ObjectMapper objectMapper) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public String getPlatformId() {
        return "tiktok";
    }

    @Override
    public Set<EntityDomain> getSupportedDomains() {
        return EnumSet.of(EntityDomain.TIKTOK_AD_GROUP);
    }

    @Override
    public CompletableFuture<List<OwnedEntity>> listEntities(String userId, EntityDomain domain) {
        return CompletableFuture.supplyAsync(() -> {
            OperatorProperties.TikTokAccountProperties account = account(userId);
            HttpUrl url = url("adgroup/get/")
                    .addQueryParameter(ADVERTISER_ID, account.getAdvertiserId())
                    .addQueryParameter("fields", "[\"adgroup_id\",\"adgroup_name\",\"budget\",\"operation_status\"]")
                    .addQueryParameter("page_size", String.valueOf(PAGE_SIZE))
                    .build();
            JsonNode data = execute(account, new Request.Builder().url(url).get());

            List<OwnedEntity> entities = new ArrayList<>();
            for (JsonNode node : data.path("list")) {
                entities.add(new OwnedEntity(node.path("adgroup_id").asText(), node.path("adgroup_name").asText(""),
                        EntityDomain.TIKTOK_AD_GROUP, node.path("budget").asDouble(0),
                        node.path("operation_status").asText(null)));
            }
            log.debug("[TikTok] Listed {} ad groups for {}", entities.size(), userId);
            return entities;
        });
    }

    @Override
    public CompletableFuture<PlatformActionResult> pause(String userId, EntityDomain domain, String entityId) {
        return updateStatus(userId, entityId, "DISABLE");
    }

    @Override
    public CompletableFuture<PlatformActionResult> enable(String userId, EntityDomain domain, String entityId) {
        return updateStatus(userId, entityId, "ENABLE");
    }

    @Override
    public CompletableFuture<PlatformActionResult> adjustBudget(String userId, EntityDomain domain, String entityId,
            BudgetChange change) {
        return CompletableFuture.supplyAsync(() -> {
            OperatorProperties.TikTokAccountProperties account = account(userId);
            Double previous = null;
            double budget;
            if (change.isPercentage()) {
                previous = currentBudget(account, entityId);
                budget = Math.max(MIN_DAILY_BUDGET, Math.round(change.applyTo(previous) * 100) / 100.0);
            } else {
                budget = change.amount();
            }
            if (budget < MIN_DAILY_BUDGET) {
                throw new PlatformApiException("TikTok minimum daily budget is $20");
            }

            Map<String, Object> body = new LinkedHashMap<>();
            body.put(ADVERTISER_ID, account.getAdvertiserId());
            body.put("adgroup_id", entityId);
            body.put("budget", budget);
            post(account, "adgroup/update/", body);
            log.info("[TikTok] Ad group {} budget set to {}", entityId, budget);

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("budget", budget);
            if (previous != null) {
                details.put("previous_budget", previous);
            }
            return new PlatformActionResult(entityId,
                    String.format(Locale.ROOT, "TikTok ad group %s budget set to $%.2f/day", entityId, budget),
                    details);
        });
    }

    private CompletableFuture<PlatformActionResult> updateStatus(String userId, String entityId, String status) {
        return CompletableFuture.supplyAsync(() -> {
            OperatorProperties.TikTokAccountProperties account = account(userId);
            Map<String, Object> body = new LinkedHashMap<>();
            body.put(ADVERTISER_ID, account.getAdvertiserId());
            body.put("adgroup_ids", List.of(entityId));
            body.put("opt_status", status);
            post(account, "adgroup/status/update/", body);
            String verb = "DISABLE".equals(status) ? "paused" : "enabled";
            log.info("[TikTok] Ad group {} {}", entityId, verb);
            return new PlatformActionResult(entityId, "TikTok ad group " + entityId + " " + verb,
                    Map.of("opt_status", status));
        });
    }

    private double currentBudget(OperatorProperties.TikTokAccountProperties account, String entityId) {
        HttpUrl url = url("adgroup/get/")
                .addQueryParameter(ADVERTISER_ID, account.getAdvertiserId())
                .addQueryParameter("filtering", "{\"adgroup_ids\":[\"" + entityId + "\"]}")
                .addQueryParameter("fields", "[\"budget\"]")
                .build();
        JsonNode first = execute(account, new Request.Builder().url(url).get()).path("list").path(0);
        if (first.isMissingNode()) {
            throw new PlatformApiException("TikTok ad group " + entityId + " not found");
        }
        return first.path("budget").asDouble(0);
    }

    private JsonNode post(OperatorProperties.TikTokAccountProperties account, String path, Map<String, Object> body) {
        String json;
        try {
            json = objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
        return execute(account, new Request.Builder().url(url(path).build()).post(RequestBody.create(json, JSON)));
    }

    private JsonNode execute(OperatorProperties.TikTokAccountProperties account, Request.Builder builder) {
        Request request = builder.header(ACCESS_TOKEN_HEADER, account.getAccessToken()).build();
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            String payload = body != null ? body.string() : "";
            JsonNode root;
            try {
                root = objectMapper.readTree(payload);
            } catch (IOException e) {
                throw new PlatformApiException("TikTok API returned invalid JSON: "
                        + payload.substring(0, Math.min(200, payload.length())), e);
            }
            if (root == null || root.path("code").asInt(-1) != 0) {
                String message = root != null
                        ? root.path("message").asText("TikTok API error code " + root.path("code").asText())
                        : "TikTok API error: HTTP " + response.code();
                log.warn("[TikTok] {} failed: {}", request.url().encodedPath(), message);
                throw new PlatformApiException(message);
            }
            JsonNode data = root.path("data");
            return data.isMissingNode() ? root : data;
        } catch (IOException e) {
            throw new PlatformApiException("TikTok API request failed: " + e.getMessage(), e);
        }
    }

    private OperatorProperties.TikTokAccountProperties account(String userId) {
        OperatorProperties.TikTokAccountProperties account = properties.getPlatforms().getTiktok().getAccounts()
                .get(userId);
        if (account == null || account.getAccessToken() == null || account.getAccessToken().isBlank()) {
            throw new PlatformApiException("No TikTok credentials configured");
        }
        return account;
    }

    private HttpUrl.Builder url(String path) {
        return HttpUrl.get(properties.getPlatforms().getTiktok().getBaseUrl()).newBuilder().addPathSegments(path);
    }
}
