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
import me.golemcore.operator.domain.model.EntityDomain;
import me.golemcore.operator.domain.model.OwnedEntity;
import me.golemcore.operator.domain.model.PlatformActionResult;
import me.golemcore.operator.infrastructure.config.OperatorProperties;
import me.golemcore.operator.port.outbound.CheckoutPlatformPort;
import lombok.extern.slf4j.Slf4j;
import okhttp3.FormBody;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Checkout Champ adapter for subscription purchases.
 *
 * <p>
 * Credentials travel as {@code loginId}/{@code password} query parameters;
 * writes send their fields form-encoded. A {@code result} of {@code ERROR} is
 * an error, with the reason in {@code message}.
 */
@Component
@Slf4j
public class CheckoutChampAdapter implements CheckoutPlatformPort {

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("MM/dd/yyyy");
    private static final String PURCHASE_ID = "purchaseId";
    private static final int RESULTS_PER_PAGE = 200;

    private final OperatorProperties properties;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public CheckoutChampAdapter(OperatorProperties properties, OkHttpClient httpClient, ObjectMapper objectMapper,
            Clock clock) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public CompletableFuture<List<OwnedEntity>> listSubscriptions(String userId) {
        return CompletableFuture.supplyAsync(() -> {
            OperatorProperties.CheckoutAccountProperties account = account(userId);
            LocalDate today = LocalDate.now(clock);
            LocalDate start = today.minusDays(properties.getPlatforms().getCheckout().getLookbackDays());
            HttpUrl url = url(account, "purchase/query/")
                    .addQueryParameter("startDate", DATE_FORMAT.format(start))
                    .addQueryParameter("endDate", DATE_FORMAT.format(today))
                    .addQueryParameter("status", "ACTIVE")
                    .addQueryParameter("resultsPerPage", String.valueOf(RESULTS_PER_PAGE))
                    .build();
            JsonNode root = execute(new Request.Builder().url(url).get().build(), true);

            List<OwnedEntity> subscriptions = new ArrayList<>();
            for (JsonNode node : root.path("message").path("data")) {
                subscriptions.add(new OwnedEntity(node.path(PURCHASE_ID).asText(),
                        node.path("productName").asText(""), EntityDomain.SUBSCRIPTION,
                        node.path("price").asDouble(0), node.path("status").asText(null)));
            }
            log.debug("[Checkout] Listed {} subscriptions for {}", subscriptions.size(), userId);
            return subscriptions;
        });
    }

    @Override
    public CompletableFuture<PlatformActionResult> pauseSubscription(String userId, String purchaseId) {
        return CompletableFuture.supplyAsync(() -> {
            OperatorProperties.CheckoutAccountProperties account = account(userId);
            FormBody body = new FormBody.Builder().add(PURCHASE_ID, purchaseId).build();
            JsonNode root = execute(new Request.Builder().url(url(account, "purchase/pause/").build())
                    .post(body).build(), false);
            log.info("[Checkout] Subscription {} paused", purchaseId);
            return new PlatformActionResult(purchaseId, "Subscription " + purchaseId + " paused",
                    Map.of("status", root.path("result").asText("SUCCESS")));
        });
    }

    @Override
    public CompletableFuture<PlatformActionResult> cancelSubscription(String userId, String purchaseId,
            String reason) {
        return CompletableFuture.supplyAsync(() -> {
            OperatorProperties.CheckoutAccountProperties account = account(userId);
            FormBody body = new FormBody.Builder()
                    .add(PURCHASE_ID, purchaseId)
                    .add("cancelReason", reason)
                    .build();
            JsonNode root = execute(new Request.Builder().url(url(account, "purchase/cancel/").build())
                    .post(body).build(), false);
            log.info("[Checkout] Subscription {} cancelled", purchaseId);
            return new PlatformActionResult(purchaseId, "Subscription " + purchaseId + " cancelled",
                    Map.of("status", root.path("result").asText("SUCCESS"), "reason", reason));
        });
    }

    /**
     * @param query
     *            queries report an empty result set as an ERROR whose message
     *            starts with "No "; that is returned as an empty payload
     */
    private JsonNode execute(Request request, boolean query) {
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            String payload = body != null ? body.string() : "";
            JsonNode root;
            try {
                root = objectMapper.readTree(payload);
            } catch (IOException e) {
                throw new PlatformApiException("Checkout Champ returned invalid JSON (HTTP " + response.code() + ")",
                        e);
            }
            if (root == null || !response.isSuccessful()) {
                throw new PlatformApiException("Checkout Champ error: HTTP " + response.code());
            }
            if ("ERROR".equals(root.path("result").asText())) {
                JsonNode message = root.path("message");
                String text = message.isTextual() ? message.asText() : "Unknown error";
                if (query && text.startsWith("No ")) {
                    return objectMapper.createObjectNode();
                }
                log.warn("[Checkout] {} failed: {}", request.url().encodedPath(), text);
                throw new PlatformApiException(text);
            }
            return root;
        } catch (IOException e) {
            throw new PlatformApiException("Checkout Champ request failed: " + e.getMessage(), e);
        }
    }

    private OperatorProperties.CheckoutAccountProperties account(String userId) {
        OperatorProperties.CheckoutAccountProperties account = properties.getPlatforms().getCheckout()
                .getAccounts().get(userId);
        if (account == null || account.getLoginId() == null || account.getPassword() == null) {
            throw new PlatformApiException("No Checkout Champ credentials configured");
        }
        return account;
    }

    private HttpUrl.Builder url(OperatorProperties.CheckoutAccountProperties account, String path) {
        return HttpUrl.get(properties.getPlatforms().getCheckout().getBaseUrl()).newBuilder()
                .addPathSegments(path)
                .addQueryParameter("loginId", account.getLoginId())
                .addQueryParameter("password", account.getPassword());
    }
}
