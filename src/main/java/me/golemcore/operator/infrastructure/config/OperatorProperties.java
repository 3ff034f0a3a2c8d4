package me.golemcore.operator.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Centralized configuration properties for the operator, bound from
 * application.yml.
 *
 * <p>
 * All configuration is organized under the {@code operator.*} prefix. Nested
 * property classes cover each subsystem:
 * <ul>
 * <li>{@link LlmProperties} - oracle provider settings</li>
 * <li>{@link TurnProperties} - per-turn step limit and deadline</li>
 * <li>{@link ConfirmationProperties} - pending action TTL and sweep</li>
 * <li>{@link MemoryProperties} - long-term memory extraction cadence</li>
 * <li>{@link PlatformsProperties} - ad and checkout platform credentials</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "operator")
@Data
public class OperatorProperties {

    private LlmProperties llm = new LlmProperties();
    private RouterProperties router = new RouterProperties();
    private TurnProperties turn = new TurnProperties();
    private StreamProperties stream = new StreamProperties();
    private ConfirmationProperties confirmation = new ConfirmationProperties();
    private MemoryProperties memory = new MemoryProperties();
    private SuggestionsProperties suggestions = new SuggestionsProperties();
    private StorageProperties storage = new StorageProperties();
    private HttpProperties http = new HttpProperties();
    private PlatformsProperties platforms = new PlatformsProperties();

    // ==================== LLM ====================

    @Data
    public static class LlmProperties {
        private String provider = "langchain4j";
        private Langchain4jProperties langchain4j = new Langchain4jProperties();
    }

    @Data
    public static class Langchain4jProperties {
        private long timeoutMs = 120000;
        private Map<String, ProviderProperties> providers = new HashMap<>();
    }

    @Data
    public static class ProviderProperties {
        private String apiKey;
        private String baseUrl;
    }

    @Data
    public static class RouterProperties {
        /** Model driving the tool loop, as {@code provider/model}. */
        private String model = "anthropic/claude-sonnet-4-20250514";

        /** Lightweight model for memory extraction and follow-up suggestions. */
        private String lightModel = "anthropic/claude-3-5-haiku-20241022";

        private double temperature = 0.2;
        private int maxTokens = 4096;
    }

    // ==================== TURN BUDGET ====================

    @Data
    public static class TurnProperties {
        /** Max number of oracle calls allowed within a single turn. */
        private int maxLlmCalls = 10;

        /** Max wall-clock time budget for a single turn. */
        private Duration deadline = Duration.ofMinutes(2);

        /** Max time a single tool handler may take before its call is reported as failed. */
        private Duration toolTimeout = Duration.ofSeconds(30);

        /** Max characters of a tool result sent back to the oracle. */
        private int maxToolResultChars = 20000;
    }

    @Data
    public static class StreamProperties {
        /** Final answer text is streamed in chunks of this many characters. */
        private int chunkSize = 20;
    }

    // ==================== CONFIRMATION ====================

    @Data
    public static class ConfirmationProperties {
        private Duration ttl = Duration.ofMinutes(5);
        private Duration sweepInterval = Duration.ofMinutes(1);
        private boolean shortcutEnabled = true;
    }

    // ==================== MEMORY ====================

    @Data
    public static class MemoryProperties {
        private boolean enabled = true;

        /** Extraction fires on every N-th message appended to a conversation. */
        private int extractEvery = 5;
        private int windowMessages = 10;
        private int maxMessageChars = 500;
        private int maxFacts = 3;

        /** Number of most recent facts injected into the system context. */
        private int recallLimit = 20;
        private boolean deduplicate = true;

        /** Conversations whose message counters are kept; least recently active are dropped. */
        private int maxTrackedConversations = 10_000;
    }

    @Data
    public static class SuggestionsProperties {
        private boolean enabled = true;
        private int maxSuggestions = 3;
    }

    // ==================== STORAGE ====================

    @Data
    public static class StorageProperties {
        private String basePath = "${user.home}/.golemcore/operator";
        private String conversationsDirectory = "conversations";
        private String memoryDirectory = "memory";
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 30000;
        private long writeTimeout = 30000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    // ==================== PLATFORMS ====================

    @Data
    public static class PlatformsProperties {
        private MetaProperties meta = new MetaProperties();
        private TikTokProperties tiktok = new TikTokProperties();
        private CheckoutProperties checkout = new CheckoutProperties();
    }

    @Data
    public static class MetaProperties {
        private String baseUrl = "https://graph.facebook.com/v21.0";

        /** Credentials keyed by operator user id. */
        private Map<String, MetaAccountProperties> accounts = new HashMap<>();
    }

    @Data
    public static class MetaAccountProperties {
        private String accessToken;
        private String adAccountId;
    }

    @Data
    public static class TikTokProperties {
        private String baseUrl = "https://business-api.tiktok.com/open_api/v1.3";
        private Map<String, TikTokAccountProperties> accounts = new HashMap<>();
    }

    @Data
    public static class TikTokAccountProperties {
        private String accessToken;
        private String advertiserId;
    }

    @Data
    public static class CheckoutProperties {
        private String baseUrl = "https://api.checkoutchamp.com";

        /** How far back subscription listing looks for active purchases. */
        private int lookbackDays = 90;
        private Map<String, CheckoutAccountProperties> accounts = new HashMap<>();
    }

    @Data
    public static class CheckoutAccountProperties {
        private String loginId;
        private String password;
    }
}
