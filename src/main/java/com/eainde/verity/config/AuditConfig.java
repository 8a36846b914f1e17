package com.eainde.verity.config;

import com.eainde.verity.integration.ClimatiqEmissionsClient;
import com.eainde.verity.integration.EmissionsClient;
import com.eainde.verity.integration.EntityRegistryClient;
import com.eainde.verity.integration.GleifRegistryClient;
import com.eainde.verity.integration.IntelligenceClient;
import com.eainde.verity.integration.LangChainReasoningClient;
import com.eainde.verity.integration.ReasoningClient;
import com.eainde.verity.integration.YouSearchIntelligenceClient;
import com.eainde.verity.log.AuditLogObserver;
import com.eainde.verity.log.LogBroadcaster;
import com.eainde.verity.thread.MdcAwareExecutor;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import lombok.extern.log4j.Log4j2;
import okhttp3.OkHttpClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;

@Log4j2
@Configuration
public class AuditConfig {

    @Bean
    public Clock auditClock() {
        return Clock.systemUTC();
    }

    @Bean
    public AuditSettings auditSettings(
            @Value("${verity.audit.reference-date:2026-02-26}") String referenceDate,
            @Value("${verity.audit.default-max-loops:3}") int defaultMaxLoops,
            @Value("${verity.audit.max-loops-ceiling:10}") int maxLoopsCeiling,
            @Value("${verity.audit.action-deadline-days:14}") int actionDeadlineDays,
            @Value("${verity.audit.remediation-window-days:17}") int remediationWindowDays,
            @Value("${verity.audit.pricing.input-per-million-usd:3.0}") double inputPrice,
            @Value("${verity.audit.pricing.output-per-million-usd:15.0}") double outputPrice) {
        return new AuditSettings(LocalDate.parse(referenceDate), defaultMaxLoops, maxLoopsCeiling,
                actionDeadlineDays, remediationWindowDays, inputPrice, outputPrice);
    }

    @Bean(name = "collaboratorExecutor", destroyMethod = "close")
    public MdcAwareExecutor collaboratorExecutor() {
        return new MdcAwareExecutor(Executors.newCachedThreadPool());
    }

    @Bean(name = "logDispatchExecutor", destroyMethod = "close")
    public MdcAwareExecutor logDispatchExecutor() {
        return new MdcAwareExecutor(Executors.newSingleThreadExecutor());
    }

    @Bean
    public LogBroadcaster logBroadcaster(@Qualifier("logDispatchExecutor") Executor dispatcher,
                                         List<AuditLogObserver> observers) {
        return new LogBroadcaster(dispatcher, observers);
    }

    @Bean
    public OkHttpClient collaboratorHttpClient(
            @Value("${verity.integrations.http.connect-timeout-seconds:5}") long connectTimeout,
            @Value("${verity.integrations.http.read-timeout-seconds:15}") long readTimeout) {
        return new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(connectTimeout))
                .readTimeout(Duration.ofSeconds(readTimeout))
                .callTimeout(Duration.ofSeconds(connectTimeout + readTimeout))
                .build();
    }

    @Bean
    public ReasoningClient reasoningClient(
            @Value("${verity.integrations.anthropic.api-key:}") String apiKey,
            @Value("${verity.integrations.anthropic.model:claude-3-5-sonnet-20241022}") String model,
            @Value("${verity.integrations.anthropic.max-tokens:4096}") int maxTokens,
            @Value("${verity.integrations.anthropic.timeout-seconds:60}") long timeoutSeconds) {
        if (apiKey.isBlank()) {
            log.warn("No reasoning API key configured; reasoning steps will use their fallbacks");
            return ReasoningClient.unavailable("no API key configured");
        }
        return new LangChainReasoningClient(AnthropicChatModel.builder()
                .apiKey(apiKey)
                .modelName(model)
                .maxTokens(maxTokens)
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .build());
    }

    @Bean
    public EmissionsClient emissionsClient(
            OkHttpClient collaboratorHttpClient,
            ObjectMapper objectMapper,
            @Value("${verity.integrations.climatiq.base-url:https://api.climatiq.io/data/v1}") String baseUrl,
            @Value("${verity.integrations.climatiq.api-key:}") String apiKey) {
        return new ClimatiqEmissionsClient(collaboratorHttpClient, objectMapper, baseUrl, apiKey);
    }

    @Bean
    public EntityRegistryClient entityRegistryClient(
            OkHttpClient collaboratorHttpClient,
            ObjectMapper objectMapper,
            @Value("${verity.integrations.gleif.base-url:https://api.gleif.org/api/v1}") String baseUrl) {
        return new GleifRegistryClient(collaboratorHttpClient, objectMapper, baseUrl);
    }

    @Bean
    public IntelligenceClient intelligenceClient(
            OkHttpClient collaboratorHttpClient,
            ObjectMapper objectMapper,
            Clock auditClock,
            @Value("${verity.integrations.you.base-url:https://api.ydc-index.io}") String baseUrl,
            @Value("${verity.integrations.you.api-key:}") String apiKey) {
        return new YouSearchIntelligenceClient(collaboratorHttpClient, objectMapper, baseUrl, apiKey, auditClock);
    }
}
