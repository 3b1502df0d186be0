package com.pulsewatch.agent.forward;

import com.pulsewatch.agent.config.AgentProperties;
import com.pulsewatch.agent.model.Anomaly;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

/**
 * POSTs anomaly batches to the orchestrator. Each attempt has its own timeout and the whole
 * exchange, retries included, is bounded by a deadline. Nothing is kept once a batch is
 * dropped.
 */
@Component
public class OrchestratorForwarder implements AnomalyForwarder {
    private static final Logger log = LoggerFactory.getLogger(OrchestratorForwarder.class);

    private final WebClient webClient;
    private final AgentProperties.Orchestrator settings;
    private final String agentName;
    private final Clock clock;

    @Autowired
    public OrchestratorForwarder(AgentProperties properties, WebClient.Builder webClientBuilder) {
        this(properties, webClientBuilder, Clock.systemUTC());
    }

    OrchestratorForwarder(AgentProperties properties, WebClient.Builder webClientBuilder, Clock clock) {
        this.settings = properties.orchestrator();
        this.agentName = properties.agent().name();
        this.clock = clock;
        this.webClient = webClientBuilder
                .defaultHeader("Content-Type", MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    @Override
    public CompletableFuture<ForwardResult> forward(List<Anomaly> anomalies) {
        if (!settings.enabled()) {
            if (!anomalies.isEmpty()) {
                log.info("Forwarding disabled; {} anomalies not sent", anomalies.size());
            }
            return CompletableFuture.completedFuture(ForwardResult.SKIPPED);
        }
        if (anomalies.isEmpty()) {
            return CompletableFuture.completedFuture(ForwardResult.SKIPPED);
        }
        ForwardPayload payload = new ForwardPayload(agentName, clock.instant().toString(), anomalies);
        return send(payload)
                .retryWhen(Retry.backoff(settings.maxAttempts() - 1L, settings.initialBackoff())
                        .filter(ForwardingException.class::isInstance)
                        .doBeforeRetry(signal -> log.warn("Forward attempt {} of {} to {} failed: {}",
                                signal.totalRetries() + 1, settings.maxAttempts(), settings.endpoint(),
                                signal.failure().getMessage())))
                .timeout(settings.deadline())
                .thenReturn(ForwardResult.DELIVERED)
                .doOnNext(result -> log.info("Forwarded {} anomalies to {}", anomalies.size(), settings.endpoint()))
                .onErrorResume(e -> {
                    logDrop(anomalies, e);
                    return Mono.just(ForwardResult.DROPPED);
                })
                .toFuture();
    }

    private Mono<Void> send(ForwardPayload payload) {
        return webClient.post()
                .uri(settings.endpoint())
                .bodyValue(payload)
                .retrieve()
                .toBodilessEntity()
                .timeout(settings.timeout())
                .onErrorMap(e -> !(e instanceof ForwardingException), OrchestratorForwarder::toForwardingException)
                .then();
    }

    private static ForwardingException toForwardingException(Throwable e) {
        if (e instanceof WebClientResponseException response) {
            return new ForwardingException("Orchestrator answered " + response.getStatusCode().value(), e);
        }
        return new ForwardingException("Orchestrator unreachable: " + e.getMessage(), e);
    }

    private void logDrop(List<Anomaly> anomalies, Throwable cause) {
        Throwable reason = cause.getCause() != null ? cause.getCause() : cause;
        log.error("Dropping batch of {} anomalies for {} after {} attempts or {} deadline: {}",
                anomalies.size(), settings.endpoint(), settings.maxAttempts(), settings.deadline(), reason.getMessage());
        for (Anomaly anomaly : anomalies) {
            log.error("Dropped anomaly {} ({} {} {})", anomaly.anomalyId(), anomaly.metricName(),
                    anomaly.anomalyType().wireValue(), anomaly.severity().wireValue());
        }
    }
}
