package com.pulsewatch.agent.prometheus;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.pulsewatch.agent.config.AgentProperties;
import com.pulsewatch.agent.model.Metric;
import com.pulsewatch.agent.model.MetricPoint;
import com.pulsewatch.agent.model.MetricQuery;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * Range-query client for the Prometheus HTTP API. Calls block; the pipeline runs them on its
 * own fetch pool.
 */
@Component
public class PrometheusClient implements MetricFetcher {
    private static final Logger log = LoggerFactory.getLogger(PrometheusClient.class);
    private static final Duration HEALTH_TIMEOUT = Duration.ofSeconds(2);

    private final WebClient webClient;
    private final String baseUrl;
    private final Duration timeout;

    public PrometheusClient(AgentProperties properties) {
        this.baseUrl = properties.prometheus().url();
        this.timeout = properties.prometheus().timeout();
        this.webClient = WebClient.builder()
                .baseUrl(baseUrl)
                .defaultHeader("Accept", MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    @Override
    public Metric fetch(MetricQuery query, Instant start, Instant end, Duration step) {
        QueryRangeResponse response;
        try {
            response = webClient.get()
                    .uri(builder -> builder.path("/api/v1/query_range")
                            .queryParam("query", "{query}")
                            .queryParam("start", "{start}")
                            .queryParam("end", "{end}")
                            .queryParam("step", "{step}")
                            .build(Map.of(
                                    "query", query.expression(),
                                    "start", start.getEpochSecond(),
                                    "end", end.getEpochSecond(),
                                    "step", Math.max(1, step.toSeconds()))))
                    .retrieve()
                    .bodyToMono(QueryRangeResponse.class)
                    .timeout(timeout)
                    .block();
        } catch (WebClientResponseException e) {
            throw new FetchException(query.name(), "Prometheus returned " + e.getStatusCode().value()
                    + " for " + query.name() + ": " + e.getResponseBodyAsString(), e);
        } catch (RuntimeException e) {
            throw new FetchException(query.name(), "Prometheus query failed for " + query.name() + ": " + e.getMessage(), e);
        }
        if (response == null) {
            throw new FetchException(query.name(), "Empty response from Prometheus for " + query.name());
        }
        if (!"success".equals(response.status())) {
            throw new FetchException(query.name(), "Prometheus query for " + query.name() + " failed: "
                    + response.errorType() + " " + response.error());
        }
        return toMetric(query, response);
    }

    public boolean isReachable() {
        try {
            webClient.get().uri("/-/healthy")
                    .retrieve()
                    .toBodilessEntity()
                    .timeout(HEALTH_TIMEOUT)
                    .block();
            return true;
        } catch (RuntimeException e) {
            log.debug("Prometheus at {} not reachable: {}", baseUrl, e.getMessage());
            return false;
        }
    }

    public String baseUrl() {
        return baseUrl;
    }

    private Metric toMetric(MetricQuery query, QueryRangeResponse response) {
        List<Series> result = response.data() == null || response.data().result() == null
                ? List.of()
                : response.data().result();
        if (result.isEmpty()) {
            log.debug("No series returned for {}", query.name());
            return Metric.empty(query.name());
        }
        if (result.size() > 1) {
            log.debug("Query for {} returned {} series; using the first", query.name(), result.size());
        }
        Series series = result.get(0);
        List<MetricPoint> points = new ArrayList<>();
        if (series.values() != null) {
            for (List<Object> pair : series.values()) {
                points.add(toPoint(query, pair));
            }
        }
        return new Metric(query.name(), series.metric(), points);
    }

    private static MetricPoint toPoint(MetricQuery query, List<Object> pair) {
        if (pair == null || pair.size() != 2 || !(pair.get(0) instanceof Number ts)) {
            throw new FetchException(query.name(), "Malformed sample for " + query.name() + ": " + pair);
        }
        Instant timestamp = Instant.ofEpochMilli(Math.round(ts.doubleValue() * 1000));
        return new MetricPoint(timestamp, parseValue(query, String.valueOf(pair.get(1))));
    }

    static double parseValue(MetricQuery query, String raw) {
        switch (raw) {
            case "+Inf":
                return Double.POSITIVE_INFINITY;
            case "-Inf":
                return Double.NEGATIVE_INFINITY;
            default:
                try {
                    return Double.parseDouble(raw);
                } catch (NumberFormatException e) {
                    throw new FetchException(query.name(), "Unparseable sample value '" + raw + "' for " + query.name(), e);
                }
        }
    }

    // --- Response DTOs --- //
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record QueryRangeResponse(
            @JsonProperty("status") String status,
            @JsonProperty("data") Data data,
            @JsonProperty("errorType") String errorType,
            @JsonProperty("error") String error
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Data(
            @JsonProperty("resultType") String resultType,
            @JsonProperty("result") List<Series> result
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Series(
            @JsonProperty("metric") Map<String, String> metric,
            @JsonProperty("values") List<List<Object>> values
    ) {}
}
