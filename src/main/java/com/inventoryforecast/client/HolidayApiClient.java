package com.inventoryforecast.client;

import com.inventoryforecast.exception.HolidayReferenceUnavailableException;
import com.fasterxml.jackson.databind.JsonNode;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Holiday reference backed by a public-holiday REST API
 * ({@code GET /PublicHolidays/{year}/{countryCode}}). Years are fetched once and cached.
 *
 * <p>With {@code holidays.api.fail-open} (the default) a year the API cannot serve is
 * reported as not covered and has no holidays; it is asked for again once
 * {@code holidays.api.retry-after-seconds} have passed. Otherwise the failure propagates.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "pipeline.holidays.provider", havingValue = "remote")
public class HolidayApiClient implements HolidayCalendar {

    @Value("${holidays.api.base-url}")
    private String baseUrl;

    @Value("${holidays.api.timeout-seconds:5}")
    private int timeoutSeconds;

    @Value("${pipeline.holidays.country-code:US}")
    private String countryCode;

    @Value("${holidays.api.fail-open:true}")
    private boolean failOpen;

    @Value("${holidays.api.retry-after-seconds:300}")
    private int retryAfterSeconds;

    private WebClient webClient;
    private final ConcurrentHashMap<Integer, Set<LocalDate>> cache = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<Integer, Instant> unavailableUntil = new ConcurrentHashMap<>();

    @PostConstruct
    void init() {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 5_000)
            .doOnConnected(conn -> conn.addHandlerLast(
                new ReadTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS)));
        this.webClient = WebClient.builder()
            .baseUrl(baseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .build();
        log.info("HolidayApiClient initialised → {} | country={}", baseUrl, countryCode);
    }

    @Override
    public boolean isHoliday(LocalDate date) {
        return lookup(date.getYear()).map(dates -> dates.contains(date)).orElse(false);
    }

    @Override
    public boolean covers(LocalDate date) {
        return lookup(date.getYear()).isPresent();
    }

    Optional<Set<LocalDate>> lookup(int year) {
        Set<LocalDate> cached = cache.get(year);
        if (cached != null) {
            return Optional.of(cached);
        }
        Instant blockedUntil = unavailableUntil.get(year);
        if (blockedUntil != null && Instant.now().isBefore(blockedUntil)) {
            return Optional.empty();
        }
        try {
            Set<LocalDate> dates = holidaysFor(year);
            unavailableUntil.remove(year);
            return Optional.of(dates);
        } catch (HolidayReferenceUnavailableException | IllegalStateException e) {
            if (!failOpen) {
                throw e;
            }
            unavailableUntil.put(year, Instant.now().plusSeconds(retryAfterSeconds));
            log.warn("Holiday reference unavailable, treating year as uncovered | year={} | country={} | reason={}",
                     year, countryCode, e.getMessage());
            return Optional.empty();
        }
    }

    Set<LocalDate> holidaysFor(int year) {
        return cache.computeIfAbsent(year, y -> {
            Set<LocalDate> fetched = fetchYear(y).block(Duration.ofSeconds(timeoutSeconds * 3L));
            if (fetched == null) {
                throw new HolidayReferenceUnavailableException("Holiday reference returned no data for " + y);
            }
            return fetched;
        });
    }

    public Mono<Set<LocalDate>> fetchYear(int year) {
        return webClient.get().uri("/PublicHolidays/{year}/{country}", year, countryCode)
            .retrieve()
            .onStatus(HttpStatusCode::isError, resp ->
                resp.bodyToMono(String.class)
                    .defaultIfEmpty("")
                    .map(b -> new HolidayReferenceUnavailableException(
                        "Holiday reference responded " + resp.statusCode().value() + " for " + year + ": " + b)))
            .bodyToFlux(JsonNode.class)
            .map(this::toDate)
            .collect(Collectors.toUnmodifiableSet())
            .retryWhen(Retry.backoff(2, Duration.ofMillis(300))
                .filter(ex -> ex instanceof WebClientRequestException)
                .onRetryExhaustedThrow((spec, sig) -> new HolidayReferenceUnavailableException(sig.failure())))
            .onErrorMap(WebClientRequestException.class, HolidayReferenceUnavailableException::new)
            .doOnNext(dates -> log.info("Holidays fetched | year={} | country={} | count={}",
                                        year, countryCode, dates.size()));
    }

    private LocalDate toDate(JsonNode node) {
        if (node == null || !node.hasNonNull("date")) {
            throw new HolidayReferenceUnavailableException("Holiday entry missing 'date': " + node);
        }
        try {
            return LocalDate.parse(node.get("date").asText());
        } catch (DateTimeParseException e) {
            throw new HolidayReferenceUnavailableException(e);
        }
    }
}
