package com.inventoryforecast.client;

import com.inventoryforecast.exception.HolidayReferenceUnavailableException;
import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import org.junit.jupiter.api.*;
import org.springframework.test.util.ReflectionTestUtils;
import reactor.test.StepVerifier;

import java.time.LocalDate;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HolidayApiClientTest {

    private static WireMockServer wireMock;

    private HolidayApiClient client;

    @BeforeAll
    static void startWireMock() {
        wireMock = new WireMockServer(WireMockConfiguration.wireMockConfig().dynamicPort());
        wireMock.start();
    }

    @AfterAll
    static void stopWireMock() { wireMock.stop(); }

    @BeforeEach
    void setUp() {
        wireMock.resetAll();
        client = new HolidayApiClient();
        ReflectionTestUtils.setField(client, "baseUrl", wireMock.baseUrl());
        ReflectionTestUtils.setField(client, "timeoutSeconds", 2);
        ReflectionTestUtils.setField(client, "countryCode", "US");
        ReflectionTestUtils.setField(client, "failOpen", true);
        ReflectionTestUtils.setField(client, "retryAfterSeconds", 300);
        client.init();
    }

    private void stubYear(int year, String body) {
        wireMock.stubFor(get(urlEqualTo("/PublicHolidays/" + year + "/US")).willReturn(aResponse()
            .withHeader("Content-Type", "application/json")
            .withBody(body)));
    }

    @Test
    void fetchYear_parsesHolidayDates() {
        stubYear(2024, "[{\"date\":\"2024-01-01\",\"localName\":\"New Year's Day\"},"
            + "{\"date\":\"2024-07-04\",\"localName\":\"Independence Day\"}]");

        StepVerifier.create(client.fetchYear(2024))
            .assertNext(dates -> assertThat(dates)
                .containsExactlyInAnyOrder(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 7, 4)))
            .verifyComplete();
    }

    @Test
    void fetchYear_serverError_mapsToUnavailable() {
        wireMock.stubFor(get(urlEqualTo("/PublicHolidays/2024/US"))
            .willReturn(aResponse().withStatus(500).withBody("boom")));

        StepVerifier.create(client.fetchYear(2024))
            .expectError(HolidayReferenceUnavailableException.class)
            .verify();
    }

    @Test
    void fetchYear_entryWithoutDate_mapsToUnavailable() {
        stubYear(2024, "[{\"localName\":\"Mystery Day\"}]");

        StepVerifier.create(client.fetchYear(2024))
            .expectError(HolidayReferenceUnavailableException.class)
            .verify();
    }

    @Test
    void isHoliday_fetchesEachYearOnce() {
        stubYear(2024, "[{\"date\":\"2024-12-25\"}]");

        assertThat(client.isHoliday(LocalDate.of(2024, 12, 25))).isTrue();
        assertThat(client.isHoliday(LocalDate.of(2024, 12, 26))).isFalse();
        assertThat(client.covers(LocalDate.of(2024, 3, 1))).isTrue();

        wireMock.verify(1, getRequestedFor(urlEqualTo("/PublicHolidays/2024/US")));
    }

    @Test
    void referenceDown_yearIsUncoveredAndHasNoHolidays() {
        wireMock.stubFor(get(urlEqualTo("/PublicHolidays/2023/US"))
            .willReturn(aResponse().withStatus(503)));

        assertThat(client.covers(LocalDate.of(2023, 5, 1))).isFalse();
        assertThat(client.isHoliday(LocalDate.of(2023, 12, 25))).isFalse();

        wireMock.verify(1, getRequestedFor(urlEqualTo("/PublicHolidays/2023/US")));
    }

    @Test
    void referenceDown_yearIsAskedForAgainAfterTheRetryDelay() {
        ReflectionTestUtils.setField(client, "retryAfterSeconds", 0);
        wireMock.stubFor(get(urlEqualTo("/PublicHolidays/2023/US"))
            .willReturn(aResponse().withStatus(503)));
        assertThat(client.covers(LocalDate.of(2023, 5, 1))).isFalse();

        wireMock.resetAll();
        stubYear(2023, "[{\"date\":\"2023-12-25\"}]");

        assertThat(client.covers(LocalDate.of(2023, 5, 1))).isTrue();
        assertThat(client.isHoliday(LocalDate.of(2023, 12, 25))).isTrue();
    }

    @Test
    void referenceDown_withoutFailOpen_throws() {
        ReflectionTestUtils.setField(client, "failOpen", false);
        wireMock.stubFor(get(urlEqualTo("/PublicHolidays/2023/US"))
            .willReturn(aResponse().withStatus(503)));

        assertThatThrownBy(() -> client.isHoliday(LocalDate.of(2023, 5, 1)))
            .isInstanceOf(HolidayReferenceUnavailableException.class);
    }
}
