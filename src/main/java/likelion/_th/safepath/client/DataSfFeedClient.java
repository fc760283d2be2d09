package likelion._th.safepath.client;

import com.fasterxml.jackson.databind.JsonNode;
import likelion._th.safepath.config.SafePathProperties;
import likelion._th.safepath.domain.LatLng;
import likelion._th.safepath.exception.IncidentFetchException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Optional;

/**
 * Common SODA (Socrata) query plumbing for the DataSF datasets.
 */
@Slf4j
public abstract class DataSfFeedClient implements IncidentFeed {

    protected final WebClient webClient;
    protected final SafePathProperties properties;
    protected final Clock clock;

    protected DataSfFeedClient(WebClient webClient, SafePathProperties properties, Clock clock) {
        this.webClient = webClient;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * GET /resource/{dataset}.json with a SoQL where/order/limit. The SoQL
     * expressions go through URI variables so they are fully encoded.
     */
    protected JsonNode query(String dataset, String where, String order, int limit) {
        Duration timeout = properties.getFetch().getTimeout();
        long start = System.currentTimeMillis();

        JsonNode response;
        try {
            response = webClient.get()
                    .uri(uriBuilder -> uriBuilder
                            .path("/resource/{dataset}.json")
                            .queryParam("$where", "{where}")
                            .queryParam("$order", "{order}")
                            .queryParam("$limit", "{limit}")
                            .build(Map.of(
                                    "dataset", dataset,
                                    "where", where,
                                    "order", order,
                                    "limit", String.valueOf(limit))))
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .timeout(timeout)
                    .block();
        } catch (WebClientResponseException e) {
            throw new IncidentFetchException(sourceId(), "DataSF 응답 오류: HTTP " + e.getStatusCode().value(), e);
        } catch (RuntimeException e) {
            throw new IncidentFetchException(sourceId(), "DataSF 요청 실패: " + e.getMessage(), e);
        }

        if (response == null || !response.isArray()) {
            throw new IncidentFetchException(sourceId(), "DataSF 응답이 JSON 배열이 아님");
        }

        log.debug("{} 조회 완료: {} 건 (소요: {}ms)", sourceId(), response.size(), System.currentTimeMillis() - start);
        return response;
    }

    // lookback 기준 날짜 (YYYY-MM-DD, 설정 시간대 기준)
    protected String lookbackDate() {
        return LocalDate.now(clock.withZone(zone())).minusDays(properties.getFetch().getLookbackDays()).toString();
    }

    protected ZoneId zone() {
        return properties.getZone();
    }

    /**
     * DataSF timestamps are floating (no offset) local times; an explicit offset
     * is honoured when present.
     */
    protected Optional<Instant> parseTimestamp(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDateTime.parse(raw).atZone(zone()).toInstant());
        } catch (DateTimeParseException e) {
            try {
                return Optional.of(OffsetDateTime.parse(raw).toInstant());
            } catch (DateTimeParseException ignored) {
                log.debug("{} 시간 형식 오류: {}", sourceId(), raw);
                return Optional.empty();
            }
        }
    }

    // GeoJSON Point: [lng, lat]
    protected Optional<LatLng> parsePoint(JsonNode point) {
        if (point == null || !point.has("coordinates")) {
            return Optional.empty();
        }
        JsonNode coords = point.get("coordinates");
        if (!coords.isArray() || coords.size() < 2) {
            return Optional.empty();
        }
        return toLatLng(coords.get(1).asText(null), coords.get(0).asText(null));
    }

    protected Optional<LatLng> toLatLng(String lat, String lng) {
        if (lat == null || lng == null || lat.isBlank() || lng.isBlank()) {
            return Optional.empty();
        }
        try {
            double latitude = Double.parseDouble(lat);
            double longitude = Double.parseDouble(lng);
            // 좌표 없음(0,0) 레코드 제외
            if (latitude == 0.0 && longitude == 0.0) {
                return Optional.empty();
            }
            return Optional.of(new LatLng(latitude, longitude));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    protected static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
