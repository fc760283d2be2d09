package likelion._th.safepath.client;

import com.fasterxml.jackson.databind.JsonNode;
import likelion._th.safepath.config.SafePathProperties;
import likelion._th.safepath.domain.LatLng;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.Optional;

@Component
@Slf4j
public class GraphHopperGeocodingClient implements GeocodingProvider {

    private final WebClient webClient;
    private final String apiKey;
    private final SafePathProperties properties;

    public GraphHopperGeocodingClient(
            @Qualifier("graphhopperClient") WebClient webClient,
            @Value("${external-api.graphhopper.api-key:}") String apiKey,
            SafePathProperties properties
    ) {
        this.webClient = webClient;
        this.apiKey = apiKey;
        this.properties = properties;
    }

    @Override
    public Optional<LatLng> geocode(String address) {
        if (address == null || address.isBlank()) {
            return Optional.empty();
        }

        JsonNode response;
        try {
            response = webClient.get()
                    .uri(uriBuilder -> uriBuilder
                            .path("/geocode")
                            .queryParam("q", "{q}")
                            .queryParam("locale", "en")
                            .queryParam("limit", 1)
                            .queryParam("key", "{key}")
                            .build(address, apiKey))
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .timeout(properties.getFetch().getTimeout())
                    .block();
        } catch (RuntimeException e) {
            log.warn("지오코딩 실패 ({}): {}", address, e.getMessage());
            return Optional.empty();
        }

        if (response == null || !response.has("hits") || response.get("hits").isEmpty()) {
            log.info("지오코딩 결과 없음: {}", address);
            return Optional.empty();
        }

        JsonNode point = response.get("hits").get(0).get("point");
        if (point == null || !point.has("lat") || !point.has("lng")) {
            return Optional.empty();
        }
        return Optional.of(new LatLng(point.get("lat").asDouble(), point.get("lng").asDouble()));
    }
}
