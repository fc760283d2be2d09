package likelion._th.safepath.client;

import likelion._th.safepath.config.SafePathProperties;
import likelion._th.safepath.domain.LatLng;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("GraphHopperGeocodingClient")
class GraphHopperGeocodingClientTest {

    private final AtomicReference<URI> lastRequest = new AtomicReference<>();

    private GraphHopperGeocodingClient clientReturning(HttpStatus status, String body) {
        WebClient webClient = WebClient.builder()
                .baseUrl("https://graphhopper.com/api/1")
                .exchangeFunction(request -> {
                    lastRequest.set(request.url());
                    return Mono.just(ClientResponse.create(status)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                            .body(body)
                            .build());
                })
                .build();
        return new GraphHopperGeocodingClient(webClient, "test-key", new SafePathProperties());
    }

    @Test
    @DisplayName("첫 번째 결과의 좌표 반환")
    void returnsFirstHit() {
        GraphHopperGeocodingClient client = clientReturning(HttpStatus.OK, """
                {"hits":[{"point":{"lat":37.7793,"lng":-122.4193},"name":"City Hall"},
                         {"point":{"lat":1.0,"lng":2.0}}]}
                """);

        assertThat(client.geocode("1 Dr Carlton B Goodlett Pl, San Francisco"))
                .contains(new LatLng(37.7793, -122.4193));
        assertThat(lastRequest.get().getPath()).endsWith("/geocode");
        assertThat(lastRequest.get().getQuery()).contains("q=1 Dr Carlton B Goodlett Pl, San Francisco");
    }

    @Test
    @DisplayName("결과가 없으면 empty")
    void noHitsIsEmpty() {
        assertThat(clientReturning(HttpStatus.OK, "{\"hits\":[]}").geocode("nowhere")).isEmpty();
    }

    @Test
    @DisplayName("API 오류도 empty")
    void errorIsEmpty() {
        assertThat(clientReturning(HttpStatus.UNAUTHORIZED, "{\"message\":\"bad key\"}").geocode("somewhere"))
                .isEmpty();
    }
}
