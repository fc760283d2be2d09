package likelion._th.safepath.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
// DataSF(사건 피드), GraphHopper(경로/지오코딩) api 호출
public class WebClientConfig {

    // 311 응답이 기본 버퍼(256KB)를 넘음
    private static final int MAX_IN_MEMORY_SIZE = 4 * 1024 * 1024;

    @Value("${external-api.datasf.base-url}")
    private String datasfBaseUrl;

    @Value("${external-api.graphhopper.base-url}")
    private String graphhopperBaseUrl;

    @Bean(name = "datasfClient")
    public WebClient datasfClient(@Value("${external-api.datasf.app-token:}") String appToken) {
        WebClient.Builder builder = WebClient.builder()
                .baseUrl(datasfBaseUrl)
                .codecs(c -> c.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_SIZE));
        if (!appToken.isBlank()) {
            builder.defaultHeader("X-App-Token", appToken);
        }
        return builder.build();
    }

    @Bean(name = "graphhopperClient")
    public WebClient graphhopperClient() {
        return WebClient.builder()
                .baseUrl(graphhopperBaseUrl)
                .codecs(c -> c.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_SIZE))
                .build();
    }

}
