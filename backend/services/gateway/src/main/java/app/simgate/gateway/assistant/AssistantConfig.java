package app.simgate.gateway.assistant;

import app.simgate.gateway.upstream.UpstreamConnectionPool;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

import java.time.Duration;

@Configuration
@EnableConfigurationProperties(AssistantProps.class)
public class AssistantConfig {

    private static final String DEFAULT_BASE_URL = "https://api.anthropic.com";

    @Bean
    public RestClient assistantRestClient(RestClient.Builder restClientBuilder,
                                          UpstreamConnectionPool connectionPool,
                                          AssistantProps props) {
        Duration timeout = props.timeout() == null ? Duration.ofSeconds(60) : props.timeout();
        return restClientBuilder
                .baseUrl(StringUtils.hasText(props.baseUrl()) ? props.baseUrl() : DEFAULT_BASE_URL)
                .requestFactory(connectionPool.requestFactory(timeout))
                .build();
    }
}
