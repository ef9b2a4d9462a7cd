package app.simgate.gateway.config;

import app.simgate.gateway.upstream.UpstreamCallExecutor;
import app.simgate.gateway.upstream.UpstreamConnectionPool;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

import java.time.Duration;

@Configuration
@EnableConfigurationProperties({JobServiceProps.class, FileServiceProps.class, UpstreamProps.class})
public class UpstreamHttpConfig {

    private static final Duration DEFAULT_JOB_TIMEOUT = Duration.ofSeconds(30);
    private static final Duration DEFAULT_FILE_TIMEOUT = Duration.ofSeconds(300);

    @Bean
    public RestClient jobServiceRestClient(JobServiceProps props, UpstreamConnectionPool pool) {
        RestClient.Builder builder = RestClient.builder()
                .requestFactory(pool.requestFactory(orDefault(props.timeout(), DEFAULT_JOB_TIMEOUT)))
                .baseUrl(props.baseUrl());
        if (StringUtils.hasText(props.userAgent())) {
            builder.defaultHeader(HttpHeaders.USER_AGENT, props.userAgent());
        }
        return builder.build();
    }

    // No base URL: every file call targets the host resolved for the job's tenant.
    @Bean
    public RestClient fileServiceRestClient(FileServiceProps props,
                                            JobServiceProps jobProps,
                                            UpstreamConnectionPool pool) {
        RestClient.Builder builder = RestClient.builder()
                .requestFactory(pool.requestFactory(orDefault(props.timeout(), DEFAULT_FILE_TIMEOUT)));
        if (StringUtils.hasText(jobProps.userAgent())) {
            builder.defaultHeader(HttpHeaders.USER_AGENT, jobProps.userAgent());
        }
        return builder.build();
    }

    @Bean
    public UpstreamCallExecutor upstreamCallExecutor(UpstreamProps props) {
        UpstreamProps.Retry retry = props.retry() == null
                ? new UpstreamProps.Retry(3, Duration.ofMillis(200), 2.0, Duration.ofSeconds(2))
                : props.retry();
        return new UpstreamCallExecutor(retry);
    }

    private static Duration orDefault(Duration value, Duration fallback) {
        return value == null ? fallback : value;
    }
}
