package app.simgate.gateway.upstream;

import app.simgate.gateway.config.UpstreamProps;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.client.ClientHttpRequest;
import org.springframework.http.client.ClientHttpRequestFactory;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class UpstreamConnectionPoolTest {

    @Test
    void requestFactory_startsPoolOnFirstRequestOnly() throws IOException {
        UpstreamConnectionPool pool = new UpstreamConnectionPool(new UpstreamProps(null, Duration.ofSeconds(2), null));
        ClientHttpRequestFactory jobs = pool.requestFactory(Duration.ofSeconds(30));
        ClientHttpRequestFactory files = pool.requestFactory(Duration.ofSeconds(300));

        assertThat(pool.isStarted()).isFalse();

        ClientHttpRequest request = jobs.createRequest(URI.create("http://localhost:9/jobs"), HttpMethod.GET);
        files.createRequest(URI.create("http://localhost:9/fs"), HttpMethod.GET);

        assertThat(request.getURI().getPath()).isEqualTo("/jobs");
        assertThat(pool.isStarted()).isTrue();
        pool.destroy();
    }

    @Test
    void constructor_readsProxyUrl() {
        UpstreamConnectionPool pool = new UpstreamConnectionPool(
                new UpstreamProps("http://proxy.corp:3128", null, null));

        assertThat(pool.proxy()).hasValueSatisfying(proxy -> {
            assertThat(proxy.host()).isEqualTo("proxy.corp");
            assertThat(proxy.port()).isEqualTo(3128);
        });
        assertThat(pool.isStarted()).isFalse();
    }
}
