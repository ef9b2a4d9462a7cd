package app.simgate.gateway.upstream;

import app.simgate.gateway.config.UpstreamProps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.http.client.ClientHttpRequestFactory;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.stereotype.Component;

import java.net.Authenticator;
import java.net.PasswordAuthentication;
import java.net.ProxySelector;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Process-wide HTTP connection pool shared by every upstream client.
 * <p>
 * The underlying {@link HttpClient} is built on first use and carries the proxy and the
 * connect timeout. Read timeouts differ per upstream, so each gets its own request factory
 * over the same client.
 */
@Component
public class UpstreamConnectionPool implements DisposableBean {
    private static final Logger log = LoggerFactory.getLogger(UpstreamConnectionPool.class);
    private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);

    private final Duration connectTimeout;
    private final Optional<ProxySettings> proxy;
    private final Map<Duration, JdkClientHttpRequestFactory> factories = new ConcurrentHashMap<>();

    private volatile HttpClient httpClient;
    private volatile ExecutorService executor;

    public UpstreamConnectionPool(UpstreamProps props) {
        this.connectTimeout = props.connectTimeout() == null ? DEFAULT_CONNECT_TIMEOUT : props.connectTimeout();
        this.proxy = ProxySettings.parse(props.proxyUrl());
    }

    /**
     * Request factory with the given read timeout. The pool itself is not touched until the
     * first request is created.
     */
    public ClientHttpRequestFactory requestFactory(Duration readTimeout) {
        return (uri, method) -> factories
                .computeIfAbsent(readTimeout, this::newFactory)
                .createRequest(uri, method);
    }

    public Optional<ProxySettings> proxy() {
        return proxy;
    }

    boolean isStarted() {
        return httpClient != null;
    }

    private JdkClientHttpRequestFactory newFactory(Duration readTimeout) {
        JdkClientHttpRequestFactory factory = new JdkClientHttpRequestFactory(client());
        factory.setReadTimeout(readTimeout);
        return factory;
    }

    private HttpClient client() {
        HttpClient current = httpClient;
        if (current != null) {
            return current;
        }
        synchronized (this) {
            if (httpClient == null) {
                executor = Executors.newCachedThreadPool(daemonThreads());
                HttpClient.Builder builder = HttpClient.newBuilder()
                        .connectTimeout(connectTimeout)
                        .followRedirects(HttpClient.Redirect.NORMAL)
                        .executor(executor);
                proxy.ifPresent(p -> {
                    builder.proxy(ProxySelector.of(p.address()));
                    if (p.hasCredentials()) {
                        builder.authenticator(new ProxyAuthenticator(p));
                    }
                });
                httpClient = builder.build();
                log.info("Upstream connection pool started connectTimeout={} proxy={}",
                        connectTimeout, proxy.map(ProxySettings::toString).orElse("none"));
            }
            return httpClient;
        }
    }

    @Override
    public void destroy() {
        ExecutorService running = executor;
        if (running != null) {
            running.shutdownNow();
            log.info("Upstream connection pool stopped");
        }
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "upstream-http-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static final class ProxyAuthenticator extends Authenticator {
        private final ProxySettings proxy;

        private ProxyAuthenticator(ProxySettings proxy) {
            this.proxy = proxy;
        }

        @Override
        protected PasswordAuthentication getPasswordAuthentication() {
            if (getRequestorType() == RequestorType.PROXY) {
                return proxy.credentials();
            }
            return null;
        }
    }
}
