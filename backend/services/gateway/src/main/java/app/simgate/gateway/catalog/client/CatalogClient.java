package app.simgate.gateway.catalog.client;

import app.simgate.gateway.catalog.domain.Instance;
import app.simgate.gateway.catalog.domain.InstanceBatch;
import app.simgate.gateway.catalog.domain.InstanceQuery;
import app.simgate.gateway.catalog.domain.Platform;
import app.simgate.gateway.security.CallerCredential;
import app.simgate.gateway.upstream.Upstream;
import app.simgate.gateway.upstream.UpstreamCallExecutor;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Platform and instance lookups, served by the job service alongside jobs.
 */
@Component
public class CatalogClient {
    private static final Logger log = LoggerFactory.getLogger(CatalogClient.class);

    private final RestClient restClient;
    private final UpstreamCallExecutor executor;

    public CatalogClient(RestClient jobServiceRestClient, UpstreamCallExecutor executor) {
        this.restClient = jobServiceRestClient;
        this.executor = executor;
    }

    /**
     * @param filters upstream filter names to values, forwarded unchanged
     */
    public List<Platform> listPlatforms(Map<String, String> filters, CallerCredential credential) {
        log.debug("Listing platforms filters={}", filters.keySet());
        CatalogPlatformList list = executor.execute(Upstream.JOB_SERVICE, "platform listing", Map.of(), () ->
                restClient.get()
                        .uri(uriBuilder -> {
                            uriBuilder.path("/platforms");
                            filters.forEach((name, value) -> uriBuilder.queryParam(name, "{" + name + "}"));
                            return uriBuilder.build(filters);
                        })
                        .header(HttpHeaders.AUTHORIZATION, credential.bearerHeader())
                        .accept(MediaType.APPLICATION_JSON)
                        .retrieve()
                        .body(CatalogPlatformList.class));
        if (list == null || list.platforms() == null) {
            return List.of();
        }
        return list.platforms().stream().map(CatalogClient::toPlatform).toList();
    }

    public Platform getPlatform(String platformId, CallerCredential credential) {
        CatalogPlatformWire wire = executor.execute(Upstream.JOB_SERVICE, "platform lookup",
                Map.of("platform_id", platformId), () ->
                        restClient.get()
                                .uri("/platforms/platform/{platformId}", platformId)
                                .header(HttpHeaders.AUTHORIZATION, credential.bearerHeader())
                                .accept(MediaType.APPLICATION_JSON)
                                .retrieve()
                                .body(CatalogPlatformWire.class));
        return wire == null ? null : toPlatform(wire);
    }

    public InstanceBatch listInstances(InstanceQuery query, CallerCredential credential) {
        log.debug("Listing instances limit={} offset={} platformId={} available={}",
                query.limit(), query.offset(), query.platformId(), query.available());
        CatalogInstanceList list = executor.execute(Upstream.JOB_SERVICE, "instance listing", Map.of(), () ->
                restClient.get()
                        .uri(uriBuilder -> uriBuilder.path("/instances")
                                .queryParam("limit", query.limit())
                                .queryParam("offset", query.offset())
                                .queryParamIfPresent("platform_id", Optional.ofNullable(query.platformId()))
                                .queryParamIfPresent("available", Optional.ofNullable(query.available()))
                                .build())
                        .header(HttpHeaders.AUTHORIZATION, credential.bearerHeader())
                        .accept(MediaType.APPLICATION_JSON)
                        .retrieve()
                        .body(CatalogInstanceList.class));
        if (list == null) {
            return new InstanceBatch(List.of(), null);
        }
        return new InstanceBatch(list.instances(), list.total());
    }

    public Instance getInstance(String instanceId, CallerCredential credential) {
        return executor.execute(Upstream.JOB_SERVICE, "instance lookup", Map.of("instance_id", instanceId), () ->
                restClient.get()
                        .uri("/instances/{instanceId}", instanceId)
                        .header(HttpHeaders.AUTHORIZATION, credential.bearerHeader())
                        .accept(MediaType.APPLICATION_JSON)
                        .retrieve()
                        .body(Instance.class));
    }

    static Platform toPlatform(CatalogPlatformWire wire) {
        String version = wire.simicsPlatformVersion() != null
                ? wire.simicsPlatformVersion() : wire.simicsPlatformRelease();
        Double memory = null;
        JsonNode rawMemory = wire.platformMemorySize();
        if (rawMemory != null && rawMemory.isNumber()) {
            memory = rawMemory.asDouble();
        } else if (rawMemory != null && rawMemory.isTextual()) {
            try {
                memory = Double.valueOf(rawMemory.asText().trim());
            } catch (NumberFormatException ex) {
                log.warn("Unparseable platform memory size platformId={} value={}", wire.platformId(), rawMemory.asText());
            }
        }
        Boolean iwpsEnabled = null;
        JsonNode features = wire.features();
        if (features != null && features.has("iwps_enabled")) {
            JsonNode flag = features.get("iwps_enabled");
            iwpsEnabled = flag.isBoolean() ? flag.asBoolean() : Boolean.valueOf(flag.asText());
        }
        return new Platform(wire.platformId(), wire.platformName(), wire.platformType(), wire.description(),
                version, memory, iwpsEnabled);
    }
}
