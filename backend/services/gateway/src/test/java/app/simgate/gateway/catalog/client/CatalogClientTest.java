package app.simgate.gateway.catalog.client;

import app.simgate.gateway.catalog.domain.InstanceBatch;
import app.simgate.gateway.catalog.domain.InstanceQuery;
import app.simgate.gateway.catalog.domain.Platform;
import app.simgate.gateway.security.CallerCredential;
import app.simgate.gateway.upstream.UpstreamTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.queryParam;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;
import static org.hamcrest.Matchers.startsWith;

class CatalogClientTest {

    private static final String BASE = "http://job-service.test/v1";
    private static final CallerCredential CREDENTIAL = new CallerCredential("tok");

    private MockRestServiceServer server;
    private CatalogClient client;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl(BASE);
        server = MockRestServiceServer.bindTo(builder).build();
        client = new CatalogClient(builder.build(), UpstreamTestSupport.fastExecutor());
    }

    @Test
    void listPlatforms_mapsWireFields() {
        server.expect(requestTo(startsWith(BASE + "/platforms")))
                .andExpect(queryParam("PlatformType", "Simics"))
                .andRespond(withSuccess("""
                        {"Platforms": [
                          {"PlatformID": "P1", "PlatformName": "Alpha", "PlatformType": "Simics",
                           "SimicsPlatformRelease": "6.0.180", "PlatformMemorySize": "32",
                           "Features": {"iwps_enabled": true}},
                          {"PlatformID": "P2", "PlatformName": "Beta", "SimicsPlatformVersion": "7.1",
                           "PlatformMemorySize": 8}
                        ]}
                        """, MediaType.APPLICATION_JSON));

        List<Platform> platforms = client.listPlatforms(Map.of("PlatformType", "Simics"), CREDENTIAL);

        assertThat(platforms).hasSize(2);
        assertThat(platforms.get(0).version()).isEqualTo("6.0.180");
        assertThat(platforms.get(0).memorySize()).isEqualTo(32.0);
        assertThat(platforms.get(0).iwpsEnabled()).isTrue();
        assertThat(platforms.get(1).version()).isEqualTo("7.1");
        assertThat(platforms.get(1).iwpsEnabled()).isNull();
    }

    @Test
    void listInstances_sendsOffsetPaging() {
        server.expect(requestTo(startsWith(BASE + "/instances")))
                .andExpect(queryParam("limit", "10"))
                .andExpect(queryParam("offset", "20"))
                .andExpect(queryParam("available", "false"))
                .andRespond(withSuccess("""
                        {"instances": [{"instance_id": "I1", "name": "one", "platform_id": "P1",
                                        "is_available": false, "cpu": 4}], "total": 21}
                        """, MediaType.APPLICATION_JSON));

        InstanceBatch batch = client.listInstances(new InstanceQuery(10, 20, null, false), CREDENTIAL);

        server.verify();
        assertThat(batch.total()).isEqualTo(21L);
        assertThat(batch.instances()).singleElement().satisfies(instance -> {
            assertThat(instance.instanceId()).isEqualTo("I1");
            assertThat(instance.available()).isFalse();
        });
    }
}
