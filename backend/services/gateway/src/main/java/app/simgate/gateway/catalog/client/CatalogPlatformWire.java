package app.simgate.gateway.catalog.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CatalogPlatformWire(
        @JsonProperty("PlatformID") String platformId,
        @JsonProperty("PlatformName") String platformName,
        @JsonProperty("PlatformType") String platformType,
        @JsonProperty("Description") String description,
        @JsonProperty("SimicsPlatformVersion") String simicsPlatformVersion,
        @JsonProperty("SimicsPlatformRelease") String simicsPlatformRelease,
        @JsonProperty("PlatformMemorySize") JsonNode platformMemorySize,
        @JsonProperty("Features") JsonNode features
) {
}
