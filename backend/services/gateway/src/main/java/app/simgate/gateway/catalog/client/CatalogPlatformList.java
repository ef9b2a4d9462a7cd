package app.simgate.gateway.catalog.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CatalogPlatformList(@JsonProperty("Platforms") List<CatalogPlatformWire> platforms) {
}
