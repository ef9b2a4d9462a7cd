package app.simgate.gateway.catalog.client;

import app.simgate.gateway.catalog.domain.Instance;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CatalogInstanceList(List<Instance> instances, Long total) {
}
