package app.simgate.gateway.client.jobservice;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record JobServiceMetadata(
        @JsonProperty("RequestedOn") String requestedOn,
        @JsonProperty("RequestedBy") String requestedBy,
        @JsonProperty("LastUpdatedOn") String lastUpdatedOn,
        @JsonProperty("LastUpdatedBy") String lastUpdatedBy
) {
}
