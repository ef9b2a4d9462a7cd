package app.simgate.gateway.shaping;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Page-number listing kept for the platform and instance resources.
 */
public record LegacyPageResponse<T>(
        @JsonIgnore ResourceKind resourceKind,
        List<T> items,
        PageMeta meta,
        @JsonProperty("filters_applied") Map<String, String> filtersApplied,
        @JsonInclude(JsonInclude.Include.NON_NULL) @JsonProperty("sort_by") String sortBy,
        @JsonInclude(JsonInclude.Include.NON_NULL) @JsonProperty("sort_order") String sortOrder
) implements Paginated<T> {

    public LegacyPageResponse {
        items = items == null ? List.of() : List.copyOf(items);
        filtersApplied = filtersApplied == null ? Map.of() : filtersApplied;
    }

    @Override
    public ResourceKind kind() {
        return resourceKind;
    }

    @Override
    public List<T> entries() {
        return items;
    }
}
