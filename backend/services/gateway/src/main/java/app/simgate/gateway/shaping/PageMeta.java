package app.simgate.gateway.shaping;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PageMeta(
        long total,
        int page,
        @JsonProperty("page_size") int pageSize,
        @JsonProperty("total_pages") int totalPages,
        @JsonProperty("has_next") boolean hasNext,
        @JsonProperty("has_previous") boolean hasPrevious
) {
    public static PageMeta of(long total, int page, int pageSize) {
        int totalPages = pageSize <= 0 ? 0 : (int) ((total + pageSize - 1) / pageSize);
        return new PageMeta(total, page, pageSize, totalPages, page < totalPages, page > 1);
    }
}
