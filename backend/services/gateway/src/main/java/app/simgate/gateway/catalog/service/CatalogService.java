package app.simgate.gateway.catalog.service;

import app.simgate.gateway.catalog.client.CatalogClient;
import app.simgate.gateway.catalog.domain.Instance;
import app.simgate.gateway.catalog.domain.InstanceBatch;
import app.simgate.gateway.catalog.domain.InstanceQuery;
import app.simgate.gateway.catalog.domain.Platform;
import app.simgate.gateway.error.GatewayErrorKind;
import app.simgate.gateway.error.GatewayException;
import app.simgate.gateway.security.CallerCredential;
import app.simgate.gateway.shaping.LegacyPageResponse;
import app.simgate.gateway.shaping.ResourceKind;
import app.simgate.gateway.shaping.ResponseShaper;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * Platform and instance listings in the page-number shape.
 * <p>
 * The job service returns every matching platform at once, so platform paging and sorting
 * happen here. Instances are paged upstream by offset.
 */
@Service
public class CatalogService {

    public static final List<String> PLATFORM_FILTERS = List.of(
            "PlatformType", "PlatformName", "IWPS", "ISIM", "NovaIWPS", "Traces", "Instance", "IWPSEnabled", "NovaCoho");
    static final List<String> PLATFORM_SORT_FIELDS = List.of("name", "platform_id");
    static final List<String> SORT_ORDERS = List.of("asc", "desc");

    static final int DEFAULT_PAGE_SIZE = 50;
    static final int MAX_PAGE_SIZE = 1000;
    static final int DEFAULT_INSTANCE_LIMIT = 100;
    static final int MAX_INSTANCE_LIMIT = 1000;

    private final CatalogClient catalogClient;
    private final ResponseShaper responseShaper;

    public CatalogService(CatalogClient catalogClient, ResponseShaper responseShaper) {
        this.catalogClient = catalogClient;
        this.responseShaper = responseShaper;
    }

    public LegacyPageResponse<Platform> listPlatforms(Map<String, String> params, CallerCredential credential) {
        int page = parseInt(params.get("page"), "page", 1, 1, Integer.MAX_VALUE);
        int pageSize = parseInt(params.get("page_size"), "page_size", DEFAULT_PAGE_SIZE, 1, MAX_PAGE_SIZE);
        String sortBy = oneOf(params.get("sort_by"), "sort_by", PLATFORM_SORT_FIELDS);
        String sortOrder = oneOf(params.get("sort_order"), "sort_order", SORT_ORDERS);
        if (sortBy != null && sortOrder == null) {
            sortOrder = "asc";
        }

        Map<String, String> filters = new LinkedHashMap<>();
        for (String name : PLATFORM_FILTERS) {
            String value = params.get(name);
            if (StringUtils.hasText(value)) {
                filters.put(name, value.trim());
            }
        }

        List<Platform> platforms = catalogClient.listPlatforms(filters, credential);
        if (sortBy != null) {
            Function<Platform, String> key = sortBy.equals("name") ? Platform::name : Platform::platformId;
            Comparator<Platform> comparator = Comparator.comparing(key,
                    Comparator.nullsLast(String.CASE_INSENSITIVE_ORDER));
            platforms = platforms.stream()
                    .sorted(sortOrder.equals("desc") ? comparator.reversed() : comparator)
                    .toList();
        }

        long from = (long) (page - 1) * pageSize;
        List<Platform> slice = from >= platforms.size()
                ? List.of()
                : platforms.subList((int) from, (int) Math.min(from + pageSize, platforms.size()));
        return responseShaper.legacyPage(ResourceKind.PLATFORMS, slice, platforms.size(), page, pageSize,
                filters, sortBy, sortOrder);
    }

    public Platform getPlatform(String platformId, CallerCredential credential) {
        Platform platform = catalogClient.getPlatform(platformId, credential);
        if (platform == null) {
            throw GatewayException.of(GatewayErrorKind.NOT_FOUND, "Platform " + platformId + " not found")
                    .withDetail("platform_id", platformId);
        }
        return platform;
    }

    public LegacyPageResponse<Instance> listInstances(String limit,
                                                      String offset,
                                                      String platformId,
                                                      String available,
                                                      CallerCredential credential) {
        InstanceQuery query = new InstanceQuery(
                parseInt(limit, "limit", DEFAULT_INSTANCE_LIMIT, 1, MAX_INSTANCE_LIMIT),
                parseInt(offset, "offset", 0, 0, Integer.MAX_VALUE),
                StringUtils.hasText(platformId) ? platformId.trim() : null,
                parseBoolean(available, "available")
        );
        InstanceBatch batch = catalogClient.listInstances(query, credential);

        long total = batch.total() != null ? batch.total() : (long) query.offset() + batch.instances().size();
        int page = query.offset() / query.limit() + 1;

        Map<String, String> filters = new LinkedHashMap<>();
        filters.put("platform_id", query.platformId());
        filters.put("available", query.available() == null ? null : query.available().toString());
        return responseShaper.legacyPage(ResourceKind.INSTANCES, batch.instances(), total, page, query.limit(),
                filters, null, null);
    }

    public Instance getInstance(String instanceId, CallerCredential credential) {
        Instance instance = catalogClient.getInstance(instanceId, credential);
        if (instance == null) {
            throw GatewayException.of(GatewayErrorKind.NOT_FOUND, "Instance " + instanceId + " not found")
                    .withDetail("instance_id", instanceId);
        }
        return instance;
    }

    private static int parseInt(String raw, String name, int defaultValue, int min, int max) {
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            int value = Integer.parseInt(raw.trim());
            if (value >= min && value <= max) {
                return value;
            }
        } catch (NumberFormatException ignored) {
            // reported below
        }
        String range = max == Integer.MAX_VALUE ? "an integer >= " + min : "an integer between " + min + " and " + max;
        throw GatewayException.invalidFilter(name, "Invalid " + name + " '" + raw + "'. Expected " + range);
    }

    private static String oneOf(String raw, String name, List<String> accepted) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        if (!accepted.contains(value)) {
            throw GatewayException.invalidFilter(name, raw, accepted);
        }
        return value;
    }

    private static Boolean parseBoolean(String raw, String name) {
        String value = oneOf(raw, name, List.of("true", "false"));
        return value == null ? null : Boolean.valueOf(value);
    }
}
