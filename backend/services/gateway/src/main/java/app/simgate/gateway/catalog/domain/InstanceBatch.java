package app.simgate.gateway.catalog.domain;

import java.util.List;

/**
 * @param total upstream total when reported, otherwise {@code null}
 */
public record InstanceBatch(List<Instance> instances, Long total) {

    public InstanceBatch {
        instances = instances == null ? List.of() : List.copyOf(instances);
    }
}
