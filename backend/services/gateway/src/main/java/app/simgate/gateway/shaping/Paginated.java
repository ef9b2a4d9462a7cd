package app.simgate.gateway.shaping;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Common view over the two listing shapes: the job service's continuation-token pages and the
 * page-number pages used for platforms and instances.
 */
public interface Paginated<T> {

    @JsonIgnore
    ResourceKind kind();

    @JsonIgnore
    List<T> entries();
}
