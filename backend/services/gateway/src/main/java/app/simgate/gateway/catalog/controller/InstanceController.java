package app.simgate.gateway.catalog.controller;

import app.simgate.gateway.catalog.domain.Instance;
import app.simgate.gateway.catalog.service.CatalogService;
import app.simgate.gateway.security.CurrentCallerProvider;
import app.simgate.gateway.shaping.LegacyPageResponse;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/instances")
public class InstanceController {

    private final CatalogService catalogService;
    private final CurrentCallerProvider currentCallerProvider;

    public InstanceController(CatalogService catalogService, CurrentCallerProvider currentCallerProvider) {
        this.catalogService = catalogService;
        this.currentCallerProvider = currentCallerProvider;
    }

    @GetMapping
    public LegacyPageResponse<Instance> listInstances(Authentication authentication,
                                                      @RequestParam(required = false) String limit,
                                                      @RequestParam(required = false) String offset,
                                                      @RequestParam(name = "platform_id", required = false) String platformId,
                                                      @RequestParam(required = false) String available) {
        return catalogService.listInstances(limit, offset, platformId, available,
                currentCallerProvider.requireCredential(authentication));
    }

    @GetMapping("/{instanceId}")
    public Instance getInstance(Authentication authentication, @PathVariable String instanceId) {
        return catalogService.getInstance(instanceId, currentCallerProvider.requireCredential(authentication));
    }
}
