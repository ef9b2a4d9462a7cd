package app.simgate.gateway.catalog.controller;

import app.simgate.gateway.catalog.domain.Platform;
import app.simgate.gateway.catalog.service.CatalogService;
import app.simgate.gateway.security.CurrentCallerProvider;
import app.simgate.gateway.shaping.LegacyPageResponse;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/platforms")
public class PlatformController {

    private final CatalogService catalogService;
    private final CurrentCallerProvider currentCallerProvider;

    public PlatformController(CatalogService catalogService, CurrentCallerProvider currentCallerProvider) {
        this.catalogService = catalogService;
        this.currentCallerProvider = currentCallerProvider;
    }

    // GET /platforms?page=&page_size=&sort_by=&sort_order=&PlatformType=...
    @GetMapping
    public LegacyPageResponse<Platform> listPlatforms(Authentication authentication,
                                                      @RequestParam Map<String, String> params) {
        return catalogService.listPlatforms(params, currentCallerProvider.requireCredential(authentication));
    }

    @GetMapping("/{platformId}")
    public Platform getPlatform(Authentication authentication, @PathVariable String platformId) {
        return catalogService.getPlatform(platformId, currentCallerProvider.requireCredential(authentication));
    }
}
