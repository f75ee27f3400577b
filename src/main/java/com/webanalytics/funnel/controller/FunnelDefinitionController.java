package com.webanalytics.funnel.controller;

import com.webanalytics.funnel.model.ApiResponse;
import com.webanalytics.funnel.model.ErrorKind;
import com.webanalytics.funnel.model.FunnelAnalyticsException;
import com.webanalytics.funnel.model.FunnelDefinition;
import com.webanalytics.funnel.model.Website;
import com.webanalytics.funnel.referrer.Hosts;
import com.webanalytics.funnel.store.FunnelDefinitionStore;
import com.webanalytics.funnel.store.WebsiteStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Funnel definition and website management endpoints.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class FunnelDefinitionController {

    private final FunnelDefinitionStore definitionStore;
    private final WebsiteStore websiteStore;

    @GetMapping("/funnels")
    public ApiResponse<List<FunnelDefinition>> list(@RequestParam("website_id") String websiteId) {
        return ApiResponse.ok(definitionStore.listActive(websiteId));
    }

    @GetMapping("/funnels/{funnelId}")
    public ApiResponse<FunnelDefinition> get(
            @PathVariable String funnelId,
            @RequestParam("website_id") String websiteId
    ) {
        return ApiResponse.ok(definitionStore.findActive(websiteId, funnelId)
                .orElseThrow(() -> new FunnelAnalyticsException(ErrorKind.FUNNEL_NOT_FOUND, "Funnel not found")));
    }

    @PostMapping("/funnels")
    @ResponseStatus(HttpStatus.CREATED)
    public ApiResponse<FunnelDefinition> create(
            @RequestParam("website_id") String websiteId,
            @RequestBody FunnelDefinition request
    ) {
        String name = request.getName();
        if (name == null || name.isBlank() || name.length() > FunnelDefinition.MAX_NAME_LENGTH) {
            throw new FunnelAnalyticsException(
                    ErrorKind.INVALID_DEFINITION,
                    "Funnel name must be 1 to " + FunnelDefinition.MAX_NAME_LENGTH + " characters");
        }
        FunnelDefinition.checkSteps(request.getSteps());

        request.setWebsiteId(websiteId);
        FunnelDefinition created = definitionStore.create(request);
        log.info("Created funnel {} '{}' with {} steps for website {}",
                created.getId(), created.getName(), created.getSteps().size(), websiteId);
        return ApiResponse.ok(created);
    }

    @DeleteMapping("/funnels/{funnelId}")
    public ApiResponse<String> delete(
            @PathVariable String funnelId,
            @RequestParam("website_id") String websiteId
    ) {
        if (!definitionStore.softDelete(websiteId, funnelId)) {
            throw new FunnelAnalyticsException(ErrorKind.FUNNEL_NOT_FOUND, "Funnel not found");
        }
        log.info("Deleted funnel {} of website {}", funnelId, websiteId);
        return ApiResponse.ok(funnelId);
    }

    @PutMapping("/websites/{websiteId}")
    public ApiResponse<Website> saveWebsite(
            @PathVariable String websiteId,
            @RequestBody Website request
    ) {
        if (request.domain() == null || request.domain().isBlank()) {
            throw new FunnelAnalyticsException(ErrorKind.INVALID_DEFINITION, "Website domain is required");
        }
        String host = Hosts.hostOf(request.domain());
        if (host == null) {
            throw new FunnelAnalyticsException(
                    ErrorKind.INVALID_DEFINITION, "Website domain must be a host name or URL: " + request.domain());
        }
        return ApiResponse.ok(websiteStore.save(new Website(websiteId, host)));
    }
}
