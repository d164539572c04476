package com.example.access.analytics.controller;

import com.example.access.analytics.PermissionAnalyticsService;
import com.example.access.analytics.model.OptimizationSuggestion;
import com.example.access.analytics.model.PermissionAnalyticsReport;
import com.example.access.analytics.model.PermissionUsage;
import com.example.access.analytics.model.RiskAssessment;
import com.example.access.authz.annotation.RequiresPermission;
import com.example.access.catalog.HospitalPermissions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/permission-analytics")
@RequiredArgsConstructor
public class PermissionAnalyticsController {

    private final PermissionAnalyticsService analyticsService;

    @GetMapping
    @RequiresPermission(HospitalPermissions.VIEW_PERMISSION_ANALYTICS)
    public Mono<PermissionAnalyticsReport> report() {
        log.debug("GET /permission-analytics");
        return Mono.fromCallable(analyticsService::report);
    }

    @GetMapping("/usage")
    @RequiresPermission(HospitalPermissions.VIEW_PERMISSION_ANALYTICS)
    public Mono<List<PermissionUsage>> usage() {
        return Mono.fromCallable(() -> analyticsService.usageByPermission());
    }

    @GetMapping("/risk")
    @RequiresPermission(HospitalPermissions.VIEW_PERMISSION_ANALYTICS)
    public Mono<List<RiskAssessment>> risk() {
        return Mono.fromCallable(() -> analyticsService.riskAssessment());
    }

    @GetMapping("/suggestions")
    @RequiresPermission(HospitalPermissions.VIEW_PERMISSION_ANALYTICS)
    public Mono<List<OptimizationSuggestion>> suggestions() {
        return Mono.fromCallable(() -> analyticsService.optimizationSuggestions());
    }
}
