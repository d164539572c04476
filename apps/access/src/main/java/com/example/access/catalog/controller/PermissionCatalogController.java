package com.example.access.catalog.controller;

import com.example.access.catalog.PermissionCatalog;
import com.example.access.catalog.model.PermissionDefinition;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/permissions")
@RequiredArgsConstructor
public class PermissionCatalogController {

    private final PermissionCatalog catalog;

    @GetMapping("/catalog")
    public Mono<List<CategoryGroup>> catalog() {
        log.debug("GET /permissions/catalog");
        return Mono.fromCallable(() -> catalog.grouped().entrySet().stream()
                .map(entry -> new CategoryGroup(entry.getKey().getDisplayName(), entry.getValue()))
                .toList());
    }

    public record CategoryGroup(String category, List<PermissionDefinition> permissions) {
    }
}
