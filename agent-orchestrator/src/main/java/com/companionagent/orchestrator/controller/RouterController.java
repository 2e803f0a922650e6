package com.companionagent.orchestrator.controller;

import com.companionagent.common.model.Route;
import com.companionagent.common.model.RouterDecision;
import com.companionagent.orchestrator.api.RouteRequest;
import com.companionagent.orchestrator.router.ClassifierCache;
import com.companionagent.orchestrator.router.RouterService;
import com.companionagent.orchestrator.router.RouterService.RouterContext;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/router")
public class RouterController {

    private final RouterService routerService;
    private final ClassifierCache classifierCache;

    public RouterController(RouterService routerService, ClassifierCache classifierCache) {
        this.routerService   = routerService;
        this.classifierCache = classifierCache;
    }

    @PostMapping("/route")
    public Mono<ResponseEntity<RouterDecision>> route(@RequestBody RouteRequest request) {
        if (request == null || request.message() == null) {
            return Mono.just(ResponseEntity.badRequest().build());
        }
        return routerService.route(request.message(), new RouterContext(request.userId(), request.sessionId()))
            .map(ResponseEntity::ok);
    }

    /** Rule-only check; {@code route} is null when the full analysis is required. */
    @GetMapping("/quick")
    public ResponseEntity<Map<String, Object>> quick(@RequestParam String message) {
        Route route = routerService.quickRouteCheck(message);
        Map<String, Object> body = new HashMap<>();
        body.put("route", route == null ? null : route.wire());
        body.put("needsFullAnalysis", route == null);
        return ResponseEntity.ok(body);
    }

    /** Live classifier cache entries, expired ones included until the next sweep. */
    @GetMapping("/cache")
    public ResponseEntity<Map<String, Integer>> cache() {
        return ResponseEntity.ok(Map.of("entries", classifierCache.size()));
    }
}
