package com.paxkun.tracker.controller;

import com.paxkun.tracker.service.LoggerService;
import com.paxkun.tracker.service.ScanlatorService;
import com.paxkun.tracker.service.scanlator.SearchResult;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/v1/scanlators")
@RequiredArgsConstructor
public class ScanlatorController {

    private final ScanlatorService scanlatorService;
    private final LoggerService logger;

    @GetMapping("/plugins")
    public ResponseEntity<List<PluginView>> listPlugins() {
        List<PluginView> plugins = scanlatorService.listPlugins().stream()
                .map(r -> new PluginView(r.identifier(), r.displayName(), r.baseUrl()))
                .toList();
        return ResponseEntity.ok(plugins);
    }

    @GetMapping("/{identifier}/search")
    public ResponseEntity<List<SearchResult>> search(@PathVariable String identifier, @RequestParam(required = false) String title) {
        logger.debug("SCANLATOR_CONTROLLER", "Search request | plugin=" + LoggerService.sanitizeForLog(identifier)
                + " | title=" + LoggerService.sanitizeForLog(title));
        return ResponseEntity.ok(scanlatorService.search(identifier, title));
    }

    public record PluginView(String identifier, String displayName, String baseUrl) {
    }
}
