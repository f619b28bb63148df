package com.paxkun.pulldb.controller;

import com.paxkun.pulldb.model.CollectionRef;
import com.paxkun.pulldb.model.Issue;
import com.paxkun.pulldb.service.catalog.ArcContext;
import com.paxkun.pulldb.service.catalog.CatalogService;
import com.paxkun.pulldb.service.catalog.CatalogStats;
import com.paxkun.pulldb.service.catalog.CollectionIssues;
import com.paxkun.pulldb.service.catalog.VolumeContext;
import com.paxkun.pulldb.service.page.Page;
import com.paxkun.pulldb.service.page.PageRequest;
import com.paxkun.pulldb.util.Identifiers;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Read-only catalog endpoints. No caller identity needed.
 */
@RestController
@RequestMapping("/v1/catalog")
@RequiredArgsConstructor
public class CatalogController {

    private final CatalogService catalogService;

    @GetMapping("/issues/{id}")
    public ResponseEntity<Issue> getIssue(@PathVariable String id) {
        return catalogService.getIssue(parseId(id))
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/volumes/{id}")
    public ResponseEntity<VolumeContext> getVolume(@PathVariable String id,
                                                   @RequestParam(defaultValue = "false") boolean context) {
        return catalogService.getVolume(parseId(id), context)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/volumes/{id}/issues")
    public ResponseEntity<CollectionIssues> getVolumeIssues(@PathVariable String id) {
        return catalogService.collectionIssues(CollectionRef.volume(parseId(id)))
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/volumes/list/{type}")
    public ResponseEntity<Page<VolumeContext>> listVolumes(@PathVariable String type,
                                                           @RequestParam(defaultValue = "false") boolean context,
                                                           @RequestParam(defaultValue = "false") boolean count,
                                                           @RequestParam(required = false) Integer limit,
                                                           @RequestParam(required = false) String position) {
        return ResponseEntity.ok(catalogService.listVolumes(type, new PageRequest(limit, position, context, count)));
    }

    @GetMapping("/volumes/stats")
    public ResponseEntity<Map<String, CatalogStats>> volumeStats(@RequestParam(defaultValue = "false") boolean all) {
        return ResponseEntity.ok(Map.of("counts", catalogService.volumeStats(all)));
    }

    @GetMapping("/arcs/{id}")
    public ResponseEntity<ArcContext> getArc(@PathVariable String id,
                                             @RequestParam(defaultValue = "false") boolean context) {
        return catalogService.getArc(parseId(id), context)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/arcs/{id}/issues")
    public ResponseEntity<CollectionIssues> getArcIssues(@PathVariable String id) {
        return catalogService.collectionIssues(CollectionRef.arc(parseId(id)))
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/arcs/stats")
    public ResponseEntity<Map<String, CatalogStats>> arcStats(@RequestParam(defaultValue = "false") boolean all) {
        return ResponseEntity.ok(Map.of("counts", catalogService.arcStats(all)));
    }

    private static long parseId(String raw) {
        return Identifiers.parseId(raw)
                .orElseThrow(() -> new IllegalArgumentException("Malformed id: " + Identifiers.sanitizeForLog(raw)));
    }
}
