package com.paxkun.pulldb.controller;

import com.paxkun.pulldb.model.Pull;
import com.paxkun.pulldb.model.UserIdentity;
import com.paxkun.pulldb.service.LoggerService;
import com.paxkun.pulldb.service.page.Page;
import com.paxkun.pulldb.service.page.PageRequest;
import com.paxkun.pulldb.service.pull.BatchResult;
import com.paxkun.pulldb.service.pull.ClassificationBucket;
import com.paxkun.pulldb.service.pull.PullContext;
import com.paxkun.pulldb.service.pull.PullListOptions;
import com.paxkun.pulldb.service.pull.PullListType;
import com.paxkun.pulldb.service.pull.PullMaintenanceService;
import com.paxkun.pulldb.service.pull.PullOperation;
import com.paxkun.pulldb.service.pull.PullQueryService;
import com.paxkun.pulldb.service.pull.PullStats;
import com.paxkun.pulldb.service.pull.PullUpdateService;
import com.paxkun.pulldb.service.watch.NewIssue;
import com.paxkun.pulldb.service.watch.NewIssueResolver;
import com.paxkun.pulldb.util.Identifiers;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST endpoints for a user's pull ledger.
 *
 * Author: Pax
 */
@RestController
@RequestMapping("/v1/pulls")
@RequiredArgsConstructor
public class PullController {

    private static final String TAG = "PULL_CONTROLLER";

    private final PullUpdateService updateService;
    private final PullQueryService queryService;
    private final PullMaintenanceService maintenanceService;
    private final NewIssueResolver newIssueResolver;
    private final LoggerService logger;

    // ─────────────────────────────
    // Batch operations
    // ─────────────────────────────

    @PostMapping("/add")
    public ResponseEntity<Map<String, Object>> addPulls(UserIdentity user, @RequestBody Map<String, List<Object>> request) {
        BatchResult result = updateService.addPulls(user, request.getOrDefault("issues", List.of()));
        return ok("Added " + result.count(ClassificationBucket.ADDED) + " pulls", result);
    }

    @PostMapping("/remove")
    public ResponseEntity<Map<String, Object>> removePulls(UserIdentity user, @RequestBody Map<String, List<Object>> request) {
        BatchResult result = updateService.removePulls(user, request.getOrDefault("issues", List.of()));
        return ok("Removed " + result.count(ClassificationBucket.REMOVED) + " pulls", result);
    }

    /**
     * Applies state operations, e.g. {@code {"pull": [1, 2], "read": ["3"]}}.
     * An unknown operation name rejects the whole request.
     */
    @PostMapping("/update")
    public ResponseEntity<Map<String, Object>> updatePulls(UserIdentity user, @RequestBody Map<String, List<Object>> request) {
        Map<PullOperation, List<Object>> operations = new EnumMap<>(PullOperation.class);
        for (Map.Entry<String, List<Object>> entry : request.entrySet()) {
            PullOperation operation = PullOperation.fromWireName(entry.getKey())
                    .orElseThrow(() -> new IllegalArgumentException(
                            "Unknown operation: " + Identifiers.sanitizeForLog(entry.getKey())));
            operations.put(operation, entry.getValue() != null ? entry.getValue() : List.of());
        }
        logger.debug(TAG, "Update request for " + Identifiers.sanitizeForLog(user.id()) + ": " + operations.keySet());
        BatchResult result = updateService.updatePulls(user, operations);
        return ok("Updated " + result.count(ClassificationBucket.UPDATED) + " pulls", result);
    }

    // ─────────────────────────────
    // Lookups
    // ─────────────────────────────

    @PostMapping("/fetch")
    public ResponseEntity<Map<String, Object>> fetchPulls(UserIdentity user, @RequestBody Map<String, List<Object>> request) {
        List<Pull> pulls = queryService.fetchPulls(user, request.getOrDefault("ids", List.of()));
        HttpStatus status = pulls.isEmpty() ? HttpStatus.NOT_FOUND : HttpStatus.OK;
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", pulls.isEmpty() ? "No pulls found" : "Found " + pulls.size() + " pulls");
        body.put("results", pulls);
        return ResponseEntity.status(status).body(body);
    }

    @GetMapping("/{id}")
    public ResponseEntity<PullContext> getPull(UserIdentity user,
                                               @PathVariable String id,
                                               @RequestParam(defaultValue = "false") boolean context) {
        return queryService.getPull(user, parseId(id), context)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/list/{type}")
    public ResponseEntity<Page<PullContext>> listPulls(UserIdentity user,
                                                       @PathVariable String type,
                                                       @RequestParam(defaultValue = "false") boolean weighted,
                                                       @RequestParam(defaultValue = "false") boolean reverse,
                                                       @RequestParam(defaultValue = "false") boolean all,
                                                       @RequestParam(defaultValue = "false") boolean context,
                                                       @RequestParam(defaultValue = "false") boolean count,
                                                       @RequestParam(required = false) Integer limit,
                                                       @RequestParam(required = false) String position) {
        PullListOptions options = new PullListOptions(weighted, reverse, all);
        PageRequest page = new PageRequest(limit, position, context, count);
        return ResponseEntity.ok(queryService.listPulls(user, PullListType.fromWireName(type), options, page));
    }

    @GetMapping("/stats")
    public ResponseEntity<Map<String, PullStats>> stats(UserIdentity user) {
        return ResponseEntity.ok(Map.of("counts", queryService.stats(user)));
    }

    @GetMapping("/new")
    public ResponseEntity<Map<String, Object>> newIssues(UserIdentity user) {
        List<NewIssue> issues = newIssueResolver.resolve(user);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("count", issues.size());
        body.put("results", issues);
        return ResponseEntity.ok(body);
    }

    // ─────────────────────────────
    // Maintenance
    // ─────────────────────────────

    @PostMapping("/{id}/refresh")
    public ResponseEntity<Map<String, Object>> refreshPull(UserIdentity user, @PathVariable String id) {
        return refreshed(maintenanceService.refreshPull(user, parseId(id)));
    }

    @PostMapping("/refresh")
    public ResponseEntity<Map<String, Object>> refreshAll(UserIdentity user) {
        return refreshed(maintenanceService.refreshAll(user));
    }

    private static ResponseEntity<Map<String, Object>> refreshed(List<Pull> changed) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("count", changed.size());
        body.put("results", changed);
        return ResponseEntity.ok(body);
    }

    private static ResponseEntity<Map<String, Object>> ok(String message, BatchResult result) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", message);
        body.put("results", result);
        return ResponseEntity.ok(body);
    }

    static long parseId(String raw) {
        return Identifiers.parseId(raw)
                .orElseThrow(() -> new IllegalArgumentException("Malformed issue id: " + Identifiers.sanitizeForLog(raw)));
    }
}
