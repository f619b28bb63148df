package com.paxkun.pulldb.controller;

import com.paxkun.pulldb.model.CollectionRef;
import com.paxkun.pulldb.model.UserIdentity;
import com.paxkun.pulldb.service.page.Page;
import com.paxkun.pulldb.service.page.PageRequest;
import com.paxkun.pulldb.service.pull.BatchResult;
import com.paxkun.pulldb.service.pull.PullContext;
import com.paxkun.pulldb.service.pull.PullListOptions;
import com.paxkun.pulldb.service.pull.PullListType;
import com.paxkun.pulldb.service.pull.PullQueryService;
import com.paxkun.pulldb.service.watch.WatchContext;
import com.paxkun.pulldb.service.watch.WatchService;
import com.paxkun.pulldb.util.Identifiers;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * REST endpoints for a user's watches (subscriptions to volumes and story arcs).
 *
 * Author: Pax
 */
@RestController
@RequestMapping("/v1/watches")
@RequiredArgsConstructor
public class WatchController {

    private final WatchService watchService;
    private final PullQueryService pullQueryService;

    /**
     * Body: {@code {"volumes": [...], "arcs": [...], "start": "2020-01-01"}}; {@code start} is optional.
     */
    @PostMapping("/add")
    public ResponseEntity<Map<String, BatchResult>> addWatches(UserIdentity user, @RequestBody WatchRequest request) {
        LocalDate start = null;
        if (request.start() != null && !request.start().isBlank()) {
            start = Identifiers.parseDate(request.start())
                    .orElseThrow(() -> new IllegalArgumentException("Unparseable start date: "
                            + Identifiers.sanitizeForLog(request.start())));
        }
        BatchResult result = watchService.addWatches(user, request.volumes(), request.arcs(), start);
        return ResponseEntity.ok(Map.of("results", result));
    }

    @PostMapping("/remove")
    public ResponseEntity<Map<String, BatchResult>> removeWatches(UserIdentity user, @RequestBody WatchRequest request) {
        BatchResult result = watchService.removeWatches(user, request.volumes(), request.arcs());
        return ResponseEntity.ok(Map.of("results", result));
    }

    /**
     * Body: {@code {"volumes": {"12": "2021-05-01"}, "arcs": {"7": "2020-01-01"}}}.
     */
    @PostMapping("/update")
    public ResponseEntity<Map<String, BatchResult>> updateWatches(UserIdentity user, @RequestBody WatchDatesRequest request) {
        BatchResult result = watchService.updateWatches(user, request.volumes(), request.arcs());
        return ResponseEntity.ok(Map.of("results", result));
    }

    @GetMapping("/list")
    public ResponseEntity<Page<WatchContext>> listWatches(UserIdentity user,
                                                          @RequestParam(defaultValue = "false") boolean context,
                                                          @RequestParam(defaultValue = "false") boolean count,
                                                          @RequestParam(required = false) Integer limit,
                                                          @RequestParam(required = false) String position) {
        return ResponseEntity.ok(watchService.listWatches(user, new PageRequest(limit, position, context, count)));
    }

    @GetMapping("/{collection}")
    public ResponseEntity<WatchContext> getWatch(UserIdentity user,
                                                 @PathVariable String collection,
                                                 @RequestParam(defaultValue = "false") boolean context) {
        return watchService.getWatch(user, CollectionRef.parse(collection), context)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/{collection}/pulls/{type}")
    public ResponseEntity<Page<PullContext>> listWatchPulls(UserIdentity user,
                                                            @PathVariable String collection,
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
        return pullQueryService.listWatchPulls(user, CollectionRef.parse(collection), PullListType.fromWireName(type), options, page)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    public record WatchRequest(List<Object> volumes, List<Object> arcs, String start) {
    }

    public record WatchDatesRequest(Map<String, String> volumes, Map<String, String> arcs) {
    }
}
