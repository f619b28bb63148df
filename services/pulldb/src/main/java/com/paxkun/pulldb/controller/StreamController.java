package com.paxkun.pulldb.controller;

import com.paxkun.pulldb.model.Stream;
import com.paxkun.pulldb.model.UserIdentity;
import com.paxkun.pulldb.service.page.Page;
import com.paxkun.pulldb.service.page.PageRequest;
import com.paxkun.pulldb.service.pull.BatchResult;
import com.paxkun.pulldb.service.pull.ClassificationBucket;
import com.paxkun.pulldb.service.stream.StreamContext;
import com.paxkun.pulldb.service.stream.StreamService;
import com.paxkun.pulldb.service.stream.StreamUpdate;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST endpoints for a user's reading streams.
 *
 * Author: Pax
 */
@RestController
@RequestMapping("/v1/streams")
@RequiredArgsConstructor
public class StreamController {

    private final StreamService streamService;

    /**
     * Body: {@code {"streams": ["weekly", "backlog"]}}.
     */
    @PostMapping("/add")
    public ResponseEntity<Map<String, Object>> addStreams(UserIdentity user, @RequestBody Map<String, List<Object>> request) {
        BatchResult result = streamService.addStreams(user, request.getOrDefault("streams", List.of()));
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Added " + result.count(ClassificationBucket.ADDED) + " streams");
        body.put("results", result);
        return ResponseEntity.ok(body);
    }

    /**
     * Body: {@code [{"name": "weekly", "volumes": {"add": [12], "delete": [7]}, "issues": {"add": [99]}}]}.
     */
    @PostMapping("/update")
    public ResponseEntity<Map<String, Object>> updateStreams(UserIdentity user, @RequestBody List<StreamUpdate> request) {
        BatchResult result = streamService.updateStreams(user, request);
        int changes = result.count(ClassificationBucket.UPDATED);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", changes > 0 ? changes + " stream changes" : "no changes");
        body.put("results", result);
        return ResponseEntity.ok(body);
    }

    @GetMapping("/list")
    public ResponseEntity<Page<StreamContext>> listStreams(UserIdentity user,
                                                           @RequestParam(defaultValue = "false") boolean context,
                                                           @RequestParam(defaultValue = "false") boolean count,
                                                           @RequestParam(required = false) Integer limit,
                                                           @RequestParam(required = false) String position) {
        return ResponseEntity.ok(streamService.listStreams(user, new PageRequest(limit, position, context, count)));
    }

    @GetMapping("/{name}")
    public ResponseEntity<StreamContext> getStream(UserIdentity user,
                                                   @PathVariable String name,
                                                   @RequestParam(defaultValue = "false") boolean context) {
        return streamService.getStream(user, name, context)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PostMapping("/{name}/refresh")
    public ResponseEntity<Stream> refreshStream(UserIdentity user, @PathVariable String name) {
        return streamService.refreshStream(user, name)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
