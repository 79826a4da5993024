package com.example.toolstore.adapter.tools;

import com.example.toolstore.adapter.web.Headers;
import com.example.toolstore.core.lifecycle.ToolLifecycleService;
import com.example.toolstore.core.paging.PagePolicy;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Map;

/** Record writes and paginated reads against registered tools. */
@RestController
@RequestMapping(path = "/tools", produces = MediaType.APPLICATION_JSON_VALUE)
public class ToolDataController {
    private final ToolLifecycleService lifecycle;
    private final PagePolicy pagePolicy;

    public ToolDataController(ToolLifecycleService lifecycle, PagePolicy pagePolicy) {
        this.lifecycle = lifecycle;
        this.pagePolicy = pagePolicy;
    }

    @PostMapping("/{name}")
    public Mono<Map<String, Object>> store(@PathVariable("name") String name,
                                           @RequestHeader(name = Headers.TOOL_TOKEN, required = false) String token,
                                           @RequestBody JsonNode payload) {
        return Mono.fromCallable(() -> {
            lifecycle.store(name, token, payload);
            return Map.<String, Object>of("ok", true, "status", "stored", "tool_name", name);
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/{name}")
    public Mono<List<ObjectNode>> read(@PathVariable("name") String name,
                                       @RequestParam(name = "limit", required = false) Integer limit,
                                       @RequestParam(name = "offset", required = false) Integer offset) {
        return Mono.fromCallable(() -> lifecycle.read(name, pagePolicy.resolve(limit, offset)))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
