package com.example.toolstore.adapter.common;

import com.example.toolstore.adapter.web.Headers;
import com.example.toolstore.core.common.CommonRecord;
import com.example.toolstore.core.common.CommonRecordService;
import com.example.toolstore.core.paging.PagePolicy;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Map;

/** Legacy shared-table ingestion for tools that never registered a schema. */
@RestController
@RequestMapping(path = "/common", produces = MediaType.APPLICATION_JSON_VALUE)
public class CommonRecordController {
    private final CommonRecordService service;
    private final PagePolicy pagePolicy;

    public CommonRecordController(CommonRecordService service, PagePolicy pagePolicy) {
        this.service = service;
        this.pagePolicy = pagePolicy;
    }

    public record CommonReq(@JsonProperty("tool_name") String toolName, Integer sensitive, JsonNode data) {}

    @PostMapping
    public Mono<Map<String, Object>> store(@RequestHeader(name = Headers.TOOL_TOKEN, required = false) String token,
                                           @RequestBody CommonReq req) {
        int sensitive = req.sensitive() == null ? 0 : req.sensitive();
        return Mono.fromCallable(() -> {
            service.store(req.toolName(), sensitive, token, req.data());
            return Map.<String, Object>of("ok", true, "status", "stored", "tool_name", req.toolName());
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/{toolName}")
    public Mono<List<CommonRecord>> list(@PathVariable("toolName") String toolName,
                                         @RequestHeader(name = Headers.TOOL_TOKEN, required = false) String token,
                                         @RequestParam(name = "limit", required = false) Integer limit,
                                         @RequestParam(name = "offset", required = false) Integer offset) {
        return Mono.fromCallable(() -> service.list(toolName, token, pagePolicy.resolve(limit, offset)))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
