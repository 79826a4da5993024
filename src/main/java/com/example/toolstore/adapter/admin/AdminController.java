package com.example.toolstore.adapter.admin;

import com.example.toolstore.adapter.web.Headers;
import com.example.toolstore.core.lifecycle.ToolLifecycleService;
import com.example.toolstore.core.registry.ToolRegistry;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Map;

@RestController
@RequestMapping(produces = MediaType.APPLICATION_JSON_VALUE)
public class AdminController {
    private final ToolLifecycleService lifecycle;
    private final ToolRegistry registry;

    public AdminController(ToolLifecycleService lifecycle, ToolRegistry registry) {
        this.lifecycle = lifecycle;
        this.registry = registry;
    }

    public record RegisterReq(@JsonProperty("tool_name") String toolName, String token, JsonNode schema) {}

    @PostMapping("/register-tool")
    public Mono<Map<String, Object>> register(@RequestHeader(name = Headers.ADMIN_TOKEN, required = false) String adminToken,
                                              @RequestBody RegisterReq req) {
        return Mono.fromCallable(() -> {
            lifecycle.register(req.toolName(), req.token(), req.schema(), adminToken);
            return Map.<String, Object>of("ok", true, "status", "created", "tool_name", req.toolName());
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @DeleteMapping("/tools/{name}")
    public Mono<Map<String, Object>> delete(@RequestHeader(name = Headers.ADMIN_TOKEN, required = false) String adminToken,
                                            @PathVariable("name") String name) {
        return Mono.fromCallable(() -> {
            lifecycle.deregister(name, adminToken);
            return Map.<String, Object>of("ok", true, "status", "deleted", "tool_name", name);
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/tools")
    public Mono<Map<String, Object>> listTools() {
        return Mono.fromCallable(() -> Map.<String, Object>of("tools", registry.list()))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/tools/{name}/schema")
    public Mono<Map<String, Object>> describe(@PathVariable("name") String name) {
        return Mono.fromCallable(() -> Map.<String, Object>of("tool_name", name, "schema", lifecycle.describe(name)))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
