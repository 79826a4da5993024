package com.example.toolstore.adapter.health;

import com.example.toolstore.core.error.RelationStoreException;
import org.springframework.dao.DataAccessException;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Map;

@RestController
public class HealthController {
    private final JdbcTemplate jdbc;

    public HealthController(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @GetMapping(path = "/", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<Map<String, Object>> health() {
        return Mono.fromCallable(() -> {
            try {
                jdbc.queryForObject("SELECT 1", Integer.class);
            } catch (DataAccessException e) {
                throw new RelationStoreException("Store is unreachable", e);
            }
            return Map.<String, Object>of("status", "storage service + db connected");
        }).subscribeOn(Schedulers.boundedElastic());
    }
}
