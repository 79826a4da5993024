package com.example.toolstore.core.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.Map;

@ConfigurationProperties(prefix = "app")
@Validated
public record ToolStoreProperties(
        @NotNull @Valid Auth auth, Pagination pagination, Store store, Lifecycle lifecycle) {

    public ToolStoreProperties {
        if (pagination == null) {
            pagination = new Pagination(0, 0);
        }
        if (store == null) {
            store = new Store(null, null);
        }
        if (lifecycle == null) {
            lifecycle = new Lifecycle(false);
        }
    }

    public record Auth(@NotBlank String adminToken, Map<String, String> legacyTokens) {

        public Auth {
            legacyTokens = legacyTokens == null ? Map.of() : Map.copyOf(legacyTokens);
        }
    }

    public record Pagination(int defaultLimit, int maxLimit) {

        public Pagination {
            if (maxLimit <= 0) {
                maxLimit = 100;
            }
            if (defaultLimit <= 0) {
                defaultLimit = 10;
            }
            defaultLimit = Math.min(defaultLimit, maxLimit);
        }
    }

    public record Store(String dialect, String tablePrefix) {

        public Store {
            if (dialect == null || dialect.isBlank()) {
                dialect = "h2";
            }
            if (tablePrefix == null || tablePrefix.isBlank()) {
                tablePrefix = "tool_";
            }
        }
    }

    /**
     * @param lenientDeregistration when true a failed table drop is logged and the registry row
     *     is removed anyway, possibly leaving an unreachable table behind
     */
    public record Lifecycle(boolean lenientDeregistration) {}
}
