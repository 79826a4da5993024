package com.example.toolstore.core.common;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonRawValue;

import java.time.Instant;

public record CommonRecord(
        long id,
        @JsonProperty("tool_name") String toolName,
        @JsonRawValue String data,
        int sensitive,
        @JsonProperty("created_at") Instant createdAt
) {}
