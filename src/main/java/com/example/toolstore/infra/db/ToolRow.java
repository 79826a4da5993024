package com.example.toolstore.infra.db;

import java.time.Instant;

public record ToolRow(long id, String toolName, String token, String schemaJson, Instant createdAt) {}
