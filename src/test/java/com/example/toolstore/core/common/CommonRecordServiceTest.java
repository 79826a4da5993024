package com.example.toolstore.core.common;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import com.example.toolstore.core.auth.AccessPolicy;
import com.example.toolstore.core.auth.ExactMatchCredentialVerifier;
import com.example.toolstore.core.config.ToolStoreProperties;
import com.example.toolstore.core.error.PayloadValidationException;
import com.example.toolstore.core.error.UnauthorizedException;
import com.example.toolstore.core.paging.PageRequest;
import com.example.toolstore.infra.db.CommonRecordRepository;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CommonRecordService")
class CommonRecordServiceTest {

    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

    private final ObjectMapper om = new ObjectMapper();
    private final CommonRecordRepository repo = mock(CommonRecordRepository.class);
    private final CommonRecordService service = new CommonRecordService(repo,
            new AccessPolicy(new ExactMatchCredentialVerifier(), new ToolStoreProperties(
                    new ToolStoreProperties.Auth("admin", Map.of("reports_tool", "token123")), null, null, null)),
            om, Clock.fixed(NOW, ZoneOffset.UTC));

    private JsonNode json(String text) throws Exception {
        return om.readTree(text);
    }

    @Test
    @DisplayName("stores public records without a token")
    void publicRecord() throws Exception {
        service.store("adhoc", 0, null, json("{\"a\":1}"));

        verify(repo).insert("adhoc", "{\"a\":1}", 0, NOW);
    }

    @Test
    @DisplayName("requires a legacy token for sensitive records")
    void sensitiveNeedsToken() throws Exception {
        assertThatThrownBy(() -> service.store("adhoc", 1, null, json("{\"a\":1}")))
                .isInstanceOf(UnauthorizedException.class);
        assertThatThrownBy(() -> service.store("adhoc", 1, "token999", json("{\"a\":1}")))
                .isInstanceOf(UnauthorizedException.class);
        verifyNoInteractions(repo);

        service.store("adhoc", 1, "token123", json("{\"a\":1}"));
        verify(repo).insert(eq("adhoc"), anyString(), eq(1), any());
    }

    @Test
    @DisplayName("rejects a bad sensitivity flag, tool name or data")
    void rejectsMalformedInput() throws Exception {
        assertThatThrownBy(() -> service.store("adhoc", 2, null, json("{}")))
                .isInstanceOf(PayloadValidationException.class);
        assertThatThrownBy(() -> service.store(" ", 0, null, json("{}")))
                .isInstanceOf(PayloadValidationException.class);
        assertThatThrownBy(() -> service.store("adhoc", 0, null, json("[1]")))
                .isInstanceOf(PayloadValidationException.class);
        verify(repo, never()).insert(anyString(), anyString(), anyInt(), any());
    }

    @Test
    @DisplayName("includes sensitive records only for a valid token")
    void listFiltersSensitive() {
        PageRequest page = new PageRequest(10, 0);

        service.list("adhoc", null, page);
        service.list("adhoc", "token123", page);

        verify(repo).findByToolName("adhoc", false, page);
        verify(repo).findByToolName("adhoc", true, page);
    }
}
