package com.example.toolstore.core.common;

import com.example.toolstore.core.auth.AccessPolicy;
import com.example.toolstore.core.error.PayloadValidationException;
import com.example.toolstore.core.error.RelationStoreException;
import com.example.toolstore.core.paging.PageRequest;
import com.example.toolstore.infra.db.CommonRecordRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Legacy ingestion path for unregistered tools. Records go to one shared table without any
 * schema; only sensitive records need a token, checked against the static legacy set. It does
 * not consult the tool registry.
 */
@Service
public class CommonRecordService {

    private static final Logger log = LoggerFactory.getLogger(CommonRecordService.class);

    static final int MAX_TOOL_NAME_LENGTH = 50;

    private final CommonRecordRepository repo;
    private final AccessPolicy accessPolicy;
    private final ObjectMapper om;
    private final Clock clock;

    public CommonRecordService(CommonRecordRepository repo, AccessPolicy accessPolicy, ObjectMapper om, Clock clock) {
        this.repo = repo;
        this.accessPolicy = accessPolicy;
        this.om = om;
        this.clock = clock;
    }

    public void store(String toolName, int sensitive, String token, JsonNode data) {
        if (sensitive != 0 && sensitive != 1) {
            throw new PayloadValidationException("sensitive must be 0 or 1");
        }
        if (sensitive == 1) {
            accessPolicy.requireLegacyToken(token);
        }
        if (toolName == null || toolName.isBlank() || toolName.length() > MAX_TOOL_NAME_LENGTH) {
            throw new PayloadValidationException("tool_name must be 1-" + MAX_TOOL_NAME_LENGTH + " characters");
        }
        if (data == null || !data.isObject()) {
            throw new PayloadValidationException("data must be a JSON object");
        }
        try {
            repo.insert(toolName, om.writeValueAsString(data), sensitive, clock.instant());
        } catch (JsonProcessingException e) {
            throw new PayloadValidationException("data is not serializable: " + e.getOriginalMessage());
        } catch (DataAccessException e) {
            throw new RelationStoreException("Failed to store common record for " + toolName, e);
        }
        log.info("Stored common record for {} (sensitive={})", toolName, sensitive);
    }

    public List<CommonRecord> list(String toolName, String token, PageRequest page) {
        boolean includeSensitive = accessPolicy.isLegacyToken(token);
        try {
            return repo.findByToolName(toolName, includeSensitive, page);
        } catch (DataAccessException e) {
            throw new RelationStoreException("Failed to read common records for " + toolName, e);
        }
    }
}
