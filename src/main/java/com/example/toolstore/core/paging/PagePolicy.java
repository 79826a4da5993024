package com.example.toolstore.core.paging;

import com.example.toolstore.core.config.ToolStoreProperties;
import org.springframework.stereotype.Component;

@Component
public class PagePolicy {

    private final int defaultLimit;
    private final int maxLimit;

    public PagePolicy(ToolStoreProperties properties) {
        this.defaultLimit = properties.pagination().defaultLimit();
        this.maxLimit = properties.pagination().maxLimit();
    }

    public PageRequest resolve(Integer limit, Integer offset) {
        int effectiveLimit = limit == null ? defaultLimit : Math.min(limit, maxLimit);
        int effectiveOffset = offset == null ? 0 : offset;
        return new PageRequest(effectiveLimit, effectiveOffset);
    }
}
