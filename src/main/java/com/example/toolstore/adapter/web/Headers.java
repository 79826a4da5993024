package com.example.toolstore.adapter.web;

/** Request headers carrying credentials. */
public final class Headers {
    public static final String ADMIN_TOKEN = "admin-token";
    public static final String TOOL_TOKEN = "token";

    private Headers() {}
}
