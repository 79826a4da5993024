package com.example.toolstore.core.auth;

import com.example.toolstore.core.config.ToolStoreProperties;
import com.example.toolstore.core.error.ForbiddenException;
import com.example.toolstore.core.error.UnauthorizedException;
import com.example.toolstore.core.registry.ToolRegistration;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;

@Component
public class AccessPolicy {

    private final CredentialVerifier verifier;
    private final String adminToken;
    private final Collection<String> legacyTokens;

    public AccessPolicy(CredentialVerifier verifier, ToolStoreProperties properties) {
        this.verifier = verifier;
        this.adminToken = properties.auth().adminToken();
        this.legacyTokens = List.copyOf(properties.auth().legacyTokens().values());
    }

    public void requireAdmin(String credential) {
        if (!verifier.matches(credential, adminToken)) {
            throw new ForbiddenException("Admin credential required");
        }
    }

    public void requireToolToken(ToolRegistration registration, String token) {
        if (!verifier.matches(token, registration.token())) {
            throw new UnauthorizedException("Invalid token for tool " + registration.toolName());
        }
    }

    public boolean isLegacyToken(String token) {
        for (String candidate : legacyTokens) {
            if (verifier.matches(token, candidate)) {
                return true;
            }
        }
        return false;
    }

    public void requireLegacyToken(String token) {
        if (!isLegacyToken(token)) {
            throw new UnauthorizedException("Invalid or missing token");
        }
    }
}
