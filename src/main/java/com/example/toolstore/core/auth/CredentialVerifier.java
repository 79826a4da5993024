package com.example.toolstore.core.auth;

/**
 * Compares a presented credential with the expected one. Implementations may hash or otherwise
 * harden the comparison; callers only see the boolean.
 */
public interface CredentialVerifier {

    boolean matches(String presented, String expected);
}
