package com.parallax.core.model;

/**
 * Outcome of the verification hook for one workspace.
 */
public record VerificationResult(boolean passed, String diagnostics) {

    public static VerificationResult pass(String diagnostics) {
        return new VerificationResult(true, diagnostics);
    }

    public static VerificationResult fail(String diagnostics) {
        return new VerificationResult(false, diagnostics);
    }
}
