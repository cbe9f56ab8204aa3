package com.demo.quotatoken.verifier;

public sealed interface VerificationResult {

    record Verified(AuthenticatedToken token) implements VerificationResult {
    }

    record Rejected(AuthFailure reason) implements VerificationResult {

        public String message() {
            return reason.message();
        }
    }

    default boolean verified() {
        return this instanceof Verified;
    }
}
