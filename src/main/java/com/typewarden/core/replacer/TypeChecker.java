package com.typewarden.core.replacer;

/**
 * The project's compiler, used as the oracle of correctness.
 */
@FunctionalInterface
public interface TypeChecker {

    /**
     * Runs a full check of the working tree. Must return within its configured
     * timeout and must not throw for compiler failures.
     */
    TypeCheckResult check();
}
