package org.neuralchilli.marshal.service;

import java.util.Optional;

/**
 * Result of loading one pipeline file. The loader reports per-file outcomes
 * instead of stopping at the first bad file.
 */
public sealed interface LoadResult {

    boolean isSuccess();

    /**
     * Pipeline name on success, file name on failure
     */
    String name();

    Optional<String> error();

    record Success(String name, int steps) implements LoadResult {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public Optional<String> error() {
            return Optional.empty();
        }
    }

    record Failure(String name, String errorMessage) implements LoadResult {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public Optional<String> error() {
            return Optional.of(errorMessage);
        }
    }

    static LoadResult success(String name, int steps) {
        return new Success(name, steps);
    }

    static LoadResult failure(String name, Exception e) {
        return new Failure(name, e.getMessage());
    }
}
