package com.parallax.workspace;

/**
 * Integrates a source branch into the mainline. On success the source branch is deleted.
 */
@FunctionalInterface
public interface MergeHook {

    Result merge(String sourceBranch, String mainline) throws WorkspaceException;

    record Result(boolean success, String message) {

        public static Result merged(String message) {
            return new Result(true, message);
        }

        public static Result rejected(String message) {
            return new Result(false, message);
        }
    }
}
