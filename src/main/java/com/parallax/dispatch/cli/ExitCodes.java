package com.parallax.dispatch.cli;

/**
 * Process exit codes shared by the CLI commands.
 */
final class ExitCodes {

    static final int OK = 0;
    static final int INVALID_INPUT = 1;
    static final int SCHEDULING_ERROR = 2;

    private ExitCodes() {}
}
