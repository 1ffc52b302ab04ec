package com.parallax.workspace;

import com.parallax.core.model.VerificationResult;
import com.parallax.core.model.Workspace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

/**
 * Verification hook that runs a shell command inside the workspace tree. A blank command
 * always passes.
 */
public class CommandVerifier implements VerificationHook {

    private static final Logger log = LoggerFactory.getLogger(CommandVerifier.class);

    private final ProcessRunner runner;
    private final String commandLine;
    private final Duration timeout;

    public CommandVerifier(ProcessRunner runner, String commandLine, Duration timeout) {
        this.runner = runner;
        this.commandLine = commandLine == null ? "" : commandLine.trim();
        this.timeout = timeout;
    }

    @Override
    public VerificationResult verify(Workspace workspace) throws Exception {
        if (commandLine.isEmpty()) {
            return VerificationResult.pass("no verification command configured");
        }
        if (workspace.getPath() == null) {
            return VerificationResult.fail("workspace " + workspace.getId() + " has no working tree");
        }
        log.info("Verifying workspace {} with '{}'", workspace.getId(), commandLine);
        var result = runner.run(List.of("sh", "-c", commandLine), workspace.getPath(), null, timeout);
        if (result.timedOut()) {
            return VerificationResult.fail("verification timed out after " + timeout.toSeconds() + "s");
        }
        if (result.exitCode() != 0) {
            return VerificationResult.fail("verification exited with code " + result.exitCode()
                    + "\n" + tail(result.output()));
        }
        return VerificationResult.pass(tail(result.output()));
    }

    private static String tail(String output) {
        if (output == null) return "";
        return output.length() > 2000 ? output.substring(output.length() - 2000) : output;
    }
}
