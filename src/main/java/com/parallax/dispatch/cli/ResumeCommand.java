package com.parallax.dispatch.cli;

import com.parallax.core.dispatch.ConcurrentDispatcher;
import com.parallax.core.model.ExecutionReport;
import com.parallax.core.model.WorkspaceInfo;
import com.parallax.core.resume.ResumeScanner;
import com.parallax.core.scheduler.SchedulingException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: parallax resume [--days N] [--run]
 * <p>
 * Lists existing workspaces with their intent and resumability, and optionally re-admits
 * the resumable ones.
 */
@Command(name = "resume", mixinStandardHelpOptions = true,
        description = "List existing workspaces and optionally resume the recent ones")
@Component
public class ResumeCommand implements Callable<Integer> {

    @Option(names = "--days", description = "Recency window in days")
    private Integer days;

    @Option(names = "--run", description = "Resume every resumable workspace")
    private boolean run;

    private final ResumeScanner scanner;
    private final ConcurrentDispatcher dispatcher;

    public ResumeCommand(ResumeScanner scanner, ConcurrentDispatcher dispatcher) {
        this.scanner = scanner;
        this.dispatcher = dispatcher;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        if (days != null && days < 0) {
            ConsoleOutput.error("--days must not be negative");
            return ExitCodes.INVALID_INPUT;
        }
        ResumeScanner effective = days == null ? scanner : scanner.withRecencyWindow(Duration.ofDays(days));

        List<WorkspaceInfo> infos = effective.scan();
        if (infos.isEmpty()) {
            ConsoleOutput.info("No open workspaces found");
            return ExitCodes.OK;
        }
        for (WorkspaceInfo info : infos) {
            ConsoleOutput.workspaceInfo(info);
        }

        List<WorkspaceInfo> resumable = effective.resumable(infos);
        ConsoleOutput.info(String.format("%d of %d workspaces resumable (window %d days)",
                resumable.size(), infos.size(), effective.getRecencyWindow().toDays()));
        if (!run || resumable.isEmpty()) {
            return ExitCodes.OK;
        }

        ExecutionReport report;
        try {
            report = dispatcher.resume(resumable);
        } catch (SchedulingException e) {
            ConsoleOutput.error("Scheduling error [" + e.getErrorCode() + "]: " + e.getMessage());
            return ExitCodes.SCHEDULING_ERROR;
        }
        ConsoleOutput.report(report);
        return report.allGroupsFinished() ? ExitCodes.OK : ExitCodes.SCHEDULING_ERROR;
    }
}
