package com.purchasingpower.ptcaudit.cli;

import com.purchasingpower.ptcaudit.exception.InvalidRunIdentifierException;
import com.purchasingpower.ptcaudit.exception.ReconciliationException;
import com.purchasingpower.ptcaudit.exception.RunNotFoundException;
import com.purchasingpower.ptcaudit.model.dto.ReconciliationReport;
import com.purchasingpower.ptcaudit.report.ReconciliationReportFormatter;
import com.purchasingpower.ptcaudit.report.ReportMode;
import com.purchasingpower.ptcaudit.service.ReconciliationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.List;

/**
 * Renders one report from the command line.
 *
 * <pre>
 *   --run-id=ar-xxx | sk-xxx | c-xxx   (required)
 *   --title="exact title"              (canvas ids only)
 *   --full                             (no truncation, breakdown table)
 *   --mode=verify | billing | calling  (default verify)
 * </pre>
 *
 * Exit codes: 0 report printed, 1 run not found, 2 bad arguments, 3 store unreadable.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.cli", name = "enabled", havingValue = "true")
public class ReconciliationCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_NOT_FOUND = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_FAILURE = 3;

    private static final String USAGE = "Usage: --run-id=<ar-...|sk-...|c-...> [--title=<title>] [--full] [--mode=verify|billing|calling]";

    private final ReconciliationService reconciliationService;
    private final ReconciliationReportFormatter formatter;

    private PrintStream out = System.out;
    private int exitCode = EXIT_OK;

    @Override
    public void run(ApplicationArguments args) {
        exitCode = execute(args);
    }

    int execute(ApplicationArguments args) {
        String runId = single(args, "run-id");
        if (runId == null || runId.isBlank()) {
            log.error("Missing --run-id. {}", USAGE);
            return EXIT_USAGE;
        }
        String title = single(args, "title");
        boolean full = args.containsOption("full");

        ReportMode mode;
        try {
            mode = ReportMode.fromValue(single(args, "mode"));
        } catch (IllegalArgumentException e) {
            log.error("Unknown --mode. {}", USAGE);
            return EXIT_USAGE;
        }

        try {
            ReconciliationReport report = mode == ReportMode.CALLING
                    ? reconciliationService.traceCalls(runId, title)
                    : reconciliationService.reconcile(runId, title, full);
            out.print(formatter.render(report, mode, full));
            out.flush();
            return EXIT_OK;

        } catch (RunNotFoundException e) {
            log.error(e.getMessage());
            return EXIT_NOT_FOUND;
        } catch (InvalidRunIdentifierException e) {
            log.error(e.getMessage());
            return EXIT_USAGE;
        } catch (ReconciliationException e) {
            log.error("Reconciliation of {} failed", runId, e);
            return EXIT_FAILURE;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    void setOut(PrintStream out) {
        this.out = out;
    }

    private static String single(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        return values == null || values.isEmpty() ? null : values.get(values.size() - 1);
    }
}
