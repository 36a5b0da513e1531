package com.phillippitts.modelorchestrator.cli;

import com.phillippitts.modelorchestrator.service.orchestration.OrchestrationService;
import com.phillippitts.modelorchestrator.service.report.SummaryReporter;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import picocli.CommandLine;

import java.util.Arrays;

/**
 * Runs {@link OrchestrateCommand} once at startup when {@code orchestrator.cli.enabled=true}
 * (the {@code cli} profile) and remembers its exit code for {@code SpringApplication.exit}.
 */
@Component
@ConditionalOnProperty(prefix = "orchestrator.cli", name = "enabled", havingValue = "true")
public class OrchestrationCliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final OrchestrationService orchestrationService;
    private final SummaryReporter reporter;
    private int exitCode;

    public OrchestrationCliRunner(OrchestrationService orchestrationService, SummaryReporter reporter) {
        this.orchestrationService = orchestrationService;
        this.reporter = reporter;
    }

    @Override
    public void run(String... args) {
        CommandLine cli = new CommandLine(new OrchestrateCommand(orchestrationService, reporter));
        exitCode = cli.execute(commandArgs(args));
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /**
     * Drops Spring property arguments such as {@code --spring.profiles.active=cli}; picocli would
     * reject them as unknown options.
     */
    static String[] commandArgs(String... args) {
        return Arrays.stream(args)
                .filter(arg -> !isSpringProperty(arg))
                .toArray(String[]::new);
    }

    private static boolean isSpringProperty(String arg) {
        if (!arg.startsWith("--")) {
            return false;
        }
        int eq = arg.indexOf('=');
        String name = eq < 0 ? arg.substring(2) : arg.substring(2, eq);
        return name.contains(".");
    }
}
