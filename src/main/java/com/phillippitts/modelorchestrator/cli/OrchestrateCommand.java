package com.phillippitts.modelorchestrator.cli;

import com.phillippitts.modelorchestrator.domain.OrchestrationSummary;
import com.phillippitts.modelorchestrator.exception.InvalidOrchestrationRequestException;
import com.phillippitts.modelorchestrator.service.orchestration.OrchestrationService;
import com.phillippitts.modelorchestrator.service.report.SummaryReporter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * {@code orchestrate -p "prompt" -m gemini,claude -t 30000 -r 2}
 *
 * <p>Prints the JSON summary followed by each successful model's output to stdout; logs go to
 * stderr. Exit code 0 when at least one model succeeded, 1 otherwise or on invalid input.
 */
@Command(
        name = "orchestrate",
        mixinStandardHelpOptions = true,
        description = "Send one prompt to several AI models concurrently with retries.",
        footer = {"", "Exit codes: 0 = at least one model succeeded, 1 = all models failed or invalid input."}
)
public class OrchestrateCommand implements Callable<Integer> {

    private static final Logger LOG = LogManager.getLogger(OrchestrateCommand.class);

    static final int EXIT_SUCCESS = 0;
    static final int EXIT_FAILURE = 1;

    @Option(names = {"-p", "--prompt"}, description = "Prompt text.")
    String prompt;

    @Option(names = {"-f", "--file"}, description = "Read the prompt from a file (overrides --prompt).")
    Path file;

    @Option(names = {"-m", "--models"}, split = ",", description = "Comma-separated model ids (default: configured).")
    List<String> models;

    @Option(names = {"-t", "--timeout"}, description = "Per-attempt timeout in ms (capped at the configured maximum).")
    Long timeoutMs;

    @Option(names = {"-r", "--retries"}, description = "Retries per model after the first attempt.")
    Integer retries;

    private final OrchestrationService orchestrationService;
    private final SummaryReporter reporter;

    public OrchestrateCommand(OrchestrationService orchestrationService, SummaryReporter reporter) {
        this.orchestrationService = orchestrationService;
        this.reporter = reporter;
    }

    @Override
    public Integer call() {
        String text;
        try {
            text = resolvePrompt();
        } catch (IOException e) {
            System.err.println("Error: cannot read prompt file " + file + ": " + e.getMessage());
            return EXIT_FAILURE;
        }

        OrchestrationSummary summary;
        try {
            summary = orchestrationService.orchestrate(models, text, timeoutMs, retries);
        } catch (InvalidOrchestrationRequestException e) {
            System.err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        }

        reporter.logSummary(summary);
        System.out.println(reporter.toJson(summary));
        String outputs = reporter.renderOutputs(summary);
        if (!outputs.isEmpty()) {
            System.out.print(outputs);
        }
        LOG.debug("CLI run finished, overallSuccess={}", summary.overallSuccess());
        return summary.overallSuccess() ? EXIT_SUCCESS : EXIT_FAILURE;
    }

    private String resolvePrompt() throws IOException {
        if (file != null) {
            return Files.readString(file, StandardCharsets.UTF_8).trim();
        }
        return prompt;
    }
}
