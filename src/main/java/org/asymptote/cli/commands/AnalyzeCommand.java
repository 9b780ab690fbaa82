package org.asymptote.cli.commands;

import com.typesafe.config.ConfigException;
import org.asymptote.analyzer.ComplexityAnalyzer;
import org.asymptote.analyzer.api.AnalysisException;
import org.asymptote.analyzer.report.AnalysisReport;
import org.asymptote.analyzer.report.ReportSerializer;
import org.asymptote.cli.CommandLineInterface;
import org.asymptote.config.AnalyzerOptions;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.util.concurrent.Callable;

@Command(name = "analyze", description = "Analyzes a pseudocode file and prints the JSON report.")
public class AnalyzeCommand implements Callable<Integer> {

    @Option(names = {"-f", "--file"}, required = true, description = "The path to the pseudocode file.")
    private File file;

    @Option(names = "--max-depth", description = "Deepest recursion tree level to expand (default from configuration).")
    private Integer maxDepth;

    @Option(names = "--compact", description = "Print the report on a single line.")
    private boolean compact;

    @CommandLine.ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter err = spec.commandLine().getErr();
        if (maxDepth != null && maxDepth < 0) {
            throw new CommandLine.ParameterException(spec.commandLine(), "--max-depth must not be negative: " + maxDepth);
        }

        AnalyzerOptions options;
        try {
            options = AnalyzerOptions.fromConfig(parent.getConfig());
        } catch (ConfigException | IllegalArgumentException e) {
            err.println("Invalid configuration: " + e.getMessage());
            return CommandLineInterface.EXIT_IO_FAILED;
        }
        if (maxDepth != null) {
            options = options.withMaxDepth(maxDepth);
        }

        String source;
        try {
            source = Files.readString(file.toPath());
        } catch (IOException e) {
            err.println("Cannot read " + file + ": " + e.getMessage());
            return CommandLineInterface.EXIT_IO_FAILED;
        }

        AnalysisReport report;
        try {
            report = new ComplexityAnalyzer(options).analyze(source, file.getName());
        } catch (AnalysisException e) {
            err.println(e.getMessage());
            return CommandLineInterface.EXIT_ANALYSIS_FAILED;
        }

        spec.commandLine().getOut().println(new ReportSerializer(!compact).toJson(report));
        return CommandLineInterface.EXIT_OK;
    }
}
