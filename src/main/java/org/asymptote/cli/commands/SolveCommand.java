package org.asymptote.cli.commands;

import com.typesafe.config.ConfigException;
import org.asymptote.analyzer.analysis.recurrence.RecurrenceParser;
import org.asymptote.analyzer.analysis.recurrence.RecurrenceRelation;
import org.asymptote.analyzer.analysis.recurrence.RecurrenceSolver;
import org.asymptote.analyzer.analysis.recurrence.SolverOutcome;
import org.asymptote.analyzer.report.ReportSerializer;
import org.asymptote.cli.CommandLineInterface;
import org.asymptote.config.AnalyzerOptions;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(name = "solve", description = "Solves a recurrence such as \"T(n) = 2T(n/2) + n\" and prints the derivation.")
public class SolveCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "The recurrence, e.g. \"T(n) = T(n-1) + T(n-2) + 1\".")
    private String recurrence;

    @CommandLine.ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter err = spec.commandLine().getErr();
        int steps;
        try {
            steps = AnalyzerOptions.fromConfig(parent.getConfig()).substitutionSteps();
        } catch (ConfigException e) {
            err.println("Invalid configuration: " + e.getMessage());
            return CommandLineInterface.EXIT_IO_FAILED;
        }

        RecurrenceRelation relation;
        try {
            relation = RecurrenceParser.parse(recurrence);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            return CommandLineInterface.EXIT_ANALYSIS_FAILED;
        }

        SolverOutcome outcome = new RecurrenceSolver(steps).solve(relation);
        ReportSerializer serializer = new ReportSerializer();
        spec.commandLine().getOut().println(serializer.toJson(serializer.toJsonTree(relation, outcome)));
        return CommandLineInterface.EXIT_OK;
    }
}
