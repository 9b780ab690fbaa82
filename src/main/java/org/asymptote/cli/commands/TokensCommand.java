package org.asymptote.cli.commands;

import org.asymptote.analyzer.api.LexException;
import org.asymptote.analyzer.diagnostics.DiagnosticsEngine;
import org.asymptote.analyzer.frontend.lexer.Lexer;
import org.asymptote.analyzer.frontend.lexer.Token;
import org.asymptote.cli.CommandLineInterface;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "tokens", description = "Prints the token stream of a pseudocode file.")
public class TokensCommand implements Callable<Integer> {

    @Option(names = {"-f", "--file"}, required = true, description = "The path to the pseudocode file.")
    private File file;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        String source;
        try {
            source = Files.readString(file.toPath());
        } catch (IOException e) {
            err.println("Cannot read " + file + ": " + e.getMessage());
            return CommandLineInterface.EXIT_IO_FAILED;
        }

        try {
            List<Token> tokens = new Lexer(source, new DiagnosticsEngine(), file.getName()).scanTokens();
            tokens.forEach(out::println);
            return CommandLineInterface.EXIT_OK;
        } catch (LexException e) {
            err.println(e.getMessage());
            return CommandLineInterface.EXIT_ANALYSIS_FAILED;
        }
    }
}
