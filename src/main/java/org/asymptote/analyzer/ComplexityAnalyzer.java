package org.asymptote.analyzer;

import org.asymptote.analyzer.analysis.linecost.LineCostAnalyzer;
import org.asymptote.analyzer.analysis.linecost.LineCostReport;
import org.asymptote.analyzer.analysis.recurrence.RecurrenceExtractor;
import org.asymptote.analyzer.analysis.recurrence.RecurrenceRelation;
import org.asymptote.analyzer.analysis.recurrence.RecurrenceSolver;
import org.asymptote.analyzer.analysis.recurrence.SolverOutcome;
import org.asymptote.analyzer.analysis.resolution.Resolution;
import org.asymptote.analyzer.analysis.resolution.Resolver;
import org.asymptote.analyzer.analysis.structural.StructuralEngine;
import org.asymptote.analyzer.analysis.structural.StructuralReport;
import org.asymptote.analyzer.analysis.tree.RecursionTree;
import org.asymptote.analyzer.analysis.tree.RecursionTreeBuilder;
import org.asymptote.analyzer.api.AnalysisException;
import org.asymptote.analyzer.api.IComplexityAnalyzer;
import org.asymptote.analyzer.api.IGrammarCorrector;
import org.asymptote.analyzer.api.ParseException;
import org.asymptote.analyzer.diagnostics.DiagnosticsEngine;
import org.asymptote.analyzer.frontend.AstPrinter;
import org.asymptote.analyzer.frontend.lexer.Lexer;
import org.asymptote.analyzer.frontend.lexer.Token;
import org.asymptote.analyzer.frontend.parser.Parser;
import org.asymptote.analyzer.frontend.parser.ProcedureTable;
import org.asymptote.analyzer.frontend.parser.ast.Program;
import org.asymptote.analyzer.report.AnalysisReport;
import org.asymptote.config.AnalyzerOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * The analyzer implementation. It runs the whole pipeline from source text to report:
 * lexing, parsing, line costs, structural analysis, recurrence extraction and solving, the
 * recursion tree and the final resolution.
 * <p>
 * Instances hold no per-request state and may be shared between threads.
 */
public class ComplexityAnalyzer implements IComplexityAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(ComplexityAnalyzer.class);

    private final AnalyzerOptions options;
    private final IGrammarCorrector corrector;
    private final LineCostAnalyzer lineCostAnalyzer = new LineCostAnalyzer();
    private final StructuralEngine structuralEngine = new StructuralEngine();
    private final RecurrenceExtractor extractor = new RecurrenceExtractor();
    private final RecurrenceSolver solver;
    private final RecursionTreeBuilder treeBuilder;
    private final Resolver resolver = new Resolver();

    public ComplexityAnalyzer() {
        this(AnalyzerOptions.defaults(), null);
    }

    public ComplexityAnalyzer(AnalyzerOptions options) {
        this(options, null);
    }

    /**
     * @param options The tunables.
     * @param corrector The grammar-correction collaborator consulted after a parse error, or {@code null}.
     */
    public ComplexityAnalyzer(AnalyzerOptions options, IGrammarCorrector corrector) {
        this.options = options;
        this.corrector = corrector;
        this.solver = new RecurrenceSolver(options.substitutionSteps());
        this.treeBuilder = new RecursionTreeBuilder(options.maxDepth(), options.maxNodes(), options.nominalSize());
    }

    /**
     * {@inheritDoc}
     * <p>
     * After a parse error the grammar corrector, if installed and enabled, may rewrite the source
     * once. A failure of the rewritten source surfaces its own parse error. Lexer errors are never
     * retried.
     */
    @Override
    public AnalysisReport analyze(String source, String programName) throws AnalysisException {
        try {
            return run(source, programName);
        } catch (ParseException e) {
            if (corrector == null || !options.grammarCorrectionEnabled()) {
                throw e;
            }
            Optional<String> corrected = corrector.correct(source, e);
            if (corrected.isEmpty() || corrected.get().equals(source)) {
                LOG.debug("No correction offered for {}", programName);
                throw e;
            }
            LOG.info("Parse error in {} ({}), retrying once with corrected source", programName, e.getMessage());
            return run(corrected.get(), programName)
                    .withCorrectionNote("Source was rewritten after: " + e.getMessage());
        }
    }

    private AnalysisReport run(String source, String programName) throws AnalysisException {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Phase 1: Lexical analysis
        List<Token> tokens = new Lexer(source, diagnostics, programName).scanTokens();

        // Phase 2: Parsing
        Program program = new Parser(tokens, diagnostics).parse();
        ProcedureTable.of(program, diagnostics);
        LOG.debug("Parsed {}: {} procedure(s), main block: {}", programName,
                program.procedures().size(), program.hasBody());

        // Phase 3: Line costs and structural analysis
        LineCostReport lineCosts = lineCostAnalyzer.analyze(program, source);
        StructuralReport structural = structuralEngine.analyzeProgram(program);

        // Phase 4: Recurrence of the recursive procedure the program revolves around
        Optional<RecurrenceRelation> relation = structural.recursiveProcedure()
                .flatMap(name -> extractor.extract(program, name, lineCosts));
        Optional<SolverOutcome> outcome = relation.map(solver::solve);
        Optional<RecursionTree> tree = relation.map(treeBuilder::build);

        // Phase 5: Resolution
        Resolution resolution = resolver.resolve(structural, relation, outcome);
        LOG.debug("Resolved {}: {} via {}", programName, resolution.mainResult(), resolution.method());

        return new AnalysisReport(programName, tokens, AstPrinter.dump(program), lineCosts,
                relation.orElse(null), outcome.orElse(null), tree.orElse(null), resolution,
                diagnostics.getDiagnostics(), null);
    }

    public AnalyzerOptions getOptions() {
        return options;
    }
}
