package org.asymptote.analyzer.frontend.parser;

import org.asymptote.analyzer.diagnostics.DiagnosticsEngine;
import org.asymptote.analyzer.frontend.parser.ast.ProcedureDecl;
import org.asymptote.analyzer.frontend.parser.ast.Program;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves procedure names to their declarations. Names are case-insensitive, like keywords.
 * Recursive and mutual calls are resolved through this table, never through references in the tree.
 */
public final class ProcedureTable {

    private final Map<String, ProcedureDecl> procedures = new LinkedHashMap<>();

    private ProcedureTable() {
    }

    /**
     * Builds the table for a parsed program. A duplicate name keeps the first declaration.
     * @param program The program.
     * @param diagnostics Receives a warning for each duplicate, may be {@code null}.
     * @return The table.
     */
    public static ProcedureTable of(Program program, DiagnosticsEngine diagnostics) {
        ProcedureTable table = new ProcedureTable();
        for (ProcedureDecl procedure : program.procedures()) {
            String key = normalize(procedure.procedureName());
            if (table.procedures.containsKey(key)) {
                if (diagnostics != null) {
                    diagnostics.reportWarning("Procedure '" + procedure.procedureName() + "' is already defined.",
                            procedure.sourceInfo().fileName(), procedure.line(), procedure.sourceInfo().columnNumber());
                }
            } else {
                table.procedures.put(key, procedure);
            }
        }
        return table;
    }

    public static ProcedureTable of(Program program) {
        return of(program, null);
    }

    public Optional<ProcedureDecl> lookup(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(procedures.get(normalize(name)));
    }

    public boolean contains(String name) {
        return lookup(name).isPresent();
    }

    public Collection<ProcedureDecl> all() {
        return Collections.unmodifiableCollection(procedures.values());
    }

    private static String normalize(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
