package org.asymptote.analyzer.model;

/**
 * A note attached to a result by one of the analysis stages.
 *
 * @param kind What was recognized.
 * @param message A human readable description.
 * @param line The source line the note refers to, or {@code 0}.
 * @param assumption {@code true} if the result depends on a guess that this note makes explicit.
 */
public record Annotation(AnnotationKind kind, String message, int line, boolean assumption) {

    public static Annotation of(AnnotationKind kind, String message, int line) {
        return new Annotation(kind, message, line, false);
    }

    public static Annotation assumption(AnnotationKind kind, String message, int line) {
        return new Annotation(kind, message, line, true);
    }

    @Override
    public String toString() {
        String prefix = assumption ? "[assumption] " : "";
        return line > 0 ? prefix + kind + " (line " + line + "): " + message : prefix + kind + ": " + message;
    }
}
