package org.asymptote.analyzer.analysis.recurrence;

import org.asymptote.analyzer.model.GrowthRate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Parses recurrences written in the canonical text form, so that they can be solved without a program:
 * {@code T(n) = 2T(n/2) + n}, {@code T(n) = T(n-1) + T(n-2) + Θ(1)}, {@code T(n) = T(k) + T(n-k-1) + O(n)}.
 * <p>
 * The left-hand side is optional. Costs may be wrapped in {@code O}, {@code Θ} or {@code Ω} and use
 * {@code 1}, {@code c}, {@code n}, {@code n^d}, {@code log n}, {@code lg n}, {@code n log n} and {@code b^n}.
 */
public final class RecurrenceParser {

    private static final Pattern TERM = Pattern.compile("^(\\d+)?\\*?T\\((.+)\\)$");
    private static final Pattern SUBTRACT = Pattern.compile("^n-(\\d+)$");
    private static final Pattern DIVIDE = Pattern.compile("^n/(\\d+(?:\\.\\d+)?)$");
    private static final Pattern WRAPPED = Pattern.compile("^(?:O|Θ|Ω|Theta|Omega)\\((.*)\\)$");
    private static final Pattern COST = Pattern.compile(
            "^(?:(\\d+(?:\\.\\d+)?)\\^n)?\\*?(?:n(?:\\^(\\d+(?:\\.\\d+)?))?)?\\*?(?:(?:log|lg)(?:\\^(\\d+))?n)?$");

    private RecurrenceParser() {
    }

    /**
     * @param text The recurrence text.
     * @return The relation, named {@code T}.
     * @throws IllegalArgumentException if the text is not a recurrence in the supported form.
     */
    public static RecurrenceRelation parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Empty recurrence");
        }
        String compact = text.replaceAll("\\s+", "").replace("·", "*");
        int equals = compact.indexOf('=');
        String rhs = equals >= 0 ? compact.substring(equals + 1) : compact;
        if (rhs.isEmpty()) {
            throw new IllegalArgumentException("Missing right-hand side in: " + text);
        }

        Map<SizeTransform, Integer> grouped = new LinkedHashMap<>();
        GrowthRate cost = null;
        int splits = 0;
        for (String part : splitTopLevel(rhs)) {
            Matcher term = TERM.matcher(part);
            if (term.matches()) {
                int coefficient = term.group(1) == null ? 1 : Integer.parseInt(term.group(1));
                SizeTransform transform = transformOf(term.group(2));
                if (transform instanceof SizeTransform.Split) {
                    transform = new SizeTransform.Split(splits++ % 2 == 0);
                }
                grouped.merge(transform, coefficient, Integer::sum);
            } else {
                GrowthRate partCost = costOf(part);
                cost = cost == null ? partCost : cost.max(partCost);
            }
        }
        if (grouped.isEmpty()) {
            throw new IllegalArgumentException("No recursive term T(...) in: " + text);
        }
        if (cost == null) {
            cost = GrowthRate.CONSTANT;
        }
        List<RecursiveTerm> terms = grouped.entrySet().stream()
                .map(e -> new RecursiveTerm(e.getValue(), e.getKey()))
                .collect(Collectors.toList());
        String equation = RecurrenceRelation.equationOf(terms, cost);
        return new RecurrenceRelation("T", equation, "T(1) = 1 (assumed)",
                "Parsed from \"" + text.trim() + "\"", List.of(), terms, cost, false);
    }

    private static List<String> splitTopLevel(String rhs) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < rhs.length(); i++) {
            char c = rhs.charAt(i);
            if (c == '(') depth++;
            if (c == ')') depth--;
            if (c == '+' && depth == 0) {
                parts.add(rhs.substring(start, i));
                start = i + 1;
            }
        }
        parts.add(rhs.substring(start));
        for (String part : parts) {
            if (part.isEmpty()) {
                throw new IllegalArgumentException("Empty term in: " + rhs);
            }
        }
        return parts;
    }

    private static SizeTransform transformOf(String argument) {
        String arg = argument.toLowerCase(Locale.ROOT);
        Matcher subtract = SUBTRACT.matcher(arg);
        if (subtract.matches()) {
            return new SizeTransform.Subtract(Integer.parseInt(subtract.group(1)));
        }
        Matcher divide = DIVIDE.matcher(arg);
        if (divide.matches()) {
            double divisor = Double.parseDouble(divide.group(1));
            if (divisor <= 1) {
                throw new IllegalArgumentException("Divisor must be greater than 1: " + argument);
            }
            return new SizeTransform.Divide(divisor);
        }
        if ("k".equals(arg) || "n-k-1".equals(arg) || "n-k".equals(arg)) {
            return new SizeTransform.Split(true);
        }
        return new SizeTransform.Unknown(argument);
    }

    static GrowthRate costOf(String part) {
        String cost = part;
        Matcher wrapped = WRAPPED.matcher(cost);
        if (wrapped.matches()) {
            cost = wrapped.group(1);
        }
        cost = cost.toLowerCase(Locale.ROOT);
        if (cost.equals("1") || cost.equals("c") || cost.matches("\\d+(\\.\\d+)?")) {
            return GrowthRate.CONSTANT;
        }
        // A leading constant factor, as in 3n or c*n, does not change the growth.
        cost = cost.replaceFirst("^(?:\\d+(?:\\.\\d+)?|c)\\*?(?=[nl])", "");
        Matcher matcher = COST.matcher(cost);
        if (!matcher.matches() || cost.isEmpty()) {
            throw new IllegalArgumentException("Unsupported cost term: " + part);
        }
        double base = matcher.group(1) == null ? 1 : Double.parseDouble(matcher.group(1));
        boolean hasN = cost.matches("^(?:\\d+(?:\\.\\d+)?\\^n)?\\*?n.*");
        double degree = hasN ? (matcher.group(2) == null ? 1 : Double.parseDouble(matcher.group(2))) : 0;
        boolean hasLog = cost.contains("log") || cost.contains("lg");
        int logPower = hasLog ? (matcher.group(3) == null ? 1 : Integer.parseInt(matcher.group(3))) : 0;
        return new GrowthRate(degree, logPower, base);
    }
}
