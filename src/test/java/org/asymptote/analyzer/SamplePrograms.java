package org.asymptote.analyzer;

import org.asymptote.analyzer.api.AnalysisException;
import org.asymptote.analyzer.diagnostics.DiagnosticsEngine;
import org.asymptote.analyzer.frontend.lexer.Lexer;
import org.asymptote.analyzer.frontend.parser.Parser;
import org.asymptote.analyzer.frontend.parser.ast.Program;

/**
 * Classic algorithms in pseudocode, shared by the analysis tests.
 */
public final class SamplePrograms {

    public static final String LINEAR_SEARCH = String.join("\n",
            "begin",
            "  for i <- 1 to n do",
            "    if A[i] = x then",
            "      return i",
            "    end",
            "  end",
            "  return -1",
            "end");

    public static final String BUBBLE_SORT = String.join("\n",
            "begin",
            "  for i <- 1 to n - 1 do",
            "    for j <- 1 to n - i do",
            "      if A[j] > A[j + 1] then",
            "        swap A[j] with A[j + 1]",
            "      end",
            "    end",
            "  end",
            "end");

    public static final String BUBBLE_SORT_EARLY_EXIT = String.join("\n",
            "begin",
            "  for i <- 1 to n - 1 do",
            "    swapped <- false",
            "    for j <- 1 to n - i do",
            "      if A[j] > A[j + 1] then",
            "        swap A[j] with A[j + 1]",
            "        swapped <- true",
            "      end",
            "    end",
            "    if not swapped then",
            "      return",
            "    end",
            "  end",
            "end");

    public static final String BINARY_SEARCH = String.join("\n",
            "begin",
            "  low <- 1",
            "  high <- n",
            "  found <- false",
            "  while low <= high and not found do",
            "    mid <- (low + high) div 2",
            "    if A[mid] = x then",
            "      found <- true",
            "    else if A[mid] < x then",
            "      low <- mid + 1",
            "    else",
            "      high <- mid - 1",
            "    end",
            "  end",
            "end");

    public static final String POINTER_CHASE = String.join("\n",
            "begin",
            "  i <- 1",
            "  while i <= n do",
            "    i <- A[i]",
            "  end",
            "end");

    public static final String FACTORIAL = String.join("\n",
            "procedure fact(n)",
            "  if n <= 1 then",
            "    return 1",
            "  end",
            "  return n * fact(n - 1)",
            "end");

    public static final String RECURSIVE_BINARY_SEARCH = String.join("\n",
            "procedure bsearch(A, low, high, x)",
            "  if low > high then",
            "    return -1",
            "  end",
            "  mid <- (low + high) div 2",
            "  if A[mid] = x then",
            "    return mid",
            "  else if A[mid] < x then",
            "    return bsearch(A, mid + 1, high, x)",
            "  else",
            "    return bsearch(A, low, mid - 1, x)",
            "  end",
            "end");

    public static final String MERGE_SORT = String.join("\n",
            "procedure mergesort(A, p, r)",
            "  if p < r then",
            "    q <- (p + r) div 2",
            "    mergesort(A, p, q)",
            "    mergesort(A, q + 1, r)",
            "    merge(A, p, q, r)",
            "  end",
            "end",
            "",
            "procedure merge(A, p, q, r)",
            "  for k <- p to r do",
            "    A[k] <- B[k]",
            "  end",
            "end");

    public static final String QUICK_SORT = String.join("\n",
            "procedure quicksort(A, p, r)",
            "  if p < r then",
            "    q <- partition(A, p, r)",
            "    quicksort(A, p, q - 1)",
            "    quicksort(A, q + 1, r)",
            "  end",
            "end",
            "",
            "procedure partition(A, p, r)",
            "  x <- A[r]",
            "  i <- p - 1",
            "  for j <- p to r - 1 do",
            "    if A[j] <= x then",
            "      i <- i + 1",
            "      swap A[i] with A[j]",
            "    end",
            "  end",
            "  swap A[i + 1] with A[r]",
            "  return i + 1",
            "end");

    /** Seven half-size subproblems, issued from a loop with constant bounds, and quadratic combining work. */
    public static final String STRASSEN = String.join("\n",
            "procedure strassen(n)",
            "  if n <= 1 then",
            "    return 1",
            "  end",
            "  for t <- 1 to 7 do",
            "    strassen(n / 2)",
            "  end",
            "  for i <- 1 to n do",
            "    for j <- 1 to n do",
            "      x <- i + j",
            "    end",
            "  end",
            "end");

    public static final String FIBONACCI = String.join("\n",
            "procedure fib(n)",
            "  if n <= 1 then",
            "    return n",
            "  end",
            "  return fib(n - 1) + fib(n - 2)",
            "end");

    public static final String MUTUAL_RECURSION = String.join("\n",
            "procedure isEven(n)",
            "  if n = 0 then return true end",
            "  return isOdd(n - 1)",
            "end",
            "procedure isOdd(n)",
            "  if n = 0 then return false end",
            "  return isEven(n - 1)",
            "end");

    private SamplePrograms() {
    }

    /**
     * @param source Pseudocode.
     * @return The parsed program.
     * @throws AnalysisException if the source does not parse.
     */
    public static Program parse(String source) throws AnalysisException {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        return new Parser(new Lexer(source, diagnostics).scanTokens(), diagnostics).parse();
    }
}
