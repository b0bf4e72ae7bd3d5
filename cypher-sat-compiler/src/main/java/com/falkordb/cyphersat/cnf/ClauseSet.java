package com.falkordb.cyphersat.cnf;

import com.falkordb.cyphersat.constraint.AtomicProposition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * A normalized constraint set flattened into SAT input: signed 1-based
 * literals per clause, plus the id maps in both directions.
 *
 * @param clauses one list of signed literals per clause
 * @param forward atom to id
 * @param reverse id to atom, the exact inverse of {@code forward}
 */
public record ClauseSet(List<List<Integer>> clauses,
                        Map<AtomicProposition, Integer> forward,
                        Map<Integer, AtomicProposition> reverse) {

    /** Takes immutable copies. */
    public ClauseSet {
        List<List<Integer>> copy = new ArrayList<>(clauses.size());
        for (List<Integer> clause : clauses) {
            copy.add(List.copyOf(clause));
        }
        clauses = Collections.unmodifiableList(copy);
        forward = Collections.unmodifiableMap(forward);
        reverse = Collections.unmodifiableMap(reverse);
    }

    /**
     * @return number of distinct atoms, the highest literal id
     */
    public int variableCount() {
        return forward.size();
    }

    /**
     * @return number of clauses
     */
    public int clauseCount() {
        return clauses.size();
    }

    /**
     * Atoms set true by a model: the reverse mapping of its positive
     * literals. Literals outside the id range are ignored.
     *
     * @param model signed literals as returned by a SAT solver
     * @return true atoms in model order
     */
    public List<AtomicProposition> trueAtoms(final List<Integer> model) {
        List<AtomicProposition> atoms = new ArrayList<>();
        for (int literal : model) {
            if (literal > 0) {
                AtomicProposition atom = reverse.get(literal);
                if (atom != null) {
                    atoms.add(atom);
                }
            }
        }
        return atoms;
    }

    /**
     * DIMACS CNF text.
     *
     * <pre>
     * c comment
     * p cnf &lt;variables&gt; &lt;clauses&gt;
     * 1 2 0
     * -1 -2 0
     * </pre>
     *
     * @param comment single-line comment; line breaks are replaced by spaces
     * @return the DIMACS document, newline terminated
     */
    public String toDimacs(final String comment) {
        StringBuilder dimacs = new StringBuilder();
        String oneLine = comment == null ? "" : comment.replaceAll("[\\r\\n]+", " ");
        dimacs.append("c ").append(oneLine).append('\n');
        dimacs.append("p cnf ").append(variableCount()).append(' ')
            .append(clauseCount()).append('\n');
        for (List<Integer> clause : clauses) {
            for (Integer literal : clause) {
                dimacs.append(literal).append(' ');
            }
            dimacs.append("0\n");
        }
        return dimacs.toString();
    }
}
