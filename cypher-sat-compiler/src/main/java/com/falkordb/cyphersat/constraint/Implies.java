package com.falkordb.cyphersat.constraint;

import java.util.List;
import java.util.Objects;

/**
 * Material implication {@code antecedent -> consequent}.
 *
 * @param antecedent the "if" side
 * @param consequent the "then" side
 */
public record Implies(Proposition antecedent, Proposition consequent)
        implements Proposition {

    /** Rejects missing operands. */
    public Implies {
        Objects.requireNonNull(antecedent, "Implies requires an antecedent");
        Objects.requireNonNull(consequent, "Implies requires a consequent");
    }

    @Override
    public List<Proposition> children() {
        return List.of(antecedent, consequent);
    }
}
