package com.falkordb.cyphersat.constraint;

import java.util.List;
import java.util.Objects;

/**
 * Exactly one disjunct of the wrapped disjunction holds. Over an empty
 * disjunction this is unsatisfiable, which is a legal value.
 *
 * @param disjunction the candidates
 */
public record ExactlyOne(Disjunction disjunction) implements Proposition {

    /** Rejects a missing disjunction. */
    public ExactlyOne {
        Objects.requireNonNull(disjunction,
            "ExactlyOne requires a disjunction of candidates");
    }

    @Override
    public List<Proposition> children() {
        return List.of(disjunction);
    }
}
