package com.falkordb.cyphersat.constraint;

import java.util.List;
import java.util.Objects;

/**
 * At most one disjunct of the wrapped disjunction holds.
 *
 * @param disjunction the candidates
 */
public record AtMostOne(Disjunction disjunction) implements Proposition {

    /** Rejects a missing disjunction. */
    public AtMostOne {
        Objects.requireNonNull(disjunction,
            "AtMostOne requires a disjunction of candidates");
    }

    @Override
    public List<Proposition> children() {
        return List.of(disjunction);
    }
}
