package com.changesentinel.core.detection;

/**
 * Decides which candidate last-changepoints the optimal-partitioning recursion
 * keeps for later steps.
 *
 * <p>
 * After Q[t] is computed, each candidate &tau; evaluated at step t is offered
 * with its value Q[&tau;] + cost(&tau;+1, t) (without penalty). Returning
 * {@code false} removes &tau; from all later minimisations.
 * </p>
 *
 * @since 1.0.0
 */
public interface PruningStrategy {

    /**
     * @param candidateValue Q[&tau;] + cost(&tau;+1, t)
     * @param optimum        Q[t], the penalized optimum at step t
     * @return {@code true} to keep the candidate
     */
    boolean keep(double candidateValue, double optimum);

    /**
     * @return a strategy that keeps every candidate (plain O(n²) recursion)
     */
    static PruningStrategy none() {
        return Named.NONE;
    }

    /**
     * PELT rule with K = 0: drop &tau; once Q[&tau;] + cost(&tau;+1, t) &gt; Q[t].
     * Exact whenever splitting a segment never raises its total cost, which
     * holds for every maximum-likelihood cost here.
     *
     * @return the PELT strategy
     */
    static PruningStrategy pelt() {
        return Named.PELT;
    }

    enum Named implements PruningStrategy {
        NONE {
            @Override
            public boolean keep(double candidateValue, double optimum) {
                return true;
            }
        },
        PELT {
            @Override
            public boolean keep(double candidateValue, double optimum) {
                return candidateValue <= optimum;
            }
        }
    }
}
