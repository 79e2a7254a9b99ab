package com.microsoft.capacityplanner.solver;

/**
 * Outcome of a solver run.
 */
public enum SolutionStatus {
    /** An assignment with proven minimum objective was found. */
    OPTIMAL,
    /** No assignment satisfies every constraint. */
    INFEASIBLE,
    /** The objective has no finite minimum. */
    UNBOUNDED,
    /** The solver failed, timed out or was unavailable. */
    ERROR
}
