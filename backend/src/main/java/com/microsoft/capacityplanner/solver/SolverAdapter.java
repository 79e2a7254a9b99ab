package com.microsoft.capacityplanner.solver;

import com.microsoft.capacityplanner.formulation.PlanningModel;

/**
 * Port interface to a mixed-integer linear solver.
 *
 * CONTRACT:
 * 1. Reads only the direction, objective, constraints and variable domains
 *    of the model; never mutates it
 * 2. Blocks until the solver finishes or the configured time limit expires
 * 3. Reports every solver-side problem (fault, timeout, unavailable backend)
 *    as {@link SolutionStatus#ERROR}; does not throw for them and does not retry
 * 4. Reports the objective expression evaluated on the returned assignment
 *
 * Any implementation satisfying this contract is interchangeable.
 */
public interface SolverAdapter {

    /**
     * Returns the solver this adapter drives.
     */
    SolverKind getKind();

    /**
     * Solve a planning model.
     *
     * @param model Model produced by the model builder
     * @return Solution with an explicit status
     */
    Solution solve(PlanningModel model);
}
