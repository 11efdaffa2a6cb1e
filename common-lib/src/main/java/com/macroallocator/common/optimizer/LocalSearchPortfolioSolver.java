package com.macroallocator.common.optimizer;

import com.macroallocator.common.model.PortfolioSelection;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * Approximate solver for candidate lists too large to enumerate.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Greedy forward build: start from the best single asset and keep adding the asset
 *       that improves the subset most, up to maxAssets.</li>
 *   <li>Best-improvement local search over the add / drop / swap neighborhood until no
 *       neighbor beats the incumbent.</li>
 *   <li>{@code restarts} further local searches from seeded random subsets; the best
 *       local optimum wins.</li>
 * </ol>
 *
 * <p>Deterministic for a given seed. Honours cancellation, ignores deadline expiry.
 */
public class LocalSearchPortfolioSolver implements PortfolioSolver {

    public static final long DEFAULT_SEED = 42L;
    public static final int DEFAULT_RESTARTS = 8;

    private static final int MAX_PASSES = 200;

    private final long seed;
    private final int restarts;

    public LocalSearchPortfolioSolver() {
        this(DEFAULT_SEED, DEFAULT_RESTARTS);
    }

    public LocalSearchPortfolioSolver(long seed, int restarts) {
        if (restarts < 0) {
            throw new IllegalArgumentException("restarts must not be negative: " + restarts);
        }
        this.seed = seed;
        this.restarts = restarts;
    }

    @Override
    public PortfolioSelection solve(OptimizationProblem problem, SolverDeadline deadline) {
        int n = problem.candidateCount();
        if (n == 0) {
            return PortfolioSelection.empty();
        }

        SubsetEvaluation best = improve(problem, greedy(problem, deadline), deadline);

        Random random = new Random(seed);
        for (int r = 0; r < restarts; r++) {
            deadline.checkCancelled();
            int[] start = randomSubset(random, n, 1 + random.nextInt(problem.maxAssets()));
            SubsetEvaluation local = improve(problem, problem.evaluate(start), deadline);
            if (SelectionOrdering.INSTANCE.isBetter(local, best)) {
                best = local;
            }
        }
        return problem.toSelection(best);
    }

    @Override
    public String name() {
        return "local-search";
    }

    // ── greedy forward build ───────────────────────────────────────────────

    private SubsetEvaluation greedy(OptimizationProblem problem, SolverDeadline deadline) {
        int n = problem.candidateCount();
        SubsetEvaluation current = null;
        List<Integer> members = new ArrayList<>();

        while (members.size() < problem.maxAssets()) {
            SubsetEvaluation bestStep = null;
            int bestIndex = -1;
            for (int j = 0; j < n; j++) {
                if (members.contains(j)) continue;
                deadline.checkCancelled();
                SubsetEvaluation candidate = problem.evaluate(with(members, j));
                if (SelectionOrdering.INSTANCE.isBetter(candidate, bestStep)) {
                    bestStep = candidate;
                    bestIndex = j;
                }
            }
            if (bestStep == null || !SelectionOrdering.INSTANCE.isBetter(bestStep, current)) {
                break;
            }
            current = bestStep;
            members.add(bestIndex);
        }
        return current;
    }

    // ── neighborhood search ────────────────────────────────────────────────

    private SubsetEvaluation improve(OptimizationProblem problem, SubsetEvaluation start, SolverDeadline deadline) {
        int n = problem.candidateCount();
        SubsetEvaluation current = start;

        for (int pass = 0; pass < MAX_PASSES; pass++) {
            int[] members = current.members();
            boolean[] inSet = new boolean[n];
            for (int m : members) inSet[m] = true;

            SubsetEvaluation bestNeighbor = null;

            if (members.length < problem.maxAssets()) {
                for (int j = 0; j < n; j++) {
                    if (inSet[j]) continue;
                    deadline.checkCancelled();
                    bestNeighbor = pick(problem.evaluate(append(members, j)), bestNeighbor);
                }
            }
            if (members.length > 1) {
                for (int i = 0; i < members.length; i++) {
                    deadline.checkCancelled();
                    bestNeighbor = pick(problem.evaluate(remove(members, i)), bestNeighbor);
                }
            }
            for (int i = 0; i < members.length; i++) {
                for (int j = 0; j < n; j++) {
                    if (inSet[j]) continue;
                    deadline.checkCancelled();
                    int[] swapped = members.clone();
                    swapped[i] = j;
                    bestNeighbor = pick(problem.evaluate(swapped), bestNeighbor);
                }
            }

            if (bestNeighbor == null || !SelectionOrdering.INSTANCE.isBetter(bestNeighbor, current)) {
                return current;
            }
            current = bestNeighbor;
        }
        return current;
    }

    // ── helpers ────────────────────────────────────────────────────────────

    private static SubsetEvaluation pick(SubsetEvaluation candidate, SubsetEvaluation incumbent) {
        return SelectionOrdering.INSTANCE.isBetter(candidate, incumbent) ? candidate : incumbent;
    }

    private static int[] with(List<Integer> members, int extra) {
        int[] out = new int[members.size() + 1];
        for (int i = 0; i < members.size(); i++) out[i] = members.get(i);
        out[members.size()] = extra;
        return out;
    }

    private static int[] append(int[] members, int extra) {
        int[] out = Arrays.copyOf(members, members.length + 1);
        out[members.length] = extra;
        return out;
    }

    private static int[] remove(int[] members, int position) {
        int[] out = new int[members.length - 1];
        for (int i = 0, o = 0; i < members.length; i++) {
            if (i != position) out[o++] = members[i];
        }
        return out;
    }

    private static int[] randomSubset(Random random, int n, int size) {
        int[] pool = new int[n];
        for (int i = 0; i < n; i++) pool[i] = i;
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(n - i);
            int tmp = pool[i];
            pool[i] = pool[j];
            pool[j] = tmp;
        }
        return Arrays.copyOf(pool, size);
    }
}
