package ZFlap.Model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Exhaustive depth-first search with backtracking over machine configurations.
 * <p>
 * Transitions are tried in the order returned by {@link #getTransitions()}, so the first
 * accepting path discovered is the one reported. Every configuration entered costs one
 * unit of the step budget; once the budget is spent the search stops and rejects.
 * <p>
 * Depth is held in an explicit frame stack rather than on the call stack, so large budgets
 * cannot overflow the JVM stack.
 * @param <C> - configuration type; never mutated once created
 * @param <T> - transition type
 * @param <S> - step record type
 */
public abstract class BacktrackingSearch<C, T, S> {
    public static boolean DEBUG = false;
    private static final long CONFIGURATIONS_PERIOD = 10000L;

    /**
     * Transitions in registration order.
     */
    protected abstract List<T> getTransitions();

    protected abstract boolean isAccepting(C configuration);

    /**
     * Apply a transition to a configuration.
     * @param configuration - current configuration, left untouched
     * @param transition - candidate transition
     * @return the successor configuration and the step leading to it, or null if the transition doesn't apply
     */
    protected abstract Successor<C, S> apply(C configuration, T transition);

    /**
     * Whether a non-accepting configuration has consumed all of its input.
     * Only used to report why a search was rejected.
     */
    protected boolean isInputExhausted(C configuration) {
        return false;
    }

    protected abstract String getLabel();

    /**
     * Run the search.
     * @param initial - initial configuration
     * @param maxSteps - step budget; a budget of zero or less rejects immediately
     * @return search result, with the accepting path if one was found
     */
    public SearchResult<S> search(C initial, int maxSteps) {
        Objects.requireNonNull(initial, "initial configuration");
        final List<T> transitions = getTransitions();
        final Deque<Frame<C>> frames = new ArrayDeque<>();
        final List<S> path = new ArrayList<>();

        int remaining = maxSteps;
        long visited = 0;
        boolean inputExhausted = false;

        if (remaining-- <= 0) {
            return finish(Outcome.EXHAUSTED_STEPS, path, visited);
        }
        visited++;
        if (isAccepting(initial)) {
            return finish(Outcome.ACCEPTED_AT_FINAL, path, visited);
        }
        inputExhausted |= isInputExhausted(initial);
        frames.push(new Frame<>(initial));

        while (!frames.isEmpty()) {
            Frame<C> top = frames.peek();
            Successor<C, S> succ = null;
            while (succ == null && top.next < transitions.size()) {
                succ = apply(top.configuration, transitions.get(top.next++));
            }

            if (succ == null) {
                // dead end; backtrack over the step that led here
                frames.pop();
                if (!frames.isEmpty()) {
                    path.remove(path.size() - 1);
                }
                continue;
            }

            if (remaining-- <= 0) {
                return finish(Outcome.EXHAUSTED_STEPS, List.of(), visited);
            }
            visited++;
            path.add(succ.step());
            if (isAccepting(succ.configuration())) {
                return finish(Outcome.ACCEPTED_AT_FINAL, path, visited);
            }
            inputExhausted |= isInputExhausted(succ.configuration());
            frames.push(new Frame<>(succ.configuration()));

            if (DEBUG && visited % CONFIGURATIONS_PERIOD == 0) {
                System.out.println("DEBUG: " + getLabel() + " visited " + visited + " configurations - depth "
                    + path.size() + " - " + remaining + " steps left");
            }
        }

        return finish(inputExhausted ? Outcome.EXHAUSTED_INPUT : Outcome.NO_TRANSITION, List.of(), visited);
    }

    private SearchResult<S> finish(Outcome outcome, List<S> path, long visited) {
        if (DEBUG) {
            System.out.println("DEBUG: " + getLabel() + " " + outcome.describe() + " after " + visited
                + " configurations, path length " + path.size());
        }
        return new SearchResult<>(outcome, path, visited);
    }

    /**
     * A configuration reached by a transition, with the step record describing the move.
     */
    public record Successor<C, S>(C configuration, S step) { }

    private static final class Frame<C> {
        private final C configuration;
        private int next; // index of the next transition to try

        Frame(C configuration) {
            this.configuration = configuration;
        }
    }
}
