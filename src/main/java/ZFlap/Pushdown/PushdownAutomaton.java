package ZFlap.Pushdown;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import ZFlap.Model.BacktrackingSearch;
import ZFlap.Model.SearchResult;
import ZFlap.Model.Symbol;
import it.unimi.dsi.fastutil.chars.CharArrayList;

/**
 * Non-deterministic pushdown automaton accepting by final state once all input is consumed.
 * <p>
 * {@link #accepts(String, int)} explores configurations (state, input position, stack) depth-first,
 * trying transitions in the order they were added, and returns the first accepting path found.
 */
public class PushdownAutomaton {
    public static final int DEFAULT_MAX_STEPS = 100000;

    private final String initialState;
    private final char initialStackSymbol;
    private final List<PDATransition> transitions = new ArrayList<>();
    private final Set<String> finalStates = new LinkedHashSet<>();

    public PushdownAutomaton(String initialState, char initialStackSymbol) {
        this.initialState = Objects.requireNonNull(initialState, "initial state");
        this.initialStackSymbol = initialStackSymbol;
    }

    public void addTransition(PDATransition transition) {
        transitions.add(Objects.requireNonNull(transition, "transition"));
    }

    public void addFinalState(String state) {
        finalStates.add(Objects.requireNonNull(state, "final state"));
    }

    public void clear() {
        transitions.clear();
        finalStates.clear();
    }

    public SearchResult<PDAStep> accepts(String input) {
        return accepts(input, DEFAULT_MAX_STEPS);
    }

    /**
     * Search for an accepting run.
     * @param input - input word
     * @param maxSteps - maximum number of configurations to visit; bounds epsilon cycles
     * @return result with the first accepting path found, or the rejection reason
     */
    public SearchResult<PDAStep> accepts(String input, int maxSteps) {
        Objects.requireNonNull(input, "input");
        CharArrayList stack = new CharArrayList();
        stack.add(initialStackSymbol);
        return new Search(input).search(new PDAConfiguration(initialState, 0, stack), maxSteps);
    }

    public String getInitialState() {
        return initialState;
    }

    public char getInitialStackSymbol() {
        return initialStackSymbol;
    }

    public List<PDATransition> getTransitions() {
        return Collections.unmodifiableList(transitions);
    }

    public Set<String> getFinalStates() {
        return Collections.unmodifiableSet(finalStates);
    }

    private final class Search extends BacktrackingSearch<PDAConfiguration, PDATransition, PDAStep> {
        private final String input;

        Search(String input) {
            this.input = input;
        }

        @Override
        protected List<PDATransition> getTransitions() {
            return transitions;
        }

        @Override
        protected boolean isAccepting(PDAConfiguration configuration) {
            return isInputExhausted(configuration) && finalStates.contains(configuration.state());
        }

        @Override
        protected boolean isInputExhausted(PDAConfiguration configuration) {
            return configuration.inputIndex() == input.length();
        }

        @Override
        protected Successor<PDAConfiguration, PDAStep> apply(PDAConfiguration configuration, PDATransition t) {
            if (!t.from().equals(configuration.state())) {
                return null;
            }

            int index = configuration.inputIndex();
            if (!t.input().isEpsilon()) {
                if (index >= input.length() || !t.input().matches(input.charAt(index))) {
                    return null;
                }
                index++;
            }

            Symbol popped = Symbol.EPSILON;
            if (!t.pop().isEpsilon()) {
                if (!configuration.hasTop(t.pop().value())) {
                    return null;
                }
                popped = t.pop();
            }

            // copy so that sibling branches keep their own stack
            CharArrayList stack = new CharArrayList(configuration.stack());
            if (!popped.isEpsilon()) {
                stack.removeChar(stack.size() - 1);
            }
            String push = t.push();
            for (int i = 0; i < push.length(); i++) {
                stack.add(push.charAt(i));
            }

            PDAConfiguration next = new PDAConfiguration(t.to(), index, stack);
            PDAStep step = new PDAStep(configuration.state(), t.to(), t.input(), popped, push,
                next.renderStack(), index);
            return new Successor<>(next, step);
        }

        @Override
        protected String getLabel() {
            return "PDA";
        }
    }
}
