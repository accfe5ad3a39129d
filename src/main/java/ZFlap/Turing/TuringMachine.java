package ZFlap.Turing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import ZFlap.Model.BacktrackingSearch;
import ZFlap.Model.SearchResult;
import ZFlap.Model.TapeSymbol;

/**
 * Turing machine, possibly non-deterministic, accepting as soon as a final state is entered.
 * Neither halting nor consuming the tape is required. A configuration without a matching
 * transition is a failed branch, not a halt.
 */
public class TuringMachine {
    public static final int DEFAULT_MAX_STEPS = 100000;

    private final String initialState;
    private final char blankSymbol;
    private final List<TMTransition> transitions = new ArrayList<>();
    private final Set<String> finalStates = new LinkedHashSet<>();

    public TuringMachine(String initialState, char blankSymbol) {
        this.initialState = Objects.requireNonNull(initialState, "initial state");
        this.blankSymbol = blankSymbol;
    }

    /**
     * Add a transition. A literal blank character in it is treated as {@link TapeSymbol#BLANK}.
     */
    public void addTransition(TMTransition transition) {
        transitions.add(Objects.requireNonNull(transition, "transition").normalize(blankSymbol));
    }

    public void addFinalState(String state) {
        finalStates.add(Objects.requireNonNull(state, "final state"));
    }

    public void clear() {
        transitions.clear();
        finalStates.clear();
    }

    public SearchResult<TMStep> accepts(String input) {
        return accepts(input, DEFAULT_MAX_STEPS);
    }

    /**
     * Search for a run reaching a final state.
     * @param input - initial tape contents
     * @param maxSteps - maximum number of configurations to visit
     * @return result with the first accepting path found, or the rejection reason
     */
    public SearchResult<TMStep> accepts(String input, int maxSteps) {
        Objects.requireNonNull(input, "input");
        return new Search().search(new TMConfiguration(initialState, Tape.of(input, blankSymbol)), maxSteps);
    }

    public String getInitialState() {
        return initialState;
    }

    public char getBlankSymbol() {
        return blankSymbol;
    }

    public List<TMTransition> getTransitions() {
        return Collections.unmodifiableList(transitions);
    }

    public Set<String> getFinalStates() {
        return Collections.unmodifiableSet(finalStates);
    }

    // The tape of a configuration is never written once the configuration exists.
    private record TMConfiguration(String state, Tape tape) { }

    private final class Search extends BacktrackingSearch<TMConfiguration, TMTransition, TMStep> {

        @Override
        protected List<TMTransition> getTransitions() {
            return transitions;
        }

        @Override
        protected boolean isAccepting(TMConfiguration configuration) {
            return finalStates.contains(configuration.state());
        }

        @Override
        protected Successor<TMConfiguration, TMStep> apply(TMConfiguration configuration, TMTransition t) {
            if (!t.fromState().equals(configuration.state())) {
                return null;
            }
            TapeSymbol read = configuration.tape().read();
            if (!t.read().equals(read)) {
                return null;
            }

            Tape tape = configuration.tape().copy();
            tape.write(t.write());
            tape.move(t.move());

            TMStep step = new TMStep(configuration.state(), t.toState(), read, t.write(), t.move(),
                tape.render(), tape.getHead());
            return new Successor<>(new TMConfiguration(t.toState(), tape), step);
        }

        @Override
        protected String getLabel() {
            return "TM";
        }
    }
}
