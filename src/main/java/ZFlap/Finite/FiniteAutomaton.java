package ZFlap.Finite;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.impl.CompactNFA;

/**
 * A finite automaton as assembled by an editor: alphabet, transition relation, initial and final states.
 * Queries delegate to {@link FiniteAutomatonEngine}.
 */
public class FiniteAutomaton {
    private final Alphabet<Character> alphabet;
    private final TransitionRelation relation;
    private final Set<String> finalStates = new LinkedHashSet<>();
    private String initialState;

    public FiniteAutomaton(Alphabet<Character> alphabet, String initialState) {
        this(alphabet, initialState, new TransitionRelation());
    }

    public FiniteAutomaton(Alphabet<Character> alphabet, String initialState, TransitionRelation relation) {
        this.alphabet = Objects.requireNonNull(alphabet, "alphabet");
        this.initialState = Objects.requireNonNull(initialState, "initial state");
        this.relation = Objects.requireNonNull(relation, "relation");
    }

    public void addTransition(String from, char symbol, String to) {
        relation.addTransition(from, symbol, to);
    }

    public void addFinalState(String state) {
        finalStates.add(Objects.requireNonNull(state));
    }

    public void setInitialState(String state) {
        this.initialState = Objects.requireNonNull(state, "initial state");
    }

    /**
     * Drop transitions and final states; alphabet and initial state stay.
     */
    public void clear() {
        relation.clear();
        finalStates.clear();
    }

    public boolean accepts(String input) {
        return FiniteAutomatonEngine.isAccepted(relation, initialState, finalStates, input);
    }

    public FiniteAutomatonEngine.Evaluation evaluate(String input) {
        return FiniteAutomatonEngine.evaluate(relation, initialState, finalStates, input);
    }

    public Set<String> reachableStates(String input) {
        return FiniteAutomatonEngine.reachableStates(relation, initialState, input);
    }

    public List<String> generateAccepted(int maxLength) {
        return FiniteAutomatonEngine.generateAccepted(relation, initialState, finalStates, alphabet, maxLength);
    }

    public List<String> generateAccepted(int maxLength, int cycleLimit) {
        return FiniteAutomatonEngine.generateAccepted(
            relation, initialState, finalStates, alphabet, maxLength, cycleLimit);
    }

    public CompactNFA<Character> toCompactNFA() {
        return FiniteAutomatonEngine.toCompactNFA(relation, initialState, finalStates, alphabet);
    }

    public Alphabet<Character> getAlphabet() {
        return alphabet;
    }

    public TransitionRelation getRelation() {
        return relation;
    }

    public String getInitialState() {
        return initialState;
    }

    public Set<String> getFinalStates() {
        return Collections.unmodifiableSet(finalStates);
    }
}
