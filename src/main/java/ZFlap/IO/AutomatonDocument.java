package ZFlap.IO;

import java.util.List;
import java.util.Objects;

import ZFlap.Finite.FiniteAutomaton;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;

/**
 * Contents of an automaton file: what the editor persists, layout included.
 */
public record AutomatonDocument(String name, List<Character> alphabet, List<StateEntry> states,
                                List<TransitionEntry> transitions) {

    public AutomatonDocument {
        Objects.requireNonNull(name, "name");
        alphabet = List.copyOf(alphabet);
        states = List.copyOf(states);
        transitions = List.copyOf(transitions);
    }

    public Alphabet<Character> getInputAlphabet() {
        return Alphabets.fromCollection(alphabet);
    }

    /**
     * Rebuild the engine model. Transition order follows the file.
     * @throws IllegalStateException if no state is marked initial
     */
    public FiniteAutomaton toFiniteAutomaton() {
        String initial = null;
        for (StateEntry state : states) {
            if (state.initial()) {
                initial = state.name();
                break;
            }
        }
        if (initial == null) {
            throw new IllegalStateException("automaton '" + name + "' has no initial state");
        }

        FiniteAutomaton automaton = new FiniteAutomaton(getInputAlphabet(), initial);
        for (StateEntry state : states) {
            if (state.accepting()) {
                automaton.addFinalState(state.name());
            }
        }
        for (TransitionEntry t : transitions) {
            automaton.getRelation().addTransitions(t.from(), t.symbols(), t.to());
        }
        return automaton;
    }

    public record StateEntry(String name, double x, double y, boolean initial, boolean accepting) { }

    public record TransitionEntry(String from, String to, List<Character> symbols) {
        public TransitionEntry {
            symbols = List.copyOf(symbols);
        }
    }
}
