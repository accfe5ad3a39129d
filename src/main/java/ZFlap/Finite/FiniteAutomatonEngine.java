package ZFlap.Finite;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import ZFlap.Model.Outcome;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.impl.CompactNFA;

/**
 * Breadth-first simulation of a {@link TransitionRelation}: reachability, acceptance and
 * bounded enumeration of accepted words. All methods are pure functions of their arguments.
 */
public final class FiniteAutomatonEngine {
    public static boolean DEBUG = false;
    private static final int NO_CYCLE_LIMIT = 0;

    private FiniteAutomatonEngine() {
    }

    /**
     * States reachable after consuming the whole input.
     * Explores (state, position) pairs layer by layer; each pair is visited at most once.
     * @param relation - transition relation
     * @param initial - initial state
     * @param input - input word
     * @return reached states; empty iff no path consumes the input
     */
    public static Set<String> reachableStates(TransitionRelation relation, String initial, String input) {
        Objects.requireNonNull(relation, "relation");
        Objects.requireNonNull(initial, "initial state");
        Objects.requireNonNull(input, "input");

        final Set<String> reached = new LinkedHashSet<>();
        final Set<Position> visited = new HashSet<>();
        final Deque<Position> queue = new ArrayDeque<>();

        Position start = new Position(initial, 0);
        queue.add(start);
        visited.add(start);

        while (!queue.isEmpty()) {
            Position curr = queue.poll();
            if (curr.index() == input.length()) {
                reached.add(curr.state());
                continue;
            }
            char symbol = input.charAt(curr.index());
            for (String next : relation.getNextStates(curr.state(), symbol)) {
                Position succ = new Position(next, curr.index() + 1);
                if (visited.add(succ)) {
                    queue.add(succ);
                }
            }
        }
        return reached;
    }

    public static boolean isAccepted(TransitionRelation relation, String initial, Set<String> finals, String input) {
        return evaluate(relation, initial, finals, input).isAccepted();
    }

    /**
     * Run the input and report why it was accepted or rejected.
     */
    public static Evaluation evaluate(TransitionRelation relation, String initial, Set<String> finals, String input) {
        Objects.requireNonNull(finals, "final states");
        final Set<String> reached = reachableStates(relation, initial, input);
        final Outcome outcome;
        if (reached.isEmpty()) {
            outcome = Outcome.NO_TRANSITION;
        } else if (reached.stream().anyMatch(finals::contains)) {
            outcome = Outcome.ACCEPTED_AT_FINAL;
        } else {
            outcome = Outcome.EXHAUSTED_INPUT;
        }
        return new Evaluation(reached, outcome);
    }

    /**
     * All accepted words of length at most maxLength, in breadth-first order.
     * Duplicate entries in the relation may yield the same word more than once.
     */
    public static List<String> generateAccepted(TransitionRelation relation, String initial, Set<String> finals,
                                                Collection<Character> alphabet, int maxLength) {
        return generate(relation, initial, finals, alphabet, maxLength, NO_CYCLE_LIMIT);
    }

    /**
     * Like {@link #generateAccepted(TransitionRelation, String, Set, Collection, int)}, but a branch
     * may enter each state at most cycleLimit times (the initial state counts once at the start).
     * Keeps enumeration of cyclic automata small.
     */
    public static List<String> generateAccepted(TransitionRelation relation, String initial, Set<String> finals,
                                                Collection<Character> alphabet, int maxLength, int cycleLimit) {
        if (cycleLimit < 1) {
            throw new IllegalArgumentException("cycle limit must be at least 1: " + cycleLimit);
        }
        return generate(relation, initial, finals, alphabet, maxLength, cycleLimit);
    }

    private static List<String> generate(TransitionRelation relation, String initial, Set<String> finals,
                                         Collection<Character> alphabet, int maxLength, int cycleLimit) {
        Objects.requireNonNull(relation, "relation");
        Objects.requireNonNull(initial, "initial state");
        Objects.requireNonNull(finals, "final states");
        Objects.requireNonNull(alphabet, "alphabet");
        if (maxLength < 0) {
            throw new IllegalArgumentException("max length must not be negative: " + maxLength);
        }
        final boolean limited = cycleLimit != NO_CYCLE_LIMIT;

        final List<String> accepted = new ArrayList<>();
        final Deque<Exploration> queue = new ArrayDeque<>();

        if (finals.contains(initial)) {
            accepted.add("");
        }

        Object2IntMap<String> initVisits = null;
        if (limited) {
            initVisits = new Object2IntOpenHashMap<>();
            initVisits.put(initial, 1);
        }
        queue.add(new Exploration(initial, "", initVisits));

        long expanded = 0;
        long pruned = 0;
        while (!queue.isEmpty()) {
            Exploration curr = queue.poll();
            if (curr.word().length() >= maxLength) {
                continue;
            }
            expanded++;

            for (char symbol : alphabet) {
                for (String next : relation.getNextStates(curr.state(), symbol)) {
                    Object2IntMap<String> visits = null;
                    if (limited) {
                        // each branch owns its counts
                        visits = new Object2IntOpenHashMap<>(curr.visits());
                        int count = visits.getInt(next) + 1;
                        if (count > cycleLimit) {
                            pruned++;
                            continue;
                        }
                        visits.put(next, count);
                    }

                    String word = curr.word() + symbol;
                    if (finals.contains(next)) {
                        accepted.add(word);
                    }
                    if (word.length() < maxLength) {
                        queue.add(new Exploration(next, word, visits));
                    }
                }
            }
        }

        if (DEBUG) {
            System.out.println("DEBUG: generation expanded " + expanded + " prefixes, pruned " + pruned
                + " branches, found " + accepted.size() + " words");
        }
        return accepted;
    }

    /**
     * Export the relation as an AutomataLib NFA over the given alphabet.
     * Transitions on symbols outside the alphabet are dropped. The initial state gets index 0.
     */
    public static CompactNFA<Character> toCompactNFA(TransitionRelation relation, String initial, Set<String> finals,
                                                     Alphabet<Character> alphabet) {
        Objects.requireNonNull(initial, "initial state");
        final CompactNFA<Character> nfa = new CompactNFA<>(alphabet);
        final Object2IntMap<String> ids = new Object2IntOpenHashMap<>();
        ids.defaultReturnValue(-1);

        ids.put(initial, (int) nfa.addInitialState(finals.contains(initial)));
        for (String state : relation.states()) {
            if (ids.getInt(state) < 0) {
                ids.put(state, (int) nfa.addState(finals.contains(state)));
            }
        }

        relation.forEach((from, symbol, to) -> {
            if (alphabet.contains(symbol)) {
                // the int overload takes a symbol index, not the char
                nfa.addTransition(ids.getInt(from), alphabet.getSymbolIndex(symbol), ids.getInt(to));
            }
        });
        return nfa;
    }

    /**
     * Reached states of a run, with the reason for acceptance or rejection.
     */
    public record Evaluation(Set<String> reachedStates, Outcome outcome) {
        public boolean isAccepted() {
            return outcome.isAccepted();
        }
    }

    private record Position(String state, int index) { }

    private record Exploration(String state, String word, Object2IntMap<String> visits) { }
}
