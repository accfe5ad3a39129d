package ZFlap.Finite;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Multi-valued transition function (state, symbol) -> [states] of a finite automaton.
 * Destinations keep insertion order per key and are not deduplicated.
 */
public class TransitionRelation {
    private final Map<TransitionKey, List<String>> delta = new LinkedHashMap<>();
    private int size;

    public void addTransition(String from, char symbol, String to) {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        delta.computeIfAbsent(new TransitionKey(from, symbol), k -> new ArrayList<>(2)).add(to);
        size++;
    }

    /**
     * Add one transition per symbol, e.g. for an edge labelled "a,b".
     */
    public void addTransitions(String from, Iterable<Character> symbols, String to) {
        for (char symbol : symbols) {
            addTransition(from, symbol, to);
        }
    }

    /**
     * @return destinations for (from, symbol) in insertion order; empty if there are none
     */
    public List<String> getNextStates(String from, char symbol) {
        List<String> next = delta.get(new TransitionKey(from, symbol));
        return next == null ? List.of() : Collections.unmodifiableList(next);
    }

    public void clear() {
        delta.clear();
        size = 0;
    }

    /**
     * @return number of stored transitions, duplicates included
     */
    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * States appearing as a source or destination, in first-seen order.
     */
    public Set<String> states() {
        Set<String> states = new LinkedHashSet<>();
        for (Map.Entry<TransitionKey, List<String>> e : delta.entrySet()) {
            states.add(e.getKey().state());
            states.addAll(e.getValue());
        }
        return states;
    }

    /**
     * Visit every transition in key order, then destination order.
     */
    void forEach(TransitionConsumer consumer) {
        for (Map.Entry<TransitionKey, List<String>> e : delta.entrySet()) {
            for (String to : e.getValue()) {
                consumer.accept(e.getKey().state(), e.getKey().symbol(), to);
            }
        }
    }

    @FunctionalInterface
    interface TransitionConsumer {
        void accept(String from, char symbol, String to);
    }

    private record TransitionKey(String state, char symbol) { }
}
