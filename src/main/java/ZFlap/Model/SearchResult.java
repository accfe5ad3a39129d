package ZFlap.Model;

import java.util.List;
import java.util.Optional;

/**
 * Result of one acceptance search.
 * @param outcome - termination condition that ended the search
 * @param path - steps from the initial configuration to the accepting one; empty unless accepted
 * @param configurationsVisited - configurations entered, counted against the step budget
 * @param <S> - step record type
 */
public record SearchResult<S>(Outcome outcome, List<S> path, long configurationsVisited) {

    public SearchResult {
        path = List.copyOf(path);
    }

    public boolean isAccepted() {
        return outcome.isAccepted();
    }

    /**
     * Step at index i of the accepting path, for step-by-step playback.
     * @param i - step index
     * @return the step, or empty if i is out of range
     */
    public Optional<S> getStep(int i) {
        if (i < 0 || i >= path.size()) {
            return Optional.empty();
        }
        return Optional.of(path.get(i));
    }
}
