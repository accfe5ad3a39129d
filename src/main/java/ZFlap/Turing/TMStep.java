package ZFlap.Turing;

import ZFlap.Model.MoveDirection;
import ZFlap.Model.TapeSymbol;

/**
 * One move on an accepting path. The snapshot is taken after the move, head cell in brackets.
 */
public record TMStep(String fromState, String toState, TapeSymbol read, TapeSymbol written,
                     MoveDirection move, String tapeSnapshot, int headPosition) {

    @Override
    public String toString() {
        return fromState + " -> " + toState + " [" + read + "/" + written + "," + move + "] " + tapeSnapshot;
    }
}
