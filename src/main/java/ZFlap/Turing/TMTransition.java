package ZFlap.Turing;

import java.util.Objects;

import ZFlap.Model.MoveDirection;
import ZFlap.Model.TapeSymbol;

/**
 * (fromState, read) -> (toState, write, move).
 */
public record TMTransition(String fromState, TapeSymbol read, String toState, TapeSymbol write,
                           MoveDirection move) {

    public TMTransition {
        Objects.requireNonNull(fromState, "fromState");
        Objects.requireNonNull(read, "read");
        Objects.requireNonNull(toState, "toState");
        Objects.requireNonNull(write, "write");
        Objects.requireNonNull(move, "move");
    }

    TMTransition normalize(char blankChar) {
        return new TMTransition(fromState, read.normalize(blankChar), toState, write.normalize(blankChar), move);
    }
}
