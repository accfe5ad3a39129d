package ZFlap.Pushdown;

import ZFlap.Model.Symbol;

/**
 * One move on an accepting path.
 * @param fromState - state before the move
 * @param toState - state after the move
 * @param consumed - input symbol read, or epsilon
 * @param popped - symbol removed from the stack, or epsilon if nothing was popped
 * @param pushed - string pushed, possibly empty
 * @param stackSnapshot - stack after the move, top first
 * @param inputIndex - input position after the move
 */
public record PDAStep(String fromState, String toState, Symbol consumed, Symbol popped, String pushed,
                      String stackSnapshot, int inputIndex) {

    @Override
    public String toString() {
        return fromState + " -> " + toState + " [read " + consumed + ", pop " + popped + ", push "
            + (pushed.isEmpty() ? Symbol.EPSILON_LABEL : pushed) + "] stack=" + stackSnapshot + " at " + inputIndex;
    }
}
