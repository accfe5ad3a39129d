package ZFlap.Pushdown;

import java.util.Objects;

import ZFlap.Model.Symbol;

/**
 * (from, input, pop) -> (to, push).
 * @param from - source state
 * @param input - input symbol to consume, or epsilon to consume nothing
 * @param pop - symbol that must be on top of the stack and is removed, or epsilon to leave the stack alone
 * @param to - destination state
 * @param push - pushed left to right: the first character ends deepest, the last on top. "" pushes nothing
 */
public record PDATransition(String from, Symbol input, Symbol pop, String to, String push) {

    public PDATransition {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(pop, "pop");
        Objects.requireNonNull(to, "to");
        Objects.requireNonNull(push, "push");
    }

    @Override
    public String toString() {
        return from + " --" + input + "," + pop + "/" + (push.isEmpty() ? Symbol.EPSILON_LABEL : push) + "--> " + to;
    }
}
