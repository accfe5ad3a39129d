package ZFlap.Model;

/**
 * Input or stack symbol of a pushdown automaton: either a concrete character or epsilon.
 * Epsilon is its own value, so the NUL character stays an ordinary symbol.
 */
public record Symbol(char value, boolean isEpsilon) {
    public static final Symbol EPSILON = new Symbol('\0', true);
    public static final String EPSILON_LABEL = "ε";

    public Symbol {
        if (isEpsilon) {
            value = '\0';
        }
    }

    public static Symbol of(char value) {
        return new Symbol(value, false);
    }

    /**
     * Does this symbol match the given character? Epsilon matches nothing here;
     * callers decide what epsilon means for them.
     */
    public boolean matches(char c) {
        return !isEpsilon && value == c;
    }

    @Override
    public String toString() {
        return isEpsilon ? EPSILON_LABEL : String.valueOf(value);
    }
}
