package ZFlap.Pushdown;

import it.unimi.dsi.fastutil.chars.CharArrayList;

/**
 * Instantaneous description of a pushdown automaton. The stack's top is its last element.
 * The stack is never modified after construction; successors work on a copy.
 */
record PDAConfiguration(String state, int inputIndex, CharArrayList stack) {

    boolean hasTop(char symbol) {
        return !stack.isEmpty() && stack.getChar(stack.size() - 1) == symbol;
    }

    /**
     * @return stack contents, top first
     */
    String renderStack() {
        StringBuilder sb = new StringBuilder(stack.size());
        for (int i = stack.size() - 1; i >= 0; i--) {
            sb.append(stack.getChar(i));
        }
        return sb.toString();
    }
}
