package ZFlap.IO;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;

/**
 * Parses alphabets written as "(a,b,c)": single-character symbols, comma separated, no duplicates.
 * A space is a valid symbol, so nothing is trimmed.
 */
public final class AlphabetParser {
    static final String NOT_ENCLOSED = "alphabet must be enclosed in parentheses";
    static final String NOT_SINGLE_CHARACTER = "each symbol must be a single character";
    static final String DUPLICATE_SYMBOL = "duplicate symbol in alphabet";
    static final String EMPTY_ALPHABET = "alphabet cannot be empty";

    private AlphabetParser() {
    }

    public static Alphabet<Character> parse(String text) {
        return Alphabets.fromCollection(parseSymbols(text));
    }

    /**
     * @return symbols in declaration order
     * @throws IllegalArgumentException if the text is not a well-formed alphabet
     */
    public static List<Character> parseSymbols(String text) {
        if (text == null || text.length() < 2 || text.charAt(0) != '(' || text.charAt(text.length() - 1) != ')') {
            throw new IllegalArgumentException(NOT_ENCLOSED);
        }
        final String content = text.substring(1, text.length() - 1);
        final List<Character> symbols = new ArrayList<>();
        final Set<Character> seen = new HashSet<>();

        int start = 0;
        while (start < content.length()) {
            int comma = content.indexOf(',', start);
            int end = comma < 0 ? content.length() : comma;
            String symbol = content.substring(start, end);
            if (symbol.length() != 1) {
                throw new IllegalArgumentException(NOT_SINGLE_CHARACTER);
            }
            if (!seen.add(symbol.charAt(0))) {
                throw new IllegalArgumentException(DUPLICATE_SYMBOL);
            }
            symbols.add(symbol.charAt(0));
            start = end + 1;
        }

        if (symbols.isEmpty()) {
            throw new IllegalArgumentException(EMPTY_ALPHABET);
        }
        return symbols;
    }

    /**
     * Inverse of {@link #parseSymbols(String)}.
     */
    public static String format(Iterable<Character> symbols) {
        StringBuilder sb = new StringBuilder("(");
        for (char c : symbols) {
            if (sb.length() > 1) {
                sb.append(',');
            }
            sb.append(c);
        }
        return sb.append(')').toString();
    }
}
