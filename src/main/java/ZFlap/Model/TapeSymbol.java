package ZFlap.Model;

/**
 * Content of a Turing machine tape cell: a character or the blank.
 */
public record TapeSymbol(char value, boolean isBlank) {
    public static final TapeSymbol BLANK = new TapeSymbol('\0', true);

    public TapeSymbol {
        // every blank is the same value
        if (isBlank) {
            value = '\0';
        }
    }

    public static TapeSymbol of(char value) {
        return new TapeSymbol(value, false);
    }

    /**
     * Map the machine's blank character onto {@link #BLANK}, so that a literal blank
     * and the sentinel are interchangeable.
     * @param blankChar - the machine's blank character
     * @return normalized symbol
     */
    public TapeSymbol normalize(char blankChar) {
        return !isBlank && value == blankChar ? BLANK : this;
    }

    /**
     * Render with the given blank character.
     */
    public char render(char blankChar) {
        return isBlank ? blankChar : value;
    }

    @Override
    public String toString() {
        return isBlank ? "BLANK" : String.valueOf(value);
    }
}
