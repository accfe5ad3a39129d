package ZFlap.IO;

import net.automatalib.alphabet.Alphabet;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

class AlphabetParserTest {
  @Test
  void testValidAlphabets() {
    Assertions.assertEquals(List.of('a'), AlphabetParser.parseSymbols("(a)"));
    Assertions.assertEquals(List.of('a', 'b', 'c'), AlphabetParser.parseSymbols("(a,b,c)"));
    Assertions.assertEquals(List.of('a', '1', '@', 'z'), AlphabetParser.parseSymbols("(a,1,@,z)"));
    Assertions.assertEquals(List.of('[', ']'), AlphabetParser.parseSymbols("([,])"));
    Assertions.assertEquals(List.of(';', '.', '-'), AlphabetParser.parseSymbols("(;,.,-)"));
    Assertions.assertEquals(10, AlphabetParser.parseSymbols("(a,b,c,d,e,f,g,h,i,j)").size());
  }

  @Test
  void testSpaceIsASymbol() {
    Assertions.assertEquals(List.of(' '), AlphabetParser.parseSymbols("( )"));
    Assertions.assertEquals(List.of('a', ' ', 'b'), AlphabetParser.parseSymbols("(a, ,b)"));
    // " b" is two characters
    assertRejected("(a, b)", AlphabetParser.NOT_SINGLE_CHARACTER);
  }

  @Test
  void testAutomataLibAlphabet() {
    Alphabet<Character> alphabet = AlphabetParser.parse("(x,y)");
    Assertions.assertEquals(2, alphabet.size());
    Assertions.assertEquals('y', alphabet.getSymbol(1));
    Assertions.assertEquals(0, alphabet.getSymbolIndex('x'));
  }

  @Test
  void testParentheses() {
    assertRejected("a,b,c)", AlphabetParser.NOT_ENCLOSED);
    assertRejected("(a,b,c", AlphabetParser.NOT_ENCLOSED);
    assertRejected("a,b,c", AlphabetParser.NOT_ENCLOSED);
    assertRejected("", AlphabetParser.NOT_ENCLOSED);
    assertRejected("(", AlphabetParser.NOT_ENCLOSED);
    assertRejected(null, AlphabetParser.NOT_ENCLOSED);
  }

  @Test
  void testEmpty() {
    assertRejected("()", AlphabetParser.EMPTY_ALPHABET);
  }

  @Test
  void testMultiCharacterSymbols() {
    assertRejected("(ab,c)", AlphabetParser.NOT_SINGLE_CHARACTER);
    assertRejected("(a,bc,d)", AlphabetParser.NOT_SINGLE_CHARACTER);
    assertRejected("(hello)", AlphabetParser.NOT_SINGLE_CHARACTER);
    assertRejected("(a,,b)", AlphabetParser.NOT_SINGLE_CHARACTER);
  }

  @Test
  void testDuplicates() {
    assertRejected("(a,b,a)", AlphabetParser.DUPLICATE_SYMBOL);
    assertRejected("(a,a,a)", AlphabetParser.DUPLICATE_SYMBOL);
    assertRejected("(0,1,2,1)", AlphabetParser.DUPLICATE_SYMBOL);
  }

  @Test
  void testFormat() {
    Assertions.assertEquals("(a,b,c)", AlphabetParser.format(List.of('a', 'b', 'c')));
    Assertions.assertEquals(List.of('0', ' '), AlphabetParser.parseSymbols(AlphabetParser.format(List.of('0', ' '))));
  }

  private static void assertRejected(String text, String message) {
    IllegalArgumentException e = Assertions.assertThrows(IllegalArgumentException.class,
        () -> AlphabetParser.parseSymbols(text));
    Assertions.assertEquals(message, e.getMessage());
  }
}
