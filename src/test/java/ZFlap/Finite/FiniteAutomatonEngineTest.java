package ZFlap.Finite;

import ZFlap.Model.Outcome;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

public class FiniteAutomatonEngineTest {
  private static final Set<String> FINAL_Q2 = Set.of("q2");

  // q0 -a-> q0, q0 -a-> q1, q1 -b-> q2
  private static TransitionRelation smallNFA() {
    TransitionRelation t = new TransitionRelation();
    t.addTransition("q0", 'a', "q0");
    t.addTransition("q0", 'a', "q1");
    t.addTransition("q1", 'b', "q2");
    return t;
  }

  // S -0-> S, S -1-> A, A -0-> S, A -1-> A
  private static TransitionRelation endsWithOne() {
    TransitionRelation t = new TransitionRelation();
    t.addTransition("S", '0', "S");
    t.addTransition("S", '1', "A");
    t.addTransition("A", '0', "S");
    t.addTransition("A", '1', "A");
    return t;
  }

  @Test
  void testSmallNFA() {
    TransitionRelation t = smallNFA();
    Assertions.assertTrue(FiniteAutomatonEngine.isAccepted(t, "q0", FINAL_Q2, "aab"));
    Assertions.assertTrue(FiniteAutomatonEngine.isAccepted(t, "q0", FINAL_Q2, "ab"));
    Assertions.assertFalse(FiniteAutomatonEngine.isAccepted(t, "q0", FINAL_Q2, "a"));
    Assertions.assertEquals(Set.of("q0", "q1"), FiniteAutomatonEngine.reachableStates(t, "q0", "a"));
    Assertions.assertEquals(Set.of("q2"), FiniteAutomatonEngine.reachableStates(t, "q0", "aaab"));
  }

  @Test
  void testEmptyInputReachesOnlyInitial() {
    Assertions.assertEquals(Set.of("q0"), FiniteAutomatonEngine.reachableStates(smallNFA(), "q0", ""));
    Assertions.assertEquals(Set.of("x"), FiniteAutomatonEngine.reachableStates(new TransitionRelation(), "x", ""));
  }

  @Test
  void testEvaluateOutcomes() {
    TransitionRelation t = smallNFA();
    Assertions.assertEquals(Outcome.ACCEPTED_AT_FINAL, FiniteAutomatonEngine.evaluate(t, "q0", FINAL_Q2, "ab").outcome());

    FiniteAutomatonEngine.Evaluation nonFinal = FiniteAutomatonEngine.evaluate(t, "q0", FINAL_Q2, "a");
    Assertions.assertEquals(Outcome.EXHAUSTED_INPUT, nonFinal.outcome());
    Assertions.assertEquals(Set.of("q0", "q1"), nonFinal.reachedStates());

    FiniteAutomatonEngine.Evaluation stuck = FiniteAutomatonEngine.evaluate(t, "q0", FINAL_Q2, "ba");
    Assertions.assertEquals(Outcome.NO_TRANSITION, stuck.outcome());
    Assertions.assertTrue(stuck.reachedStates().isEmpty());
    Assertions.assertFalse(stuck.isAccepted());
  }

  @Test
  void testUnknownSymbolIsNotAnError() {
    Assertions.assertTrue(FiniteAutomatonEngine.reachableStates(smallNFA(), "q0", "az").isEmpty());
  }

  @Test
  void testGenerateDFA() {
    TransitionRelation t = new TransitionRelation();
    t.addTransition("q0", 'a', "q1");
    t.addTransition("q1", 'b', "q2");
    List<String> words = FiniteAutomatonEngine.generateAccepted(t, "q0", FINAL_Q2, List.of('a', 'b'), 3);
    Assertions.assertEquals(List.of("ab"), words);
  }

  @Test
  void testGenerateCyclic() {
    List<String> words = FiniteAutomatonEngine.generateAccepted(
        endsWithOne(), "S", Set.of("A"), List.of('0', '1'), 3);
    Assertions.assertEquals(List.of("1", "01", "11", "001", "011", "101", "111"), words);
  }

  @Test
  void testGenerateWithCycleLimit() {
    List<String> once = FiniteAutomatonEngine.generateAccepted(
        endsWithOne(), "S", Set.of("A"), List.of('0', '1'), 3, 1);
    Assertions.assertEquals(List.of("1"), once);

    List<String> twice = FiniteAutomatonEngine.generateAccepted(
        endsWithOne(), "S", Set.of("A"), List.of('0', '1'), 3, 2);
    Assertions.assertEquals(List.of("1", "01", "11", "011", "101"), twice);
  }

  @Test
  void testGenerateEmptyWord() {
    TransitionRelation t = endsWithOne();
    Assertions.assertEquals(List.of(""),
        FiniteAutomatonEngine.generateAccepted(t, "A", Set.of("A"), List.of('0', '1'), 0));
    Assertions.assertTrue(
        FiniteAutomatonEngine.generateAccepted(t, "S", Set.of("A"), List.of('0', '1'), 0).isEmpty());
    List<String> words = FiniteAutomatonEngine.generateAccepted(t, "A", Set.of("A"), List.of('0', '1'), 1);
    Assertions.assertEquals(List.of("", "1"), words);
  }

  @Test
  void testGenerateKeepsDuplicates() {
    TransitionRelation t = new TransitionRelation();
    t.addTransition("q0", 'a', "q1");
    t.addTransition("q0", 'a', "q1");
    List<String> words = FiniteAutomatonEngine.generateAccepted(t, "q0", Set.of("q1"), List.of('a'), 2);
    Assertions.assertEquals(List.of("a", "a"), words);
    Assertions.assertEquals(Set.of("q1"), FiniteAutomatonEngine.reachableStates(t, "q0", "a"));
  }

  @Test
  void testGenerateIgnoresUnusedSymbols() {
    List<String> words = FiniteAutomatonEngine.generateAccepted(
        smallNFA(), "q0", FINAL_Q2, List.of('z', 'a', 'b'), 2);
    Assertions.assertEquals(List.of("ab"), words);
  }

  @Test
  void testPreconditions() {
    TransitionRelation t = smallNFA();
    Assertions.assertThrows(NullPointerException.class,
        () -> FiniteAutomatonEngine.reachableStates(t, null, "a"));
    Assertions.assertThrows(NullPointerException.class,
        () -> FiniteAutomatonEngine.isAccepted(t, "q0", null, "a"));
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> FiniteAutomatonEngine.generateAccepted(t, "q0", FINAL_Q2, List.of('a'), -1));
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> FiniteAutomatonEngine.generateAccepted(t, "q0", FINAL_Q2, List.of('a'), 2, 0));
  }

  @Test
  void testCompactNFAExport() {
    Alphabet<Character> alphabet = Alphabets.fromCollection(List.of('a', 'b'));
    TransitionRelation t = smallNFA();
    t.addTransition("q2", 'z', "q0"); // outside the alphabet
    CompactNFA<Character> nfa = FiniteAutomatonEngine.toCompactNFA(t, "q0", FINAL_Q2, alphabet);

    Assertions.assertEquals(3, nfa.size());
    Assertions.assertEquals(Set.of(0), nfa.getInitialStates());
    Assertions.assertTrue(nfa.accepts(chars("aab")));
    Assertions.assertFalse(nfa.accepts(chars("a")));
    Assertions.assertEquals(Set.of(0, 1), nfa.getStates(chars("a")));
  }

  @Test
  void testCompactNFAExportUsesSymbolIndices() {
    // 'b' has index 0 and 'a' index 1, neither matching the char code
    Alphabet<Character> alphabet = Alphabets.fromCollection(List.of('b', 'a'));
    CompactNFA<Character> nfa = FiniteAutomatonEngine.toCompactNFA(smallNFA(), "q0", FINAL_Q2, alphabet);

    Assertions.assertTrue(nfa.accepts(chars("ab")));
    Assertions.assertFalse(nfa.accepts(chars("b")));
    Assertions.assertEquals(Set.of(2), nfa.getStates(chars("ab")));
  }

  @Test
  void testAgreesWithCompactNFA() {
    final List<Character> symbols = List.of('a', 'b');
    final Alphabet<Character> alphabet = Alphabets.fromCollection(symbols);
    final List<String> words = allWords(symbols, 5);

    for (int seed = 0; seed < 50; seed++) {
      Random random = new Random(seed);
      TransitionRelation t = randomRelation(random, 6, symbols);
      Set<String> finals = new HashSet<>();
      for (int q = 0; q < 6; q++) {
        if (random.nextBoolean()) {
          finals.add("q" + q);
        }
      }
      CompactNFA<Character> nfa = FiniteAutomatonEngine.toCompactNFA(t, "q0", finals, alphabet);

      Set<String> generated = new HashSet<>(FiniteAutomatonEngine.generateAccepted(t, "q0", finals, symbols, 5));
      for (String word : words) {
        boolean accepted = FiniteAutomatonEngine.isAccepted(t, "q0", finals, word);
        Assertions.assertEquals(nfa.accepts(chars(word)), accepted, "seed " + seed + ", word " + word);
        Assertions.assertEquals(accepted, generated.contains(word), "seed " + seed + ", word " + word);
        Assertions.assertEquals(
            nfa.getStates(chars(word)).size(), FiniteAutomatonEngine.reachableStates(t, "q0", word).size());
      }
    }
  }

  static TransitionRelation randomRelation(Random random, int size, List<Character> symbols) {
    TransitionRelation t = new TransitionRelation();
    for (int q = 0; q < size; q++) {
      for (char c : symbols) {
        int fanOut = random.nextInt(3);
        for (int k = 0; k < fanOut; k++) {
          t.addTransition("q" + q, c, "q" + random.nextInt(size));
        }
      }
    }
    return t;
  }

  static List<String> allWords(List<Character> symbols, int maxLength) {
    List<String> words = new ArrayList<>();
    words.add("");
    for (int start = 0; start < words.size(); start++) {
      String w = words.get(start);
      if (w.length() < maxLength) {
        for (char c : symbols) {
          words.add(w + c);
        }
      }
    }
    return words;
  }

  static List<Character> chars(String s) {
    List<Character> list = new ArrayList<>(s.length());
    for (char c : s.toCharArray()) {
      list.add(c);
    }
    return list;
  }
}
