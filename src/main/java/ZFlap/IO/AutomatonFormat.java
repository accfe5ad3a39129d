package ZFlap.IO;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import ZFlap.IO.AutomatonDocument.StateEntry;
import ZFlap.IO.AutomatonDocument.TransitionEntry;
import net.automatalib.exception.FormatException;

/**
 * Line-oriented automaton file format.
 * <pre>
 * # ZFlap automaton
 * name: even-zeros
 * alphabet: (0,1)
 * [States]
 * q0,100,100,true,true
 * q1,180,100,false,false
 * [Transitions]
 * q0,q1,0
 * q1,q0,0
 * q0,q0,1
 * q1,q1,1
 * </pre>
 * State rows are name,x,y,isInitial,isFinal. Transition rows are from,to followed by one or more symbols.
 * Blank lines and lines starting with '#' are ignored.
 */
public final class AutomatonFormat {
    private static final String HEADER = "# ZFlap automaton";
    private static final String NAME_KEY = "name:";
    private static final String ALPHABET_KEY = "alphabet:";
    private static final String STATES_SECTION = "[States]";
    private static final String TRANSITIONS_SECTION = "[Transitions]";

    private enum Section { HEADER, STATES, TRANSITIONS }

    private AutomatonFormat() {
    }

    public static AutomatonDocument read(Reader reader) throws IOException, FormatException {
        final BufferedReader in = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);

        String name = null;
        List<Character> alphabet = null;
        final List<StateEntry> states = new ArrayList<>();
        final List<TransitionEntry> transitions = new ArrayList<>();
        final Set<String> stateNames = new HashSet<>();
        Section section = Section.HEADER;

        String raw;
        int lineNo = 0;
        while ((raw = in.readLine()) != null) {
            lineNo++;
            String line = raw.strip();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }

            if (line.startsWith("[")) {
                if (STATES_SECTION.equalsIgnoreCase(line)) {
                    section = Section.STATES;
                } else if (TRANSITIONS_SECTION.equalsIgnoreCase(line)) {
                    section = Section.TRANSITIONS;
                } else {
                    throw error(lineNo, "unknown section " + line);
                }
                continue;
            }

            switch (section) {
                case HEADER -> {
                    if (line.startsWith(NAME_KEY)) {
                        name = line.substring(NAME_KEY.length()).strip();
                    } else if (line.startsWith(ALPHABET_KEY)) {
                        try {
                            alphabet = AlphabetParser.parseSymbols(line.substring(ALPHABET_KEY.length()).strip());
                        } catch (IllegalArgumentException e) {
                            throw error(lineNo, e.getMessage());
                        }
                    } else {
                        throw error(lineNo, "unexpected header entry: " + line);
                    }
                }
                case STATES -> {
                    StateEntry state = parseState(line, lineNo);
                    if (!stateNames.add(state.name())) {
                        throw error(lineNo, "duplicate state " + state.name());
                    }
                    states.add(state);
                }
                // raw row, a space can be a symbol
                case TRANSITIONS -> transitions.add(parseTransition(raw, lineNo, stateNames, alphabet));
            }
        }

        if (alphabet == null) {
            throw new FormatException("missing alphabet");
        }
        long initials = states.stream().filter(StateEntry::initial).count();
        if (initials == 0) {
            throw new FormatException("no initial state");
        }
        if (initials > 1) {
            throw new FormatException("more than one initial state");
        }
        return new AutomatonDocument(name == null ? "" : name, alphabet, states, transitions);
    }

    private static StateEntry parseState(String line, int lineNo) throws FormatException {
        String[] fields = line.split(",", -1);
        if (fields.length != 5) {
            throw error(lineNo, "state row needs name,x,y,isInitial,isFinal");
        }
        String name = fields[0].strip();
        if (name.isEmpty()) {
            throw error(lineNo, "empty state name");
        }
        try {
            double x = Double.parseDouble(fields[1].strip());
            double y = Double.parseDouble(fields[2].strip());
            return new StateEntry(name, x, y, parseFlag(fields[3], lineNo), parseFlag(fields[4], lineNo));
        } catch (NumberFormatException e) {
            throw error(lineNo, "bad coordinate in " + line);
        }
    }

    private static boolean parseFlag(String field, int lineNo) throws FormatException {
        String flag = field.strip().toLowerCase(Locale.ROOT);
        return switch (flag) {
            case "true", "1" -> true;
            case "false", "0" -> false;
            default -> throw error(lineNo, "expected true or false, got '" + field.strip() + "'");
        };
    }

    private static TransitionEntry parseTransition(String line, int lineNo, Set<String> stateNames,
                                                   List<Character> alphabet) throws FormatException {
        String[] fields = line.split(",", -1);
        if (fields.length < 3) {
            throw error(lineNo, "transition row needs from,to,symbol[,symbol...]");
        }
        String from = fields[0].strip();
        String to = fields[1].strip();
        if (!stateNames.contains(from)) {
            throw error(lineNo, "undeclared state " + from);
        }
        if (!stateNames.contains(to)) {
            throw error(lineNo, "undeclared state " + to);
        }

        List<Character> symbols = new ArrayList<>(fields.length - 2);
        for (int i = 2; i < fields.length; i++) {
            String symbol = fields[i];
            if (symbol.length() != 1) {
                throw error(lineNo, "symbol '" + symbol + "' must be a single character");
            }
            char c = symbol.charAt(0);
            if (alphabet != null && !alphabet.contains(c)) {
                throw error(lineNo, "symbol '" + c + "' is not in the alphabet");
            }
            symbols.add(c);
        }
        return new TransitionEntry(from, to, symbols);
    }

    private static FormatException error(int lineNo, String message) {
        return new FormatException("line " + lineNo + ": " + message);
    }

    public static void write(AutomatonDocument document, Writer out) throws IOException {
        out.write(HEADER);
        out.write('\n');
        out.write(NAME_KEY + " " + document.name() + "\n");
        out.write(ALPHABET_KEY + " " + AlphabetParser.format(document.alphabet()) + "\n");

        out.write(STATES_SECTION + "\n");
        for (StateEntry s : document.states()) {
            out.write(s.name() + "," + formatCoordinate(s.x()) + "," + formatCoordinate(s.y()) + ","
                + s.initial() + "," + s.accepting() + "\n");
        }

        out.write(TRANSITIONS_SECTION + "\n");
        for (TransitionEntry t : document.transitions()) {
            StringBuilder sb = new StringBuilder(t.from()).append(',').append(t.to());
            for (char c : t.symbols()) {
                sb.append(',').append(c);
            }
            out.write(sb.append('\n').toString());
        }
        out.flush();
    }

    private static String formatCoordinate(double v) {
        return v == Math.rint(v) && !Double.isInfinite(v) ? String.valueOf((long) v) : String.valueOf(v);
    }

    public static AutomatonDocument getFile(String filePath) {
        try (Reader reader = Files.newBufferedReader(Paths.get(filePath), StandardCharsets.UTF_8)) {
            return read(reader);
        } catch (Exception ex) {
            throw new RuntimeException(ex);
        }
    }

    public static void writeFile(String filePath, AutomatonDocument document) {
        Path path = Paths.get(filePath);
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            write(document, writer);
        } catch (IOException e) {
            throw new RuntimeException(e);
        }
    }
}
