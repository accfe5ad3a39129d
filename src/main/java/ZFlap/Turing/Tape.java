package ZFlap.Turing;

import ZFlap.Model.MoveDirection;
import ZFlap.Model.TapeSymbol;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;

/**
 * Turing machine tape that grows by one blank cell whenever the head steps past either end.
 * The tape is never truncated. The offset counts cells prepended on the left, i.e. where the
 * first input cell now sits.
 */
public class Tape {
    private final char blankChar;
    private final ObjectArrayList<TapeSymbol> cells;
    private int head;
    private int offset;

    private Tape(char blankChar, ObjectArrayList<TapeSymbol> cells, int head, int offset) {
        this.blankChar = blankChar;
        this.cells = cells;
        this.head = head;
        this.offset = offset;
    }

    /**
     * Tape holding the input, head on the first cell. An empty input gives a single blank cell.
     */
    public static Tape of(String input, char blankChar) {
        ObjectArrayList<TapeSymbol> cells = new ObjectArrayList<>(Math.max(1, input.length()));
        for (int i = 0; i < input.length(); i++) {
            cells.add(TapeSymbol.of(input.charAt(i)).normalize(blankChar));
        }
        if (cells.isEmpty()) {
            cells.add(TapeSymbol.BLANK);
        }
        return new Tape(blankChar, cells, 0, 0);
    }

    public Tape copy() {
        return new Tape(blankChar, new ObjectArrayList<>(cells), head, offset);
    }

    /**
     * @return symbol under the head; blank if the head is outside the materialized cells
     */
    public TapeSymbol read() {
        return head >= 0 && head < cells.size() ? cells.get(head) : TapeSymbol.BLANK;
    }

    public void write(TapeSymbol symbol) {
        cells.set(head, symbol.normalize(blankChar));
    }

    public void move(MoveDirection direction) {
        head += direction.getDelta();
        expand();
    }

    private void expand() {
        if (head < 0) {
            cells.add(0, TapeSymbol.BLANK);
            offset++;
            head = 0;
        } else if (head >= cells.size()) {
            cells.add(TapeSymbol.BLANK);
        }
    }

    public TapeSymbol get(int index) {
        return cells.get(index);
    }

    public int size() {
        return cells.size();
    }

    public int getHead() {
        return head;
    }

    public int getOffset() {
        return offset;
    }

    /**
     * Cell contents with blanks rendered, without head marker.
     */
    public String contents() {
        StringBuilder sb = new StringBuilder(cells.size());
        for (TapeSymbol cell : cells) {
            sb.append(cell.render(blankChar));
        }
        return sb.toString();
    }

    /**
     * Cell contents with the head cell in brackets, e.g. "a[b]_".
     */
    public String render() {
        StringBuilder sb = new StringBuilder(cells.size() + 2);
        for (int i = 0; i < cells.size(); i++) {
            char c = cells.get(i).render(blankChar);
            if (i == head) {
                sb.append('[').append(c).append(']');
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return render();
    }
}
