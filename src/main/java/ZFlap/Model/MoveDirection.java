package ZFlap.Model;

public enum MoveDirection {
    LEFT(-1),
    RIGHT(1),
    STAY(0);

    private final int delta;

    MoveDirection(int delta) {
        this.delta = delta;
    }

    public int getDelta() {
        return delta;
    }
}
