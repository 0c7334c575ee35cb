package io.github.drompincen.taskcore.runtime.board;

/**
 * Request to add {@code delta} to every active row of {@code listKey} whose position lies in
 * {@code [fromInclusive, toInclusive]}. A null upper bound means unbounded.
 */
public record PositionShift(String listKey, int fromInclusive, Integer toInclusive, int delta) {

    public static PositionShift from(String listKey, int fromInclusive, int delta) {
        return new PositionShift(listKey, fromInclusive, null, delta);
    }

    public static PositionShift range(String listKey, int fromInclusive, int toInclusive, int delta) {
        return new PositionShift(listKey, fromInclusive, toInclusive, delta);
    }

    public boolean isBounded() {
        return toInclusive != null;
    }
}
