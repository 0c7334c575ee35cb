package io.github.drompincen.taskcore.runtime.board;

import io.github.drompincen.taskcore.persistence.store.BoardRowStore;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Computes the shifts that keep active positions of a list dense ({@code 0..count-1}) across a
 * board mutation. The moved, inserted or restored row itself is written separately by the
 * caller; shifts only touch active rows, so a deleted row never moves with its neighbours.
 */
@Component
public class PositionReconciler {

    /** Opens slot {@code position}: everything at or after it moves one step later. */
    public List<PositionShift> insertAt(String listKey, int position) {
        return List.of(PositionShift.from(listKey, position, 1));
    }

    /**
     * Moving down closes the range {@code (from, to]}, moving up opens {@code [to, from)}.
     * The bounds keep rows beyond the target in place.
     */
    public List<PositionShift> moveWithin(String listKey, int from, int to) {
        if (from < to) {
            return List.of(PositionShift.range(listKey, from + 1, to, -1));
        }
        if (from > to) {
            return List.of(PositionShift.range(listKey, to, from - 1, 1));
        }
        return List.of();
    }

    public List<PositionShift> moveAcross(String fromListKey, int from, String toListKey, int to) {
        return List.of(
                PositionShift.from(fromListKey, from + 1, -1),
                PositionShift.from(toListKey, to, 1));
    }

    /** Closes the gap left by the row at {@code position}. */
    public List<PositionShift> removeAt(String listKey, int position) {
        return List.of(PositionShift.from(listKey, position + 1, -1));
    }

    /**
     * Reopens the stored slot of a restored row, pushing the current occupant aside. A slot past
     * the end of the list is pulled back to the tail.
     */
    public List<PositionShift> reinsertAt(String listKey, int storedPosition, long activeCount) {
        return List.of(PositionShift.from(listKey, reinsertPosition(storedPosition, activeCount), 1));
    }

    public int reinsertPosition(int storedPosition, long activeCount) {
        return (int) Math.min(storedPosition, activeCount);
    }

    /** Applies shifts in order and returns the total number of rows moved. */
    public int apply(BoardRowStore store, List<PositionShift> shifts) {
        int moved = 0;
        for (PositionShift shift : shifts) {
            moved += shift.isBounded()
                    ? store.shiftPositions(shift.listKey(), shift.fromInclusive(), shift.toInclusive(), shift.delta())
                    : store.shiftPositions(shift.listKey(), shift.fromInclusive(), shift.delta());
        }
        return moved;
    }
}
