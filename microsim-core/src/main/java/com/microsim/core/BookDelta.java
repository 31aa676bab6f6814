package com.microsim.core;

import com.microsim.api.Side;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Price levels touched while processing one intent, with each level's depth
 * after processing. A depth of zero means the level disappeared.
 */
public final class BookDelta {

    public static final BookDelta EMPTY = new BookDelta(Collections.emptyList());

    private final List<LevelChange> changes;

    public BookDelta(List<LevelChange> changes) {
        this.changes = Collections.unmodifiableList(new ArrayList<>(changes));
    }

    public List<LevelChange> changes() {
        return changes;
    }

    public boolean isEmpty() {
        return changes.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof BookDelta && ((BookDelta) o).changes.equals(changes);
    }

    @Override
    public int hashCode() {
        return changes.hashCode();
    }

    @Override
    public String toString() {
        return "BookDelta" + changes;
    }

    /**
     * Depth of one {@code (side, price)} level after processing.
     */
    public static final class LevelChange {
        private final byte side;
        private final long price;
        private final long depth;

        public LevelChange(byte side, long price, long depth) {
            this.side = side;
            this.price = price;
            this.depth = depth;
        }

        public byte side() {
            return side;
        }

        public long price() {
            return price;
        }

        public long depth() {
            return depth;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof LevelChange)) {
                return false;
            }
            LevelChange that = (LevelChange) o;
            return side == that.side && price == that.price && depth == that.depth;
        }

        @Override
        public int hashCode() {
            return 31 * (31 * side + Long.hashCode(price)) + Long.hashCode(depth);
        }

        @Override
        public String toString() {
            return Side.name(side) + " " + price + "=" + depth;
        }
    }
}
