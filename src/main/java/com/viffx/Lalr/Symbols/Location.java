package com.viffx.Lalr.Symbols;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A source range, 1-based and inclusive on both ends.
 */
public record Location(int firstLine, int firstColumn, int lastLine, int lastColumn) {
    public Location {
        if (firstLine < 1 || lastLine < firstLine) throw new IllegalArgumentException("Invalid line range " + firstLine + "-" + lastLine);
        if (firstColumn < 1 || lastColumn < 1) throw new IllegalArgumentException("Columns start at 1");
    }

    @Contract("_, _ -> new")
    public static @NotNull Location at(int line, int column) {
        return new Location(line, column, line, column);
    }

    /**
     * Returns the smallest range covering {@code first} through {@code last}. Either end may
     * be {@code null}, in which case the other one is returned.
     */
    public static @Nullable Location span(@Nullable Location first, @Nullable Location last) {
        if (first == null) return last;
        if (last == null) return first;
        return new Location(first.firstLine, first.firstColumn, last.lastLine, last.lastColumn);
    }

    @Override
    public String toString() {
        if (firstLine == lastLine && firstColumn == lastColumn) return firstLine + ":" + firstColumn;
        return firstLine + ":" + firstColumn + "-" + lastLine + ":" + lastColumn;
    }
}
