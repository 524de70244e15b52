package com.titiplex.expenses.core.error;

public class IndexOutOfRangeException extends ExpenseTrackerException {
    private final int position;
    private final int size;

    public IndexOutOfRangeException(int position, int size) {
        super("position " + position + " is out of range [0, " + size + ")");
        this.position = position;
        this.size = size;
    }

    public int position() {
        return position;
    }

    public int size() {
        return size;
    }
}
