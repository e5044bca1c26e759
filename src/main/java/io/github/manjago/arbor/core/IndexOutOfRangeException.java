package io.github.manjago.arbor.core;

/**
 * Node index outside a tree, or variable index outside an input vector.
 */
public class IndexOutOfRangeException extends GpException {

    private final int index;
    private final int size;

    public IndexOutOfRangeException(String what, int index, int size) {
        super(String.format("%s index %d out of range [0, %d)", what, index, size));
        this.index = index;
        this.size = size;
    }

    public int getIndex() {
        return index;
    }

    public int getSize() {
        return size;
    }
}
