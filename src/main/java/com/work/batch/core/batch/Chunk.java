package com.work.batch.core.batch;

/**
 * 批次中的一段：[offset, offset + size)，该段第一笔使用 nonceKey = baseKey。
 */
public final class Chunk {

    private final int index;
    private final int offset;
    private final int size;
    private final int baseKey;

    public Chunk(int index, int offset, int size, int baseKey) {
        this.index = index;
        this.offset = offset;
        this.size = size;
        this.baseKey = baseKey;
    }

    public int getIndex() {
        return index;
    }

    public int getOffset() {
        return offset;
    }

    public int getSize() {
        return size;
    }

    public int getBaseKey() {
        return baseKey;
    }

    /**
     * 不含。
     */
    public int getEnd() {
        return offset + size;
    }

    @Override
    public String toString() {
        return "Chunk{index=" + index + ", offset=" + offset + ", size=" + size + ", baseKey=" + baseKey + "}";
    }
}
