package com.work.batch.core.batch;

import com.work.batch.core.config.BatchConfig;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.work.batch.core.support.ValidationUtils.requireNonNull;

/**
 * 按 chunkSize 把 [0, N) 切成有序的若干段。纯计算，不涉及网络与并发。
 */
public class ChunkPlanner {

    private final int chunkSize;
    private final Duration interChunkDelay;

    public ChunkPlanner(BatchConfig config) {
        requireNonNull(config, "config");
        this.chunkSize = config.getChunkSize();
        this.interChunkDelay = config.getInterChunkDelay();
    }

    public List<Chunk> plan(int operationCount, int startKey) {
        if (operationCount < 0) {
            throw new IllegalArgumentException("operationCount 不能为负数");
        }
        if (operationCount == 0) {
            return Collections.emptyList();
        }
        List<Chunk> chunks = new ArrayList<>((operationCount + chunkSize - 1) / chunkSize);
        int index = 0;
        for (int offset = 0; offset < operationCount; offset += chunkSize) {
            int size = Math.min(chunkSize, operationCount - offset);
            chunks.add(new Chunk(index++, offset, size, startKey + offset));
        }
        return chunks;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    public Duration getInterChunkDelay() {
        return interChunkDelay;
    }
}
