package com.work.batch.core.batch;

import com.work.batch.core.config.BatchConfig;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ChunkPlannerTest {

    @Test
    public void splits_twenty_operations_into_three_chunks_of_seven() {
        ChunkPlanner planner = new ChunkPlanner(new BatchConfig(7, Duration.ZERO, 32));

        List<Chunk> chunks = planner.plan(20, 3);

        assertEquals(3, chunks.size());
        assertEquals(7, chunks.get(0).getSize());
        assertEquals(7, chunks.get(1).getSize());
        assertEquals(6, chunks.get(2).getSize());
        assertEquals(0, chunks.get(0).getOffset());
        assertEquals(14, chunks.get(2).getOffset());
        assertEquals(20, chunks.get(2).getEnd());
        // baseKey = startKey + offset
        assertEquals(3, chunks.get(0).getBaseKey());
        assertEquals(10, chunks.get(1).getBaseKey());
        assertEquals(17, chunks.get(2).getBaseKey());
    }

    @Test
    public void exact_multiple_has_no_trailing_empty_chunk() {
        ChunkPlanner planner = new ChunkPlanner(BatchConfig.defaultConfig());

        List<Chunk> chunks = planner.plan(100, 0);

        assertEquals(2, chunks.size());
        assertEquals(50, chunks.get(1).getSize());
    }

    @Test
    public void empty_input_plans_nothing() {
        ChunkPlanner planner = new ChunkPlanner(BatchConfig.defaultConfig());
        assertTrue(planner.plan(0, 1).isEmpty());
    }

    @Test
    public void defaults_are_fifty_and_five_hundred_millis() {
        ChunkPlanner planner = new ChunkPlanner(BatchConfig.defaultConfig());
        assertEquals(50, planner.getChunkSize());
        assertEquals(Duration.ofMillis(500), planner.getInterChunkDelay());
    }
}
