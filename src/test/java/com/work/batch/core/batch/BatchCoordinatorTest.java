package com.work.batch.core.batch;

import com.work.batch.core.chain.ChainClient;
import com.work.batch.core.config.BatchConfig;
import com.work.batch.core.exception.BatchValidationException;
import com.work.batch.core.exception.TransactionRejectedException;
import com.work.batch.core.execution.FanOutExecutors;
import com.work.batch.core.model.BatchResult;
import com.work.batch.core.model.SubmissionOutcome;
import com.work.batch.core.model.SubmissionStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;

import static com.work.batch.core.batch.BatchTestSupport.happyChain;
import static com.work.batch.core.batch.BatchTestSupport.operations;
import static com.work.batch.core.batch.BatchTestSupport.txHash;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

public class BatchCoordinatorTest {

    private ExecutorService executor;

    @BeforeEach
    public void setUp() {
        executor = FanOutExecutors.newFanOutExecutor(64, "test-io-");
    }

    @AfterEach
    public void tearDown() {
        executor.shutdownNow();
    }

    private BatchCoordinator coordinator(ChainClient chain, int chunkSize) {
        return BatchTestSupport.newCoordinator(chain, new BatchConfig(chunkSize, Duration.ZERO, 32), executor);
    }

    @Test
    public void five_operations_from_key_ten_all_confirm_in_order() {
        ChainClient chain = happyChain();

        BatchResult result = coordinator(chain, 50).submitBatch(operations(5), 10, true);

        assertTrue(result.isSuccess());
        assertEquals(5, result.getTotalPayments());
        assertEquals(5, result.getConfirmedPayments());
        assertEquals(0, result.getFailedPayments());
        assertEquals(0, result.getPendingPayments());
        assertEquals(1, result.getChunksProcessed());
        List<Integer> keys = new ArrayList<>();
        for (SubmissionOutcome o : result.getOutcomes()) {
            keys.add(o.getNonceKey());
            assertEquals(txHash(o.getNonceKey()), o.getTxHash());
        }
        assertEquals(List.of(10, 11, 12, 13, 14), keys);
    }

    @Test
    public void full_key_space_without_waiting_is_all_pending() {
        ChainClient chain = happyChain();

        BatchResult result = coordinator(chain, 50).submitBatch(operations(256), 0, false);

        assertTrue(result.isSuccess());
        assertEquals(256, result.getTotalPayments());
        assertEquals(256, result.getPendingPayments());
        assertEquals(0, result.getConfirmedPayments());
        assertEquals(6, result.getChunksProcessed());
        for (int i = 0; i < 256; i++) {
            SubmissionOutcome o = result.getOutcomes().get(i);
            assertEquals(i, o.getNonceKey());
            assertEquals(SubmissionStatus.PENDING, o.getStatus());
        }
        verify(chain, never()).awaitInclusion(anyString());
    }

    @Test
    public void one_failing_submission_does_not_block_siblings() {
        ChainClient chain = happyChain();
        when(chain.submit(anyString(), any(byte[].class), any(BigInteger.class), eq(12)))
                .thenThrow(new TransactionRejectedException("insufficient funds for transfer"));

        BatchResult result = coordinator(chain, 50).submitBatch(operations(5), 10, true);

        assertFalse(result.isSuccess());
        assertEquals(4, result.getConfirmedPayments());
        assertEquals(1, result.getFailedPayments());
        SubmissionOutcome failed = result.getOutcomes().get(2);
        assertEquals(12, failed.getNonceKey());
        assertEquals(SubmissionStatus.FAILED, failed.getStatus());
        assertNull(failed.getTxHash());
        assertEquals("insufficient funds for transfer", failed.getError());
        // 提交失败的那笔不进入确认阶段
        verify(chain, times(4)).awaitInclusion(anyString());
    }

    @Test
    public void twenty_operations_with_chunk_size_seven_process_three_chunks() {
        ChainClient chain = happyChain();

        BatchResult result = coordinator(chain, 7).submitBatch(operations(20), 1, true);

        assertEquals(3, result.getChunksProcessed());
        assertEquals(20, result.getTotalPayments());
        assertEquals(result.getTotalPayments(),
                result.getConfirmedPayments() + result.getFailedPayments() + result.getPendingPayments());
        for (int i = 0; i < 20; i++) {
            assertEquals(1 + i, result.getOutcomes().get(i).getNonceKey());
        }
    }

    @Test
    public void nonces_are_read_fresh_for_every_chunk() {
        ChainClient chain = happyChain();

        coordinator(chain, 7).submitBatch(operations(20), 1, false);

        for (int key = 1; key <= 20; key++) {
            verify(chain, times(1)).resolveSlotCounter(BatchTestSupport.ACCOUNT, key);
        }
    }

    @Test
    public void inter_chunk_delay_applies_between_chunks_only() {
        ChainClient chain = happyChain();
        BatchCoordinator c = BatchTestSupport.newCoordinator(chain, new BatchConfig(2, Duration.ofMillis(100), 32), executor);

        BatchResult result = c.submitBatch(operations(5), 1, false);

        // 3 个 chunk，中间 2 次间隔
        assertEquals(3, result.getChunksProcessed());
        assertTrue(result.getDurationMs() >= 200, "duration=" + result.getDurationMs());
    }

    @Test
    public void empty_list_fails_before_any_network_call() {
        ChainClient chain = mock(ChainClient.class);

        BatchValidationException e = assertThrows(BatchValidationException.class,
                () -> coordinator(chain, 50).submitBatch(Collections.emptyList(), 1, true));

        assertEquals("payments", e.getField());
        verifyNoInteractions(chain);
    }

    @Test
    public void start_key_out_of_range_fails_before_any_network_call() {
        ChainClient chain = mock(ChainClient.class);
        BatchCoordinator c = coordinator(chain, 50);

        BatchValidationException high = assertThrows(BatchValidationException.class,
                () -> c.submitBatch(operations(1), 256, true));
        BatchValidationException low = assertThrows(BatchValidationException.class,
                () -> c.submitBatch(operations(1), -1, true));

        assertEquals("startNonceKey", high.getField());
        assertEquals("startNonceKey", low.getField());
        verifyNoInteractions(chain);
    }

    @Test
    public void too_many_operations_names_the_maximum() {
        ChainClient chain = mock(ChainClient.class);

        BatchValidationException e = assertThrows(BatchValidationException.class,
                () -> coordinator(chain, 50).submitBatch(operations(7), 250, true));

        assertEquals("payments", e.getField());
        assertTrue(e.getMessage().contains("Max 6 payments"), e.getMessage());
        verifyNoInteractions(chain);
    }

    @Test
    public void empty_list_wins_over_bad_start_key() {
        ChainClient chain = mock(ChainClient.class);

        BatchValidationException e = assertThrows(BatchValidationException.class,
                () -> coordinator(chain, 50).submitBatch(new ArrayList<>(), 999, true));

        assertEquals("payments", e.getField());
    }

    @Test
    public void nonce_lookup_failure_only_fails_that_operation() {
        ChainClient chain = happyChain();
        when(chain.resolveSlotCounter(anyString(), eq(3)))
                .thenThrow(new com.work.batch.core.exception.ChainNetworkException("rpc down"));

        BatchResult result = coordinator(chain, 50).submitBatch(operations(4), 1, true);

        assertEquals(3, result.getConfirmedPayments());
        assertEquals(1, result.getFailedPayments());
        assertEquals("rpc down", result.getOutcomes().get(2).getError());
        verify(chain, never()).submit(anyString(), any(byte[].class), any(BigInteger.class), eq(3));
    }

    @Test
    public void failures_are_counted_across_chunks() {
        ChainClient chain = happyChain();
        when(chain.submit(anyString(), any(byte[].class), any(BigInteger.class), anyInt()))
                .thenAnswer(inv -> {
                    int key = inv.getArgument(3);
                    if (key % 5 == 0) {
                        throw new TransactionRejectedException("nonce too low");
                    }
                    return txHash(key);
                });

        BatchResult result = coordinator(chain, 4).submitBatch(operations(12), 1, false);

        // key 5、10 失败
        assertEquals(2, result.getFailedPayments());
        assertEquals(10, result.getPendingPayments());
        assertEquals(3, result.getChunksProcessed());
        assertFalse(result.isSuccess());
    }
}
