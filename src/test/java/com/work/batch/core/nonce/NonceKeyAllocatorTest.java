package com.work.batch.core.nonce;

import com.work.batch.core.chain.ChainClient;
import com.work.batch.core.exception.BatchValidationException;
import com.work.batch.core.exception.ChainNetworkException;
import com.work.batch.core.execution.FanOutExecutors;
import com.work.batch.core.model.NonceKeyInfo;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;
import java.util.concurrent.ExecutorService;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

public class NonceKeyAllocatorTest {

    private static final String WALLET = "0x00000000000000000000000000000000000000aa";
    private static final String OTHER = "0x00000000000000000000000000000000000000cc";

    private ExecutorService executor;

    @BeforeEach
    public void setUp() {
        executor = FanOutExecutors.newFanOutExecutor(8, "test-scan-");
    }

    @AfterEach
    public void tearDown() {
        executor.shutdownNow();
    }

    @Test
    public void out_of_range_slot_is_rejected_without_chain_call() {
        ChainClient chain = mock(ChainClient.class);
        NonceKeyAllocator allocator = new NonceKeyAllocator(chain, executor, 32);

        BatchValidationException high = assertThrows(BatchValidationException.class, () -> allocator.resolveNonce(WALLET, 256));
        assertThrows(BatchValidationException.class, () -> allocator.resolveNonce(WALLET, -1));

        assertEquals("nonceKey", high.getField());
        assertEquals("256", high.getReceived());
        verifyNoInteractions(chain);
    }

    @Test
    public void blank_address_falls_back_to_wallet() {
        ChainClient chain = mock(ChainClient.class);
        when(chain.getAddress()).thenReturn(WALLET);
        when(chain.resolveSlotCounter(eq(WALLET), eq(7))).thenReturn(BigInteger.valueOf(3));
        NonceKeyAllocator allocator = new NonceKeyAllocator(chain, executor, 32);

        assertEquals(BigInteger.valueOf(3), allocator.resolveNonce(null, 7));
        assertEquals(BigInteger.valueOf(3), allocator.resolveNonce("  ", 7));
        verify(chain, times(2)).resolveSlotCounter(eq(WALLET), eq(7));
    }

    @Test
    public void reads_are_not_cached() {
        ChainClient chain = mock(ChainClient.class);
        when(chain.resolveSlotCounter(eq(OTHER), eq(0)))
                .thenReturn(BigInteger.valueOf(5))
                .thenReturn(BigInteger.valueOf(6));
        NonceKeyAllocator allocator = new NonceKeyAllocator(chain, executor, 32);

        assertEquals(BigInteger.valueOf(5), allocator.resolveNonce(OTHER, 0));
        assertEquals(BigInteger.valueOf(6), allocator.resolveNonce(OTHER, 0));
        verify(chain, times(2)).resolveSlotCounter(eq(OTHER), eq(0));
        verify(chain, never()).getAddress();
    }

    @Test
    public void list_active_slots_scans_all_keys_and_keeps_nonzero_in_order() {
        ChainClient chain = mock(ChainClient.class);
        when(chain.getAddress()).thenReturn(WALLET);
        when(chain.resolveSlotCounter(anyString(), anyInt())).thenAnswer(inv -> {
            int slot = inv.getArgument(1);
            if (slot == 0) {
                return BigInteger.valueOf(12);
            }
            if (slot == 3 || slot == 200) {
                return BigInteger.ONE;
            }
            return BigInteger.ZERO;
        });
        NonceKeyAllocator allocator = new NonceKeyAllocator(chain, executor, 32);

        List<NonceKeyInfo> active = allocator.listActiveSlots(null);

        assertEquals(3, active.size());
        assertEquals(0, active.get(0).getKey());
        assertEquals(BigInteger.valueOf(12), active.get(0).getNonce());
        assertEquals(3, active.get(1).getKey());
        assertEquals(200, active.get(2).getKey());
        verify(chain, times(256)).resolveSlotCounter(eq(WALLET), anyInt());
    }

    @Test
    public void list_active_slots_fresh_account_is_empty() {
        ChainClient chain = mock(ChainClient.class);
        when(chain.resolveSlotCounter(anyString(), anyInt())).thenReturn(BigInteger.ZERO);
        NonceKeyAllocator allocator = new NonceKeyAllocator(chain, executor, 50);

        assertTrue(allocator.listActiveSlots(OTHER).isEmpty());
        verify(chain, times(256)).resolveSlotCounter(eq(OTHER), anyInt());
    }

    @Test
    public void list_active_slots_propagates_rpc_failure() {
        ChainClient chain = mock(ChainClient.class);
        when(chain.resolveSlotCounter(anyString(), anyInt())).thenReturn(BigInteger.ZERO);
        when(chain.resolveSlotCounter(anyString(), eq(40))).thenThrow(new ChainNetworkException("connection refused"));
        NonceKeyAllocator allocator = new NonceKeyAllocator(chain, executor, 32);

        ChainNetworkException e = assertThrows(ChainNetworkException.class, () -> allocator.listActiveSlots(OTHER));
        assertEquals("connection refused", e.getMessage());
    }
}
