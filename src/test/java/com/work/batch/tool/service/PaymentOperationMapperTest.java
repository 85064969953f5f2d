package com.work.batch.tool.service;

import com.work.batch.core.exception.BatchErrorCode;
import com.work.batch.core.exception.BatchValidationException;
import com.work.batch.core.exception.ChainNetworkException;
import com.work.batch.core.model.TransferOperation;
import com.work.batch.tool.chain.TokenMetadataClient;
import com.work.batch.tool.config.TokenProperties;
import com.work.batch.tool.web.dto.PaymentItem;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

public class PaymentOperationMapperTest {

    private static final String ALPHA = "0x20c0000000000000000000000000000000000001";
    private static final String WETH = "0x20c0000000000000000000000000000000000018";
    private static final String TO = "0x00000000000000000000000000000000000000bb";

    private final TokenMetadataClient metadata = mock(TokenMetadataClient.class);

    private PaymentOperationMapper mapper() {
        TokenProperties props = new TokenProperties();
        props.getAliases().put("AlphaUSD", ALPHA);
        props.getAliases().put("WETH18", WETH);
        when(metadata.decimals(anyString())).thenReturn(6);
        return new PaymentOperationMapper(props, metadata);
    }

    @Test
    public void alias_amount_and_memo_are_converted() {
        TransferOperation op = mapper().toOperation(new PaymentItem("alphausd", TO, "100.5", "inv-1"));

        assertEquals(ALPHA, op.getToken());
        assertEquals(BigInteger.valueOf(100_500_000L), op.getAmount());
        assertEquals("alphausd", op.getTokenSymbol());
        assertTrue(op.hasMemo());
        byte[] memo = op.getMemo();
        assertEquals(32, memo.length);
        assertEquals(0, memo[0]);
        assertEquals('1', memo[31]);
    }

    @Test
    public void amount_uses_decimals_read_from_token() {
        PaymentOperationMapper mapper = mapper();
        when(metadata.decimals(WETH)).thenReturn(18);

        TransferOperation op = mapper.toOperation(new PaymentItem("WETH18", TO, "1", null));

        assertEquals(WETH, op.getToken());
        assertEquals(new BigInteger("1000000000000000000"), op.getAmount());
    }

    @Test
    public void failed_decimals_read_falls_back_to_configured_default() {
        PaymentOperationMapper mapper = mapper();
        when(metadata.decimals(WETH)).thenThrow(new ChainNetworkException("execution reverted"));

        TransferOperation op = mapper.toOperation(new PaymentItem(WETH, TO, "2.5", null));

        assertEquals(BigInteger.valueOf(2_500_000L), op.getAmount());
    }

    @Test
    public void batch_reads_decimals_once_per_token() {
        PaymentOperationMapper mapper = mapper();
        when(metadata.decimals(WETH)).thenReturn(18);

        List<TransferOperation> ops = mapper.toOperations(Arrays.asList(
                new PaymentItem("AlphaUSD", TO, "1", null),
                new PaymentItem("WETH18", TO, "0.5", null),
                new PaymentItem(ALPHA, TO, "3", null),
                new PaymentItem(WETH, TO, "1", null)));

        assertEquals(BigInteger.valueOf(1_000_000L), ops.get(0).getAmount());
        assertEquals(new BigInteger("500000000000000000"), ops.get(1).getAmount());
        assertEquals(BigInteger.valueOf(3_000_000L), ops.get(2).getAmount());
        assertEquals(new BigInteger("1000000000000000000"), ops.get(3).getAmount());
        verify(metadata, times(1)).decimals(ALPHA);
        verify(metadata, times(1)).decimals(WETH);
    }

    @Test
    public void address_token_is_used_as_is_and_blank_memo_is_dropped() {
        String custom = "0x20C0000000000000000000000000000000000abc";
        TransferOperation op = mapper().toOperation(new PaymentItem(custom, TO, "1", ""));

        assertEquals(custom, op.getToken());
        assertFalse(op.hasMemo());
    }

    @Test
    public void unknown_token_is_rejected() {
        BatchValidationException e = assertThrows(BatchValidationException.class,
                () -> mapper().resolveTokenAddress("BetaUSD"));
        assertEquals(BatchErrorCode.INVALID_TOKEN, e.getErrorCode());
        assertEquals("token", e.getField());
    }

    @Test
    public void parse_units_rejects_bad_amounts() {
        assertEquals(BigInteger.valueOf(1), PaymentOperationMapper.parseUnits("0.000001", 6));
        for (String bad : new String[]{"0", "-1", "abc", "1.0000001"}) {
            BatchValidationException e = assertThrows(BatchValidationException.class,
                    () -> PaymentOperationMapper.parseUnits(bad, 6), bad);
            assertEquals(BatchErrorCode.INVALID_AMOUNT, e.getErrorCode());
        }
    }

    @Test
    public void format_units_strips_trailing_zeros() {
        assertEquals("100.5", PaymentOperationMapper.formatUnits(BigInteger.valueOf(100_500_000L), 6));
        assertEquals("300", PaymentOperationMapper.formatUnits(BigInteger.valueOf(300_000_000L), 6));
        assertEquals("0", PaymentOperationMapper.formatUnits(BigInteger.ZERO, 6));
    }

    @Test
    public void memo_over_32_bytes_is_rejected() {
        // 11 个汉字 = 33 字节
        String memo = "一二三四五六七八九十一";
        BatchValidationException e = assertThrows(BatchValidationException.class,
                () -> PaymentOperationMapper.padMemo(memo));
        assertEquals(BatchErrorCode.INVALID_MEMO, e.getErrorCode());
    }
}
