package com.work.batch.tool.config;

import com.work.batch.core.exception.BatchErrorCode;
import com.work.batch.core.exception.BatchException;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

public class ChainPropertiesTest {

    @Test
    public void defaults_are_valid_in_both_modes() {
        ChainProperties props = new ChainProperties();
        assertDoesNotThrow(props::validate);

        props.setMode("web3j");
        assertDoesNotThrow(props::validate);
    }

    @Test
    public void bad_account_address_is_a_configuration_error() {
        ChainProperties props = new ChainProperties();
        props.setAccountAddress("0x1234");

        BatchException e = assertThrows(BatchException.class, props::validate);
        assertEquals(BatchErrorCode.CONFIGURATION_ERROR, e.getErrorCode());
        assertEquals(5001, e.getErrorCode().getCode());
        assertTrue(e.getMessage().contains("chain.account-address"));
    }

    @Test
    public void web3j_mode_checks_rpc_settings() {
        ChainProperties props = new ChainProperties();
        props.setMode("web3j");
        props.setRpcUrl(" ");
        assertTrue(assertThrows(BatchException.class, props::validate).getMessage().contains("chain.rpc-url"));

        props.setRpcUrl("http://localhost:8545");
        props.setReceiptPollInterval(Duration.ZERO);
        assertTrue(assertThrows(BatchException.class, props::validate).getMessage().contains("chain.receipt-poll-interval"));
    }

    @Test
    public void mock_mode_ignores_rpc_settings() {
        ChainProperties props = new ChainProperties();
        props.setRpcUrl(null);
        props.setNoncePrecompileAddress("nope");

        assertDoesNotThrow(props::validate);
    }
}
