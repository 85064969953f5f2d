package com.work.batch.core.encoding;

import com.work.batch.core.model.TransferOperation;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.utils.Numeric;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * TIP-20 转账 calldata 构造：
 * - 无 memo：transfer(address,uint256)
 * - 有 memo：transferWithMemo(address,uint256,bytes32)
 *
 * 编码失败（地址非法等）直接抛出，由调用方按单笔失败处理。
 */
public class TransferPayloadEncoder {

    public static final String TRANSFER = "transfer";
    public static final String TRANSFER_WITH_MEMO = "transferWithMemo";

    public byte[] encode(TransferOperation operation) {
        return Numeric.hexStringToByteArray(encodeHex(operation));
    }

    public String encodeHex(TransferOperation operation) {
        return FunctionEncoder.encode(toFunction(operation));
    }

    Function toFunction(TransferOperation operation) {
        List<Type> args;
        String name;
        if (operation.hasMemo()) {
            name = TRANSFER_WITH_MEMO;
            args = Arrays.<Type>asList(
                    new Address(operation.getTo()),
                    new Uint256(operation.getAmount()),
                    new Bytes32(operation.getMemo()));
        } else {
            name = TRANSFER;
            args = Arrays.<Type>asList(
                    new Address(operation.getTo()),
                    new Uint256(operation.getAmount()));
        }
        return new Function(name, args, Collections.<TypeReference<?>>singletonList(new TypeReference<Bool>() {
        }));
    }
}
