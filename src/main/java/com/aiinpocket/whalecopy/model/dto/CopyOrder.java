package com.aiinpocket.whalecopy.model.dto;

import java.math.BigDecimal;

/**
 * 跟單送出的 IOC 限價單。
 */
public record CopyOrder(
        long sessionId,
        String asset,
        int assetIndex,
        boolean buy,
        BigDecimal size,
        BigDecimal limitPrice,
        boolean reduceOnly,
        String timeInForce
) {
    public static final String IOC = "Ioc";
}
