package com.aiinpocket.whalecopy.service.copier;

import com.aiinpocket.whalecopy.model.dto.CopyOrder;

import java.math.BigDecimal;

/**
 * 下單與槓桿調整，兩者都有副作用且可能暫時失敗。
 */
public interface TradingGateway {

    void submitOrder(CopyOrder order);

    void updateLeverage(String asset, BigDecimal leverage, boolean cross);
}
