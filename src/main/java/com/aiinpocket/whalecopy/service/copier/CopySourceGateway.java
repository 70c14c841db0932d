package com.aiinpocket.whalecopy.service.copier;

import com.aiinpocket.whalecopy.model.dto.AccountState;
import com.aiinpocket.whalecopy.model.dto.Fill;

import java.time.Instant;
import java.util.List;

/**
 * 來源帳戶的成交與帳戶狀態。
 * 實作可能在多次呼叫間回傳重複的成交，呼叫端必須自行去重。
 */
public interface CopySourceGateway {

    /**
     * @param since 只取此時間（含）之後的成交；null 代表取最近的成交
     * @return 依時間由舊到新排序的成交
     */
    List<Fill> fetchFills(String address, Instant since);

    AccountState fetchAccountState(String address);
}
