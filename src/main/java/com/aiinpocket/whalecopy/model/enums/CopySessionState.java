package com.aiinpocket.whalecopy.model.enums;

/**
 * 跟單 session 對外呈現的狀態。
 *
 * <ul>
 *   <li>ACTIVE：每次輪詢都會處理</li>
 *   <li>BACKING_OFF：來源地址呼叫失敗，退避期間暫停輪詢</li>
 *   <li>STOPPED：已停止，輪詢不再造訪</li>
 * </ul>
 */
public enum CopySessionState {
    ACTIVE,
    BACKING_OFF,
    STOPPED
}
