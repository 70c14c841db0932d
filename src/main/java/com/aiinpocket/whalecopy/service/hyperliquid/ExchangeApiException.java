package com.aiinpocket.whalecopy.service.hyperliquid;

/**
 * 交易所 API 呼叫失敗（連線、HTTP 錯誤或無法解析的回應）。
 */
public class ExchangeApiException extends RuntimeException {

    public ExchangeApiException(String message) {
        super(message);
    }

    public ExchangeApiException(String message, Throwable cause) {
        super(message, cause);
    }
}
