package com.aiinpocket.whalecopy.service.copier;

import com.aiinpocket.whalecopy.model.dto.AssetSizing;

import java.util.Optional;

public interface AssetSizingProvider {

    /** 查詢資產的下單精度；交易所不認得的資產回傳 empty */
    Optional<AssetSizing> resolve(String asset);
}
