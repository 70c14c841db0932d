package com.aiinpocket.whalecopy.model.dto;

import java.math.BigDecimal;
import java.time.Instant;

public record PricePoint(Instant timestamp, BigDecimal price) {}
