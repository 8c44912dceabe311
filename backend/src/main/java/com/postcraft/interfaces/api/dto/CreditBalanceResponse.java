package com.postcraft.interfaces.api.dto;

import java.math.BigDecimal;

public record CreditBalanceResponse(String accountId, BigDecimal balance) {}
