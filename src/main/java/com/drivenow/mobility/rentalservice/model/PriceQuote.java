package com.drivenow.mobility.rentalservice.model;

import java.math.BigDecimal;

public record PriceQuote(int days, BigDecimal amount) {}
