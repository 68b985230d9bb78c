package com.flagship.pos_core.sale;

/**
 * Price list a sale is rung up against.
 */
public enum SaleType {
    RETAIL,
    WHOLESALE
}
