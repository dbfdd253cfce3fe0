package com.driftindexer.domain.event;

/**
 * Why an order action happened. Declaration order mirrors the on-chain enum (Borsh variant index = ordinal),
 * so new variants must only ever be appended.
 */
public enum OrderActionExplanation {
    NONE,
    INSUFFICIENT_FREE_COLLATERAL,
    ORACLE_PRICE_BREACHED_LIMIT_PRICE,
    MARKET_ORDER_FILLED_TO_LIMIT_PRICE,
    ORDER_EXPIRED,
    LIQUIDATION,
    ORDER_FILLED_WITH_AMM,
    ORDER_FILLED_WITH_AMM_JIT,
    ORDER_FILLED_WITH_MATCH,
    ORDER_FILLED_WITH_MATCH_JIT,
    MARKET_EXPIRED,
    RISKING_INCREASING_ORDER,
    REDUCE_ONLY_ORDER_INCREASED_POSITION,
    ORDER_FILL_WITH_SERUM,
    NO_BORROW_LIQUIDITY,
    ORDER_FILL_WITH_PHOENIX,
    ORDER_FILLED_WITH_AMM_JIT_LP_SPLIT,
    ORDER_FILLED_WITH_LP_JIT,
    DERISK_LP
}
