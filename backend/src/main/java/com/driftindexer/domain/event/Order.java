package com.driftindexer.domain.event;

import java.math.BigInteger;

/**
 * Snapshot of a user order as embedded in {@link OrderRecord}. u64 fields are unsigned {@link BigInteger}s.
 */
public record Order(
        BigInteger slot,
        BigInteger price,
        BigInteger baseAssetAmount,
        BigInteger baseAssetAmountFilled,
        BigInteger quoteAssetAmountFilled,
        BigInteger triggerPrice,
        long auctionStartPrice,
        long auctionEndPrice,
        long maxTs,
        int oraclePriceOffset,
        long orderId,
        int marketIndex,
        OrderStatus status,
        OrderType orderType,
        MarketType marketType,
        int userOrderId,
        PositionDirection existingPositionDirection,
        PositionDirection direction,
        boolean reduceOnly,
        boolean postOnly,
        boolean immediateOrCancel,
        OrderTriggerCondition triggerCondition,
        int auctionDuration
) {
}
