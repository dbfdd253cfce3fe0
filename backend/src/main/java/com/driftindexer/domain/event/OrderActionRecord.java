package com.driftindexer.domain.event;

import java.math.BigInteger;

/**
 * Order action event (place, cancel, fill, trigger, expire). Optional on-chain fields are {@code null} when
 * absent; pubkeys are base58 strings, u64 amounts unsigned {@link BigInteger}s.
 */
public record OrderActionRecord(
        long ts,
        OrderAction action,
        OrderActionExplanation actionExplanation,
        int marketIndex,
        MarketType marketType,
        String filler,
        BigInteger fillerReward,
        BigInteger fillRecordId,
        BigInteger baseAssetAmountFilled,
        BigInteger quoteAssetAmountFilled,
        BigInteger takerFee,
        Long makerFee,
        Long referrerReward,
        Long quoteAssetAmountSurplus,
        BigInteger spotFulfillmentMethodFee,
        String taker,
        Long takerOrderId,
        PositionDirection takerOrderDirection,
        BigInteger takerOrderBaseAssetAmount,
        BigInteger takerOrderCumulativeBaseAssetAmountFilled,
        BigInteger takerOrderCumulativeQuoteAssetAmountFilled,
        String maker,
        Long makerOrderId,
        PositionDirection makerOrderDirection,
        BigInteger makerOrderBaseAssetAmount,
        BigInteger makerOrderCumulativeBaseAssetAmountFilled,
        BigInteger makerOrderCumulativeQuoteAssetAmountFilled,
        long oraclePrice
) implements DriftEvent {

    @Override
    public DriftEventKind kind() {
        return DriftEventKind.ORDER_ACTION_RECORD;
    }
}
