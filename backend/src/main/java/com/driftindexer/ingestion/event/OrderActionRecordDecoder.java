package com.driftindexer.ingestion.event;

import com.driftindexer.domain.event.DriftEventKind;
import com.driftindexer.domain.event.MarketType;
import com.driftindexer.domain.event.OrderAction;
import com.driftindexer.domain.event.OrderActionExplanation;
import com.driftindexer.domain.event.OrderActionRecord;
import com.driftindexer.domain.event.PositionDirection;
import org.springframework.stereotype.Component;

/**
 * Borsh layout of the Drift {@code OrderActionRecord} event (fields in declaration order).
 */
@Component
public class OrderActionRecordDecoder implements EventDecoder<OrderActionRecord> {

    @Override
    public DriftEventKind kind() {
        return DriftEventKind.ORDER_ACTION_RECORD;
    }

    @Override
    public Class<OrderActionRecord> eventType() {
        return OrderActionRecord.class;
    }

    @Override
    public OrderActionRecord decode(byte[] payload) {
        BorshReader r = new BorshReader(payload);
        OrderActionRecord record = new OrderActionRecord(
                r.i64(),
                r.variant(OrderAction.class),
                r.variant(OrderActionExplanation.class),
                r.u16(),
                r.variant(MarketType.class),
                r.option(r::pubkey),
                r.option(r::u64),
                r.option(r::u64),
                r.option(r::u64),
                r.option(r::u64),
                r.option(r::u64),
                r.option(r::i64),
                r.option(r::u32),
                r.option(r::i64),
                r.option(r::u64),
                r.option(r::pubkey),
                r.option(r::u32),
                r.option(() -> r.variant(PositionDirection.class)),
                r.option(r::u64),
                r.option(r::u64),
                r.option(r::u64),
                r.option(r::pubkey),
                r.option(r::u32),
                r.option(() -> r.variant(PositionDirection.class)),
                r.option(r::u64),
                r.option(r::u64),
                r.option(r::u64),
                r.i64());
        r.expectEnd();
        return record;
    }

    @Override
    public byte[] encode(OrderActionRecord e) {
        BorshWriter w = new BorshWriter();
        w.i64(e.ts())
                .variant(e.action())
                .variant(e.actionExplanation())
                .u16(e.marketIndex())
                .variant(e.marketType())
                .option(e.filler(), w::pubkey)
                .option(e.fillerReward(), w::u64)
                .option(e.fillRecordId(), w::u64)
                .option(e.baseAssetAmountFilled(), w::u64)
                .option(e.quoteAssetAmountFilled(), w::u64)
                .option(e.takerFee(), w::u64)
                .option(e.makerFee(), w::i64)
                .option(e.referrerReward(), w::u32)
                .option(e.quoteAssetAmountSurplus(), w::i64)
                .option(e.spotFulfillmentMethodFee(), w::u64)
                .option(e.taker(), w::pubkey)
                .option(e.takerOrderId(), w::u32)
                .option(e.takerOrderDirection(), w::variant)
                .option(e.takerOrderBaseAssetAmount(), w::u64)
                .option(e.takerOrderCumulativeBaseAssetAmountFilled(), w::u64)
                .option(e.takerOrderCumulativeQuoteAssetAmountFilled(), w::u64)
                .option(e.maker(), w::pubkey)
                .option(e.makerOrderId(), w::u32)
                .option(e.makerOrderDirection(), w::variant)
                .option(e.makerOrderBaseAssetAmount(), w::u64)
                .option(e.makerOrderCumulativeBaseAssetAmountFilled(), w::u64)
                .option(e.makerOrderCumulativeQuoteAssetAmountFilled(), w::u64)
                .i64(e.oraclePrice());
        return w.toByteArray();
    }
}
