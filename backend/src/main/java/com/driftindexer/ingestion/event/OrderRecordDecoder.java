package com.driftindexer.ingestion.event;

import com.driftindexer.domain.event.DriftEventKind;
import com.driftindexer.domain.event.MarketType;
import com.driftindexer.domain.event.Order;
import com.driftindexer.domain.event.OrderRecord;
import com.driftindexer.domain.event.OrderStatus;
import com.driftindexer.domain.event.OrderTriggerCondition;
import com.driftindexer.domain.event.OrderType;
import com.driftindexer.domain.event.PositionDirection;
import org.springframework.stereotype.Component;

/**
 * Borsh layout of the Drift {@code OrderRecord} event: ts, user, then the embedded {@code Order} struct
 * (which ends with 3 padding bytes).
 */
@Component
public class OrderRecordDecoder implements EventDecoder<OrderRecord> {

    private static final int ORDER_PADDING = 3;

    @Override
    public DriftEventKind kind() {
        return DriftEventKind.ORDER_RECORD;
    }

    @Override
    public Class<OrderRecord> eventType() {
        return OrderRecord.class;
    }

    @Override
    public OrderRecord decode(byte[] payload) {
        BorshReader r = new BorshReader(payload);
        long ts = r.i64();
        String user = r.pubkey();
        Order order = new Order(
                r.u64(),
                r.u64(),
                r.u64(),
                r.u64(),
                r.u64(),
                r.u64(),
                r.i64(),
                r.i64(),
                r.i64(),
                r.i32(),
                r.u32(),
                r.u16(),
                r.variant(OrderStatus.class),
                r.variant(OrderType.class),
                r.variant(MarketType.class),
                r.u8(),
                r.variant(PositionDirection.class),
                r.variant(PositionDirection.class),
                r.bool(),
                r.bool(),
                r.bool(),
                r.variant(OrderTriggerCondition.class),
                r.u8());
        r.bytes(ORDER_PADDING);
        r.expectEnd();
        return new OrderRecord(ts, user, order);
    }

    @Override
    public byte[] encode(OrderRecord e) {
        Order o = e.order();
        return new BorshWriter()
                .i64(e.ts())
                .pubkey(e.user())
                .u64(o.slot())
                .u64(o.price())
                .u64(o.baseAssetAmount())
                .u64(o.baseAssetAmountFilled())
                .u64(o.quoteAssetAmountFilled())
                .u64(o.triggerPrice())
                .i64(o.auctionStartPrice())
                .i64(o.auctionEndPrice())
                .i64(o.maxTs())
                .i32(o.oraclePriceOffset())
                .u32(o.orderId())
                .u16(o.marketIndex())
                .variant(o.status())
                .variant(o.orderType())
                .variant(o.marketType())
                .u8(o.userOrderId())
                .variant(o.existingPositionDirection())
                .variant(o.direction())
                .bool(o.reduceOnly())
                .bool(o.postOnly())
                .bool(o.immediateOrCancel())
                .variant(o.triggerCondition())
                .u8(o.auctionDuration())
                .bytes(new byte[ORDER_PADDING])
                .toByteArray();
    }
}
