package com.driftindexer.ingestion.event;

import com.driftindexer.domain.event.MarketType;
import com.driftindexer.domain.event.Order;
import com.driftindexer.domain.event.OrderAction;
import com.driftindexer.domain.event.OrderActionExplanation;
import com.driftindexer.domain.event.OrderActionRecord;
import com.driftindexer.domain.event.OrderRecord;
import com.driftindexer.domain.event.OrderStatus;
import com.driftindexer.domain.event.OrderTriggerCondition;
import com.driftindexer.domain.event.OrderType;
import com.driftindexer.domain.event.PositionDirection;

import java.math.BigInteger;
import java.util.List;

/**
 * Shared event fixtures. {@link #FILL_LOG_LINE} is a perp fill logged on mainnet.
 */
public final class DriftEventFixtures {

    public static final String DRIFT_PROGRAM_ID = "dRiftyHA39MWEi3m9aunc5MzRF1JYuBsbn6VPcn33UH";
    public static final String ACCOUNT = "BTDXiRzG1QBP7bfK4A33RcSP5mmZx8mGJ9YC5maetoD6";

    public static final String FILL_LOG_LINE = "Program log: 4DRDR8LtbQGWwHZkAAAAAAIIAQABAVAItYsox9wC2v+AAz8WXQRRjyHZ0aSDao8VZMh+F12zAd0EAAAAAAAAAYLxCAAAAAAAAWDjFgAAAAAAAbKkeQIAAAAAAaowAAAAAAAAAY/f////////AAAAAe3FfpKhZkk9E4ZlwFSFEmXchAsvmwHVTjGQOBC+69TDAQ8hIQABAAGAhB4AAAAAAAGAhB4AAAAAAAGq2EwDAAAAAAE10NxKUa97dfc1auP2TjQAqOAgggM7dWBcCJ9gI3Fn5AGbdFQAAQEBoNcmAgAAAAABYOMWAAAAAAABsqR5AgAAAABAiupxBgAAAA==";

    /** Log messages of a fill transaction: only the third line carries an event. */
    public static final List<String> FILL_TX_LOGS = List.of(
            "Program ComputeBudget111111111111111111111111111111 invoke [1]",
            "Program log: Instruction: FillPerpOrder",
            FILL_LOG_LINE,
            "Program dRiftyHA39MWEi3m9aunc5MzRF1JYuBsbn6VPcn33UH success");

    private DriftEventFixtures() {
    }

    /** Decoded form of {@link #FILL_LOG_LINE}. */
    public static OrderActionRecord fillRecord() {
        return new OrderActionRecord(
                1685504150L,
                OrderAction.FILL,
                OrderActionExplanation.ORDER_FILLED_WITH_MATCH,
                1,
                MarketType.PERP,
                "6PRKTZiooHi2qdBb5raxJnVvjfBhrfcDWKvfbWt2oR5C",
                BigInteger.valueOf(1245),
                BigInteger.valueOf(586114),
                BigInteger.valueOf(1500000),
                BigInteger.valueOf(41526450),
                BigInteger.valueOf(12458),
                -8305L,
                null,
                null,
                null,
                "H1AHngDKHCSZe4Xsw7Yk4SV5RP9agaaDhQmwTjRzhXFG",
                2171151L,
                PositionDirection.LONG,
                BigInteger.valueOf(2000000),
                BigInteger.valueOf(2000000),
                BigInteger.valueOf(55367850),
                "4d5KsDvVn25So6EqM6KhgJyyUbG11SaBjzDRL1FqzmRV",
                5534875L,
                PositionDirection.SHORT,
                BigInteger.valueOf(36100000),
                BigInteger.valueOf(1500000),
                BigInteger.valueOf(41526450),
                27681000000L);
    }

    public static OrderRecord placeRecord() {
        Order order = new Order(
                new BigInteger("199999999"),
                BigInteger.valueOf(27_500_000_000L),
                BigInteger.valueOf(1_000_000),
                BigInteger.ZERO,
                BigInteger.ZERO,
                BigInteger.ZERO,
                -15L,
                25L,
                1685504210L,
                -2000,
                4_294_967_295L,
                1,
                OrderStatus.OPEN,
                OrderType.LIMIT,
                MarketType.PERP,
                7,
                PositionDirection.LONG,
                PositionDirection.SHORT,
                false,
                true,
                false,
                OrderTriggerCondition.ABOVE,
                10);
        return new OrderRecord(1685504150L, "H1AHngDKHCSZe4Xsw7Yk4SV5RP9agaaDhQmwTjRzhXFG", order);
    }
}
