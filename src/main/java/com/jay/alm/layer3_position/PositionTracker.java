package com.jay.alm.layer3_position;

import com.jay.alm.model.Money;
import com.jay.alm.model.OpenPosition;
import com.jay.alm.model.PositionOutcome;
import com.jay.alm.model.TradeExecution;
import com.jay.alm.model.enums.PositionStatus;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Layer 3 — Position Tracker.
 * Per-symbol FIFO queues of open stock lots for one pipeline run.
 *
 * A stock event closes the open lots of its symbol that are opposite in sign to it, oldest
 * first: realized P&L per lot = (exit price − entry price) × closed quantity × sign(lot) × fx.
 * A symbol can hold long and short lots at once (assignment deliveries never net), so
 * same-sign lots are skipped rather than ending the match.
 * A lot consumed in full is CLOSED, one consumed in part stays OPEN with a reduced
 * {@code openQuantity}, and any unmatched remainder opens a new lot.
 * Assignment deliveries always open a new lot with zero realized P&L.
 *
 * Not thread-safe; create one tracker per run.
 */
@Slf4j
public class PositionTracker {

    private final Map<String, Deque<OpenPosition>> openBySymbol = new HashMap<>();
    private final Map<String, OpenPosition> touched = new LinkedHashMap<>();

    public PositionTracker() {}

    public PositionTracker(Collection<OpenPosition> openPositions) {
        restore(openPositions);
    }

    /** Rehydrates open lots persisted by an earlier run. Lots must be given in entry order. */
    public void restore(Collection<OpenPosition> openPositions) {
        for (OpenPosition p : openPositions) {
            if (!p.isOpen()) continue;
            OpenPosition lot = p.copy();
            if (lot.getOpenQuantity() == null) lot.setOpenQuantity(lot.getQuantity());
            openBySymbol.computeIfAbsent(lot.getSymbol(), k -> new ArrayDeque<>()).addLast(lot);
            touched.put(lot.getPositionId(), lot);
        }
        if (!openPositions.isEmpty()) {
            log.info("PositionTracker: restored {} open lot(s)", openBySymbol.values().stream().mapToInt(Deque::size).sum());
        }
    }

    /** Applies an ordinary stock trade: closes opposite lots FIFO, opens any remainder. */
    public PositionOutcome apply(TradeExecution trade, BigDecimal fxRate) {
        BigDecimal remaining = trade.quantity();
        Deque<OpenPosition> queue = openBySymbol.computeIfAbsent(trade.symbol(), k -> new ArrayDeque<>());
        List<OpenPosition> closed = new ArrayList<>();
        List<OpenPosition> reduced = new ArrayList<>();
        BigDecimal realized = Money.ZERO;

        Iterator<OpenPosition> lots = queue.iterator();
        while (remaining.signum() != 0 && lots.hasNext()) {
            OpenPosition lot = lots.next();
            if (lot.getOpenQuantity().signum() == remaining.signum()) continue;
            BigDecimal lotSign = BigDecimal.valueOf(lot.getOpenQuantity().signum());
            BigDecimal closeQty = remaining.abs().min(lot.getOpenQuantity().abs());

            BigDecimal pnl = Money.of(trade.tradePrice().subtract(lot.getEntryPrice())
                .multiply(closeQty).multiply(lotSign).multiply(fxRate));
            realized = realized.add(pnl);
            lot.setRealizedPnl(Money.of(lot.getRealizedPnl().add(pnl)));
            lot.setOpenQuantity(lot.getOpenQuantity().subtract(closeQty.multiply(lotSign)));
            remaining = remaining.add(closeQty.multiply(lotSign));

            if (lot.getOpenQuantity().signum() == 0) {
                lot.setStatus(PositionStatus.CLOSED);
                lot.setExitPrice(trade.tradePrice());
                lot.setExitTimestamp(trade.timestamp());
                lot.setExitTransactionId(trade.transactionId());
                lots.remove();
                closed.add(lot.copy());
                log.debug("Closed {} {} @ {} → P&L {}", lot.getPositionId(), lot.getSymbol(), trade.tradePrice(), lot.getRealizedPnl());
            } else {
                reduced.add(lot.copy());
            }
        }

        OpenPosition opened = null;
        if (remaining.signum() != 0) {
            opened = open(trade, remaining, fxRate, false);
        }
        return new PositionOutcome(closed, reduced, opened, realized);
    }

    /** Opens the lot delivered by an option assignment. Never closes anything. */
    public PositionOutcome openFromAssignment(TradeExecution stockLeg, BigDecimal fxRate) {
        OpenPosition opened = open(stockLeg, stockLeg.quantity(), fxRate, true);
        log.info("Opened {} from assignment: {} {} @ {}", opened.getPositionId(),
            opened.getQuantity(), opened.getSymbol(), opened.getEntryPrice());
        return new PositionOutcome(List.of(), List.of(), opened, Money.ZERO);
    }

    /** Every lot opened, restored or closed by this tracker, in entry order. */
    public List<OpenPosition> positions() {
        return touched.values().stream().map(OpenPosition::copy).toList();
    }

    public List<OpenPosition> openPositions() {
        return touched.values().stream().filter(OpenPosition::isOpen).map(OpenPosition::copy).toList();
    }

    public BigDecimal openQuantity(String symbol) {
        return openBySymbol.getOrDefault(symbol, new ArrayDeque<>()).stream()
            .map(OpenPosition::getOpenQuantity)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private OpenPosition open(TradeExecution trade, BigDecimal quantity, BigDecimal fxRate, boolean fromAssignment) {
        OpenPosition lot = OpenPosition.builder()
            .positionId(OpenPosition.idFor(trade.transactionId()))
            .symbol(trade.symbol())
            .quantity(quantity)
            .openQuantity(quantity)
            .entryPrice(trade.tradePrice())
            .entryTimestamp(trade.timestamp())
            .entryTransactionId(trade.transactionId())
            .fxRateAtEntry(fxRate)
            .fromAssignment(fromAssignment)
            .build();
        openBySymbol.computeIfAbsent(trade.symbol(), k -> new ArrayDeque<>()).addLast(lot);
        touched.put(lot.getPositionId(), lot);
        return lot.copy();
    }
}
