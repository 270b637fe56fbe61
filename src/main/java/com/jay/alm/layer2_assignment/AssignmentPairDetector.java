package com.jay.alm.layer2_assignment;

import com.jay.alm.config.AlmConfig;
import com.jay.alm.model.AmbiguousAssignmentGroup;
import com.jay.alm.model.AssignmentDetection;
import com.jay.alm.model.OptionLifecycleEvent;
import com.jay.alm.model.TradeExecution;
import com.jay.alm.model.enums.BookingClassification;
import com.jay.alm.model.enums.OptionEventType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * Layer 2 — Assignment Pair Detector.
 *
 * The broker books an option assignment as simultaneous {@code BookTrade} legs: the stock
 * delivery and the option removal, with the same timestamp. Expirations are option-only
 * bookings. Legs are bucketed by exact timestamp, then each bucket is classified:
 *   one stock leg + option legs  → ASSIGNMENT (option legs linked to the stock leg)
 *   several stock legs           → UNRESOLVED, reported as an ambiguous group
 *   option legs only             → EXPIRATION, unless a lone stock leg of the same underlying
 *                                  was booked the same day (see below)
 *   a lone stock leg             → not classified, handled as an ordinary trade
 *
 * When the exercises-and-expiries statement is available it settles the cases the timestamps
 * cannot: a multi-stock bucket whose delivery the statement names exactly once is paired, and
 * an option-only bucket with same-day stock legs is an expiration or an assignment as the
 * statement says. Without a statement such a bucket is left for review.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AssignmentPairDetector {

    private final AlmConfig config;

    public AssignmentDetection detect(Collection<TradeExecution> trades) {
        return detect(trades, List.of());
    }

    public AssignmentDetection detect(Collection<TradeExecution> trades, Collection<OptionLifecycleEvent> brokerEvents) {
        ZoneId zone = config.feeds().sourceZoneId();
        BrokerStatement statement = new BrokerStatement(brokerEvents);

        // Pass 1: index BookTrade legs by timestamp
        NavigableMap<Instant, List<TradeExecution>> byTimestamp = new TreeMap<>();
        for (TradeExecution t : trades) {
            if (!t.isBookTrade()) continue;
            byTimestamp.computeIfAbsent(t.timestamp(), k -> new ArrayList<>()).add(t);
        }

        // Pass 2: lone stock legs per day and underlying
        Map<DayKey, List<TradeExecution>> loneStockLegs = new HashMap<>();
        for (List<TradeExecution> legs : byTimestamp.values()) {
            if (legs.size() == 1 && legs.get(0).isStock()) {
                TradeExecution leg = legs.get(0);
                loneStockLegs.computeIfAbsent(DayKey.of(leg, zone), k -> new ArrayList<>()).add(leg);
            }
        }

        // Pass 3: reduce each bucket
        Map<String, BookingClassification> classifications = new LinkedHashMap<>();
        Map<String, String> optionToStock = new LinkedHashMap<>();
        List<AmbiguousAssignmentGroup> ambiguous = new ArrayList<>();
        Set<String> pairedAcrossBuckets = new HashSet<>();

        for (Map.Entry<Instant, List<TradeExecution>> bucket : byTimestamp.entrySet()) {
            Instant at = bucket.getKey();
            List<TradeExecution> legs = new ArrayList<>(bucket.getValue());
            legs.sort(Comparator.comparing(TradeExecution::transactionId));
            List<TradeExecution> stockLegs = legs.stream().filter(TradeExecution::isStock).toList();
            List<TradeExecution> optionLegs = legs.stream().filter(TradeExecution::isOption).toList();

            if (stockLegs.size() == 1 && !optionLegs.isEmpty()) {
                pair(stockLegs.get(0), optionLegs, classifications, optionToStock);
                log.info("Assignment detected at {}: stock {} ({} {}) with {} option leg(s)",
                    at, stockLegs.get(0).transactionId(), stockLegs.get(0).quantity(), stockLegs.get(0).symbol(),
                    optionLegs.size());
            } else if (stockLegs.size() > 1) {
                List<TradeExecution> delivered = optionLegs.isEmpty() ? List.of()
                    : stockLegs.stream().filter(s -> statement.delivered(s, zone)).toList();
                if (delivered.size() == 1) {
                    pair(delivered.get(0), optionLegs, classifications, optionToStock);
                    log.info("Booking group at {} settled by the exercises statement: stock {} with {} option leg(s)",
                        at, delivered.get(0).transactionId(), optionLegs.size());
                } else {
                    markUnresolved(at, stockLegs, optionLegs, classifications, ambiguous);
                    log.warn("Ambiguous booking group at {}: {} stock legs, {} option legs — left for review",
                        at, stockLegs.size(), optionLegs.size());
                }
            } else if (stockLegs.isEmpty() && !optionLegs.isEmpty()) {
                Map<String, List<TradeExecution>> byUnderlying = new LinkedHashMap<>();
                for (TradeExecution o : optionLegs) {
                    byUnderlying.computeIfAbsent(normalize(o.underlyingSymbol()), k -> new ArrayList<>()).add(o);
                }
                for (List<TradeExecution> group : byUnderlying.values()) {
                    List<TradeExecution> candidates = loneStockLegs
                        .getOrDefault(DayKey.of(group.get(0), zone), List.of()).stream()
                        .filter(s -> !pairedAcrossBuckets.contains(s.transactionId()))
                        .toList();
                    reduceOptionOnly(at, group, candidates, statement, zone,
                        classifications, optionToStock, ambiguous, pairedAcrossBuckets);
                }
            }
        }
        return new AssignmentDetection(classifications, optionToStock, List.copyOf(ambiguous));
    }

    private void reduceOptionOnly(Instant at, List<TradeExecution> optionLegs, List<TradeExecution> candidates,
                                  BrokerStatement statement, ZoneId zone,
                                  Map<String, BookingClassification> classifications,
                                  Map<String, String> optionToStock,
                                  List<AmbiguousAssignmentGroup> ambiguous,
                                  Set<String> pairedAcrossBuckets) {
        OptionEventType stated = optionLegs.stream()
            .map(o -> statement.stated(o, zone))
            .filter(Objects::nonNull)
            .findFirst()
            .orElse(null);

        if (candidates.isEmpty() || stated == OptionEventType.EXPIRATION) {
            optionLegs.forEach(o -> classifications.put(o.transactionId(), BookingClassification.EXPIRATION));
            if (stated != null && stated.delivers()) {
                log.warn("Exercises statement reports {} for {} but no stock delivery was booked that day — kept as expiration",
                    stated, optionLegs.get(0).symbol());
            } else {
                log.debug("Expiration at {}: {} option leg(s){}", at, optionLegs.size(),
                    stated == OptionEventType.EXPIRATION ? " (confirmed by statement)" : "");
            }
            return;
        }

        if (stated != null && stated.delivers()) {
            List<TradeExecution> delivered = candidates.stream().filter(s -> statement.delivered(s, zone)).toList();
            TradeExecution stockLeg = delivered.size() == 1 ? delivered.get(0)
                : candidates.size() == 1 ? candidates.get(0) : null;
            if (stockLeg != null) {
                pair(stockLeg, optionLegs, classifications, optionToStock);
                pairedAcrossBuckets.add(stockLeg.transactionId());
                log.info("{} at {} paired with stock {} booked at {} per the exercises statement",
                    stated, at, stockLeg.transactionId(), stockLeg.timestamp());
                return;
            }
        }

        markUnresolved(at, candidates, optionLegs, classifications, ambiguous);
        log.warn("Option booking at {} has {} same-day stock leg(s) in {} at other times — left for review",
            at, candidates.size(), optionLegs.get(0).underlyingSymbol());
    }

    private static void pair(TradeExecution stockLeg, List<TradeExecution> optionLegs,
                             Map<String, BookingClassification> classifications,
                             Map<String, String> optionToStock) {
        String stockId = stockLeg.transactionId();
        classifications.put(stockId, BookingClassification.ASSIGNMENT);
        for (TradeExecution option : optionLegs) {
            classifications.put(option.transactionId(), BookingClassification.ASSIGNMENT);
            optionToStock.put(option.transactionId(), stockId);
        }
    }

    private static void markUnresolved(Instant at, List<TradeExecution> stockLegs, List<TradeExecution> optionLegs,
                                       Map<String, BookingClassification> classifications,
                                       List<AmbiguousAssignmentGroup> ambiguous) {
        Stream.concat(stockLegs.stream(), optionLegs.stream())
            .forEach(t -> classifications.put(t.transactionId(), BookingClassification.UNRESOLVED));
        ambiguous.add(new AmbiguousAssignmentGroup(at,
            stockLegs.stream().map(TradeExecution::transactionId).toList(),
            optionLegs.stream().map(TradeExecution::transactionId).toList()));
    }

    /** Broker symbols pad option codes with runs of spaces that vary between extracts. */
    static String normalize(String symbol) {
        return symbol == null ? "" : symbol.trim().replaceAll("\\s+", " ").toUpperCase();
    }

    private record DayKey(LocalDate date, String underlying) {
        static DayKey of(TradeExecution t, ZoneId zone) {
            return new DayKey(t.timestamp().atZone(zone).toLocalDate(), normalize(t.underlyingSymbol()));
        }
    }

    /** Lookups over the exercises-and-expiries rows. */
    private static final class BrokerStatement {

        private final Map<LocalDate, List<OptionLifecycleEvent>> byDate = new HashMap<>();

        BrokerStatement(Collection<OptionLifecycleEvent> events) {
            for (OptionLifecycleEvent e : events) {
                if (e.date() == null || e.type() == null) continue;
                byDate.computeIfAbsent(e.date(), k -> new ArrayList<>()).add(e);
            }
        }

        /** What the statement says happened to this option on its booking day, or null. */
        OptionEventType stated(TradeExecution optionLeg, ZoneId zone) {
            String symbol = normalize(optionLeg.symbol());
            return rowsOn(optionLeg, zone)
                .filter(e -> !e.type().isStockDelivery())
                .filter(e -> normalize(e.symbol()).equals(symbol))
                .map(OptionLifecycleEvent::type)
                .findFirst()
                .orElse(null);
        }

        /** Whether the statement lists this stock leg as a delivery (same symbol and signed quantity). */
        boolean delivered(TradeExecution stockLeg, ZoneId zone) {
            String symbol = normalize(stockLeg.symbol());
            return rowsOn(stockLeg, zone)
                .filter(e -> e.type().isStockDelivery())
                .filter(e -> normalize(e.symbol()).equals(symbol))
                .anyMatch(e -> sameQuantity(e.quantity(), stockLeg.quantity()));
        }

        private Stream<OptionLifecycleEvent> rowsOn(TradeExecution t, ZoneId zone) {
            return byDate.getOrDefault(t.timestamp().atZone(zone).toLocalDate(), List.of()).stream();
        }

        private static boolean sameQuantity(BigDecimal a, BigDecimal b) {
            return a != null && b != null && a.compareTo(b) == 0;
        }
    }
}
