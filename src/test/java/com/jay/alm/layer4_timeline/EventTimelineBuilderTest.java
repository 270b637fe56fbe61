package com.jay.alm.layer4_timeline;

import com.jay.alm.TestData;
import com.jay.alm.config.AlmConfig;
import com.jay.alm.layer1_ingest.FxRateService;
import com.jay.alm.layer2_assignment.AssignmentPairDetector;
import com.jay.alm.model.CashTransaction;
import com.jay.alm.model.FinancialEvent;
import com.jay.alm.model.IngestionResult;
import com.jay.alm.model.Ledger;
import com.jay.alm.model.NavSnapshot;
import com.jay.alm.model.OpenPosition;
import com.jay.alm.model.TradeExecution;
import com.jay.alm.model.enums.EventKind;
import com.jay.alm.model.enums.OptionRight;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static com.jay.alm.TestData.*;
import static org.assertj.core.api.Assertions.*;

class EventTimelineBuilderTest {

    private AlmConfig config;
    private EventTimelineBuilder builder;
    private AssignmentPairDetector detector;

    @BeforeEach
    void setUp() {
        config = TestData.usdConfig();
        builder = new EventTimelineBuilder(config, new FxRateService(config));
        detector = new AssignmentPairDetector(config);
    }

    private Ledger build(List<TradeExecution> trades, List<CashTransaction> cash, List<NavSnapshot> nav) {
        IngestionResult input = new IngestionResult(trades, cash, nav, List.of());
        return builder.build(input, detector.detect(trades));
    }

    private static List<TradeExecution> sampleTrades() {
        return List.of(
            option("T1", "2025-06-10T10:15:00", "SPY", "622", OptionRight.PUT, "-1", "1.50", "-1.05", "0"),
            stock("T2", "2025-06-10T11:00:00", "AAPL", "10", "200", "-1.00"),
            stock("T3", "2025-06-11T10:00:00", "AAPL", "-10", "205", "-1.00"),
            stockBooking("A1", "2025-06-11T16:20:00", "SPY", "100", "622"),
            optionBooking("A2", "2025-06-11T16:20:00", "SPY", "622", OptionRight.PUT, "1", "148.95"),
            optionBooking("E1", "2025-06-11T16:30:00", "SPY", "630", OptionRight.CALL, "1", "75.00"));
    }

    private static List<CashTransaction> sampleCash() {
        return List.of(deposit("C1", "2025-06-10T08:00:00", "10000"));
    }

    private static List<NavSnapshot> sampleNav() {
        return List.of(nav("2025-06-10", "2025-06-10", "50000", "58147.95", "10000"));
    }

    @Nested
    @DisplayName("build() — full mode")
    class Full {

        @Test
        @DisplayName("events ordered by timestamp, running NAV seeded from the earliest snapshot")
        void orderedWithRunningNav() {
            Ledger ledger = build(sampleTrades(), sampleCash(), sampleNav());

            assertThat(ledger.seedNav()).isEqualByComparingTo("50000.00");
            assertThat(ledger.events()).extracting(FinancialEvent::sourceTransactionId)
                .containsExactly("C1", "T1", "T2", "T3", "A1", "A2", "E1");
            assertThat(ledger.events()).extracting(FinancialEvent::runningNav).containsExactly(
                d("60000.00"), d("60148.95"), d("58147.95"), d("60246.95"),
                d("-1953.05"), d("-1804.10"), d("-1729.10"));
        }

        @Test
        @DisplayName("running NAV obeys nav(i) = nav(i-1) + cash(i) + pnl(i)")
        void conservation() {
            Ledger ledger = build(sampleTrades(), sampleCash(), sampleNav());

            BigDecimal previous = ledger.seedNav();
            for (FinancialEvent e : ledger.events()) {
                assertThat(e.runningNav()).isEqualByComparingTo(previous.add(e.cashImpact()).add(e.realizedPnl()));
                previous = e.runningNav();
            }
            BigDecimal totalDelta = ledger.events().stream().map(FinancialEvent::navDelta)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
            assertThat(ledger.finalNav().subtract(ledger.seedNav())).isEqualByComparingTo(totalDelta);
        }

        @Test
        @DisplayName("identical input yields an equal ledger")
        void deterministic() {
            assertThat(build(sampleTrades(), sampleCash(), sampleNav()))
                .isEqualTo(build(sampleTrades(), sampleCash(), sampleNav()));
        }

        @Test
        @DisplayName("same-timestamp events are ordered by transaction id")
        void tieBreakByTransactionId() {
            Ledger ledger = build(List.of(
                    stock("Z9", "2025-06-10T10:00:00", "AAPL", "1", "200", "0"),
                    stock("A0", "2025-06-10T10:00:00", "MSFT", "1", "450", "0")),
                List.of(), List.of());

            assertThat(ledger.events()).extracting(FinancialEvent::sourceTransactionId).containsExactly("A0", "Z9");
        }

        @Test
        @DisplayName("stock close takes realized P&L from the tracker, not the reported value")
        void trackerPnl() {
            Ledger ledger = build(sampleTrades(), sampleCash(), sampleNav());

            FinancialEvent close = ledger.events().get(3);
            assertThat(close.kind()).isEqualTo(EventKind.TRADE);
            assertThat(close.realizedPnl()).isEqualByComparingTo("50.00");
            assertThat(close.cashImpact()).isEqualByComparingTo("2049.00");
            assertThat(close.linkedPositionId()).isEqualTo("POS-T2");
        }

        @Test
        @DisplayName("assignment: stock leg opens a position with zero P&L, option leg links to it")
        void assignmentEvents() {
            Ledger ledger = build(sampleTrades(), sampleCash(), sampleNav());

            FinancialEvent stockLeg = ledger.events().get(4);
            FinancialEvent optionLeg = ledger.events().get(5);
            assertThat(stockLeg.kind()).isEqualTo(EventKind.ASSIGNMENT);
            assertThat(stockLeg.realizedPnl()).isEqualByComparingTo("0");
            assertThat(stockLeg.cashImpact()).isEqualByComparingTo("-62200.00");
            assertThat(optionLeg.kind()).isEqualTo(EventKind.ASSIGNMENT);
            assertThat(optionLeg.linkedTransactionId()).isEqualTo("A1");
            assertThat(optionLeg.linkedPositionId()).isEqualTo("POS-A1");
            assertThat(optionLeg.realizedPnl()).isEqualByComparingTo("148.95");

            assertThat(ledger.openPositions()).extracting(OpenPosition::getPositionId).containsExactly("POS-A1");
        }

        @Test
        @DisplayName("expiration: zero cash impact, reported P&L")
        void expirationEvent() {
            Ledger ledger = build(sampleTrades(), sampleCash(), sampleNav());

            FinancialEvent expiry = ledger.events().get(6);
            assertThat(expiry.kind()).isEqualTo(EventKind.EXPIRATION);
            assertThat(expiry.cashImpact()).isEqualByComparingTo("0");
            assertThat(expiry.realizedPnl()).isEqualByComparingTo("75.00");
        }

        @Test
        @DisplayName("ambiguous bookings are left out of the ledger and listed")
        void unresolvedExcluded() {
            List<TradeExecution> trades = List.of(
                stockBooking("S1", "2025-06-11T16:20:00", "SPY", "-100", "622"),
                stockBooking("S2", "2025-06-11T16:20:00", "QQQ", "100", "530"),
                stock("T1", "2025-06-11T10:00:00", "AAPL", "1", "200", "0"));

            Ledger ledger = build(trades, List.of(), List.of());

            assertThat(ledger.events()).extracting(FinancialEvent::sourceTransactionId).containsExactly("T1");
            assertThat(ledger.unresolved()).extracting(TradeExecution::transactionId).containsExactly("S1", "S2");
            assertThat(ledger.ambiguousGroups()).hasSize(1);
        }

        @Test
        @DisplayName("without any snapshot or fallback the seed is unknown and NAV starts at zero")
        void unknownSeed() {
            Ledger ledger = build(List.of(stock("T1", "2025-06-10T10:00:00", "AAPL", "1", "200", "0")),
                List.of(), List.of());

            assertThat(ledger.seedKnown()).isFalse();
            assertThat(ledger.events().get(0).runningNav()).isEqualByComparingTo("-200.00");
        }

        @Test
        @DisplayName("configured fallback seeds the NAV when no snapshot exists")
        void fallbackSeed() {
            config.reporting().setOpeningNavFallback(d("1000"));

            Ledger ledger = build(List.of(stock("T1", "2025-06-10T10:00:00", "AAPL", "1", "200", "0")),
                List.of(), List.of());

            assertThat(ledger.seedNav()).isEqualByComparingTo("1000.00");
            assertThat(ledger.finalNav()).isEqualByComparingTo("800.00");
        }

        @Test
        @DisplayName("amounts are converted with the record's own FX rate")
        void fxConversion() {
            AlmConfig hkd = new AlmConfig();
            EventTimelineBuilder hkdBuilder = new EventTimelineBuilder(hkd, new FxRateService(hkd));
            TradeExecution buy = stock("T1", "2025-06-10T10:00:00", "AAPL", "10", "200", "-1")
                .toBuilder().fxRateToBase(d("7.8")).build();
            IngestionResult input = new IngestionResult(List.of(buy), List.of(), List.of(), List.of());

            Ledger ledger = hkdBuilder.build(input, detector.detect(input.trades()));

            FinancialEvent e = ledger.events().get(0);
            assertThat(e.fxRate()).isEqualByComparingTo("7.8");
            assertThat(e.cashImpact()).isEqualByComparingTo("-15607.80");
            assertThat(e.commission()).isEqualByComparingTo("-7.80");
        }
    }

    @Nested
    @DisplayName("aggregate deposit/withdrawal supplement")
    class AggregateCashFlow {

        @Test
        @DisplayName("snapshot deposits without a cash record become a synthetic event at 00:00")
        void synthesizesMissingDeposit() {
            Ledger ledger = build(List.of(), List.of(), sampleNav());

            assertThat(ledger.events()).singleElement().satisfies(e -> {
                assertThat(e.sourceTransactionId()).isEqualTo("AGGREGATE-DW-2025-06-10-2025-06-10");
                assertThat(e.synthetic()).isTrue();
                assertThat(e.timestamp()).isEqualTo(ny("2025-06-10T00:00:00"));
                assertThat(e.cashImpact()).isEqualByComparingTo("10000.00");
            });
        }

        @Test
        @DisplayName("nothing is synthesized when the cash feed has the deposit")
        void realDepositWins() {
            Ledger ledger = build(List.of(), sampleCash(), sampleNav());

            assertThat(ledger.events()).extracting(FinancialEvent::synthetic).containsExactly(false);
        }

        @Test
        @DisplayName("a month snapshot does not repeat deposits already supplied for its days")
        void shorterPeriodsFirst() {
            List<NavSnapshot> snapshots = List.of(
                nav("2025-06-01", "2025-06-11", "40000", "50000", "10000"),
                nav("2025-06-10", "2025-06-10", "50000", "60000", "10000"));

            Ledger ledger = build(List.of(), List.of(), snapshots);

            assertThat(ledger.events()).extracting(FinancialEvent::sourceTransactionId)
                .containsExactly("AGGREGATE-DW-2025-06-10-2025-06-10");
        }

        @Test
        @DisplayName("can be switched off")
        void disabled() {
            config.ledger().setSynthesizeAggregateCashFlow(false);
            assertThat(build(List.of(), List.of(), sampleNav()).events()).isEmpty();
        }
    }

    @Nested
    @DisplayName("append() — incremental mode")
    class Append {

        @Test
        @DisplayName("emits only unseen ids and continues from the last persisted NAV")
        void appendsNewOnly() {
            List<TradeExecution> dayOne = sampleTrades().subList(0, 2);
            Ledger persisted = build(dayOne, sampleCash(), sampleNav());
            IngestionResult everything = new IngestionResult(sampleTrades(), sampleCash(), sampleNav(), List.of());

            Ledger appended = builder.append(everything, detector.detect(everything.trades()),
                persisted.events(), persisted.openPositions());

            assertThat(appended.events()).extracting(FinancialEvent::sourceTransactionId)
                .containsExactly("T3", "A1", "A2", "E1");
            assertThat(appended.seedNav()).isEqualByComparingTo("58147.95");
            assertThat(appended.finalNav()).isEqualByComparingTo(build(sampleTrades(), sampleCash(), sampleNav()).finalNav());
        }

        @Test
        @DisplayName("restored positions give the same realized P&L as a full build")
        void restoredPositions() {
            Ledger persisted = build(sampleTrades().subList(0, 2), sampleCash(), sampleNav());
            IngestionResult everything = new IngestionResult(sampleTrades(), sampleCash(), sampleNav(), List.of());

            Ledger appended = builder.append(everything, detector.detect(everything.trades()),
                persisted.events(), persisted.openPositions());

            assertThat(appended.events().get(0).realizedPnl()).isEqualByComparingTo("50.00");
        }

        @Test
        @DisplayName("back-dated events are still appended after the persisted ledger")
        void backDated() {
            Ledger persisted = build(List.of(stock("T5", "2025-06-12T10:00:00", "MSFT", "1", "450", "0")),
                List.of(), sampleNav());
            List<TradeExecution> trades = List.of(
                stock("T5", "2025-06-12T10:00:00", "MSFT", "1", "450", "0"),
                stock("T4", "2025-06-11T10:00:00", "AAPL", "1", "200", "0"));
            IngestionResult input = new IngestionResult(trades, List.of(), sampleNav(), List.of());

            Ledger appended = builder.append(input, detector.detect(trades), persisted.events(), persisted.openPositions());

            assertThat(appended.events()).singleElement().satisfies(e -> {
                assertThat(e.sourceTransactionId()).isEqualTo("T4");
                assertThat(e.runningNav()).isEqualByComparingTo(persisted.finalNav().subtract(d("200")));
            });
        }

        @Test
        @DisplayName("nothing new → nothing emitted")
        void idempotent() {
            Ledger persisted = build(sampleTrades(), sampleCash(), sampleNav());
            IngestionResult everything = new IngestionResult(sampleTrades(), sampleCash(), sampleNav(), List.of());

            Ledger appended = builder.append(everything, detector.detect(everything.trades()),
                persisted.events(), persisted.openPositions());

            assertThat(appended.events()).isEmpty();
        }
    }
}
