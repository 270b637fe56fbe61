package com.jay.alm.layer1_ingest;

import com.jay.alm.TestData;
import com.jay.alm.config.AlmConfig;
import com.jay.alm.exception.FeedParseException;
import com.jay.alm.model.DuplicateConflict;
import com.jay.alm.model.CashTransaction;
import com.jay.alm.model.IngestionResult;
import com.jay.alm.model.OptionLifecycleEvent;
import com.jay.alm.model.TradeExecution;
import com.jay.alm.model.enums.OptionEventType;
import com.jay.alm.model.enums.SourceType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static com.jay.alm.TestData.stock;
import static org.assertj.core.api.Assertions.*;

class FeedIngestorTest {

    private final Path feeds = TestData.feedsDir();
    private FeedIngestor ingestor;

    @BeforeEach
    void setUp() {
        AlmConfig config = new AlmConfig();
        ingestor = new FeedIngestor(new FlexFeedParser(config), config);
    }

    @AfterEach
    void tearDown() {
        ingestor.shutdown();
    }

    private FeedLocator.FeedFiles fixtureFiles() {
        return new FeedLocator.FeedFiles(
            List.of(feeds.resolve("Trades_1_MTD.xml"), feeds.resolve("Trades_2_LBD.xml")),
            List.of(feeds.resolve("Cash_Transactions_MTD.xml")),
            List.of(feeds.resolve("NAV_MTD.xml")));
    }

    @Nested
    @DisplayName("merge() — deduplication")
    class Dedup {

        @Test
        @DisplayName("identical duplicates collapse to one record without a conflict")
        void identicalDuplicatesCollapse() {
            TradeExecution t = stock("T1", "2025-06-10T10:00:00", "AAPL", "10", "200", "-1");
            IngestionResult result = ingestor.merge(
                List.of(new FeedIngestor.Extract<>("mtd", List.of(t)), new FeedIngestor.Extract<>("lbd", List.of(t))),
                List.of(), List.of());

            assertThat(result.trades()).containsExactly(t);
            assertThat(result.conflicts()).isEmpty();
        }

        @Test
        @DisplayName("differing duplicates keep the first seen and report a conflict")
        void firstSeenWins() {
            TradeExecution first = stock("T1", "2025-06-10T10:00:00", "AAPL", "10", "200", "-1");
            TradeExecution second = first.toBuilder().commission(TestData.d("-1.5")).build();
            IngestionResult result = ingestor.merge(
                List.of(new FeedIngestor.Extract<>("mtd", List.of(first)),
                        new FeedIngestor.Extract<>("lbd", List.of(second))),
                List.of(), List.of());

            assertThat(result.trades()).containsExactly(first);
            assertThat(result.conflicts()).containsExactly(
                new DuplicateConflict(SourceType.TRADE, "T1", "mtd", "lbd"));
        }

        @Test
        @DisplayName("the same id in different source types is not a duplicate")
        void keyedBySourceType() {
            IngestionResult result = ingestor.merge(
                List.of(new FeedIngestor.Extract<>("t", List.of(stock("X", "2025-06-10T10:00:00", "AAPL", "1", "1", "0")))),
                List.of(new FeedIngestor.Extract<>("c", List.of(TestData.deposit("X", "2025-06-10T08:00:00", "5")))),
                List.of());
            assertThat(result.recordCount()).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("ingest() — parallel parse with barrier")
    class Ingest {

        @Test
        @DisplayName("overlapping MTD and LBD extracts merge into unique records")
        void overlappingExtracts() {
            IngestionResult result = ingestor.ingest(fixtureFiles());

            assertThat(result.trades()).extracting(TradeExecution::transactionId)
                .containsExactly("T1", "T2", "T3", "A1", "A2", "E1");
            assertThat(result.cashTransactions()).hasSize(1);
            assertThat(result.navSnapshots()).hasSize(2);
        }

        @Test
        @DisplayName("T2 differs in commission between extracts — MTD value kept")
        void conflictFromFixtures() {
            IngestionResult result = ingestor.ingest(fixtureFiles());

            assertThat(result.conflicts()).singleElement()
                .satisfies(c -> {
                    assertThat(c.transactionId()).isEqualTo("T2");
                    assertThat(c.keptFrom()).isEqualTo("Trades_1_MTD.xml");
                    assertThat(c.discardedFrom()).isEqualTo("Trades_2_LBD.xml");
                });
            TradeExecution t2 = result.trades().get(1);
            assertThat(t2.commission()).isEqualByComparingTo("-1.00");
        }

        @Test
        @DisplayName("repeated exercise rows collapse on symbol, date, type and trade id")
        void optionEventsDeduplicated() {
            FeedLocator.FeedFiles base = fixtureFiles();
            FeedLocator.FeedFiles files = new FeedLocator.FeedFiles(base.trades(), base.cash(), base.nav(),
                List.of(feeds.resolve("Exercises_and_Expiries_MTD.xml")), List.of());

            IngestionResult result = ingestor.ingest(files);

            assertThat(result.optionEvents()).extracting(OptionLifecycleEvent::type)
                .containsExactly(OptionEventType.ASSIGNMENT, OptionEventType.BUY, OptionEventType.EXPIRATION);
            assertThat(result.conflicts()).extracting(DuplicateConflict::sourceType).containsOnly(SourceType.TRADE);
        }

        @Test
        @DisplayName("interest accruals join the cash feed")
        void interestJoinsCash() {
            FeedLocator.FeedFiles base = fixtureFiles();
            FeedLocator.FeedFiles files = new FeedLocator.FeedFiles(base.trades(), base.cash(), base.nav(),
                List.of(), List.of(feeds.resolve("extras/Interest_Accruals_MTD.xml")));

            IngestionResult result = ingestor.ingest(files);

            assertThat(result.cashTransactions()).extracting(CashTransaction::transactionId)
                .containsExactly("C1", "INT-2025-06-11-USD");
            assertThat(result.optionEvents()).isEmpty();
        }

        @Test
        @DisplayName("a parse failure in any feed aborts the whole ingestion")
        void parseFailureAborts() {
            FeedLocator.FeedFiles files = new FeedLocator.FeedFiles(
                List.of(feeds.resolve("Trades_1_MTD.xml"), feeds.resolve("Malformed_Trades.xml")),
                List.of(feeds.resolve("Cash_Transactions_MTD.xml")),
                List.of(feeds.resolve("NAV_MTD.xml")));

            assertThatThrownBy(() -> ingestor.ingest(files))
                .isInstanceOf(FeedParseException.class)
                .hasMessageContaining("quantity");
        }
    }
}
