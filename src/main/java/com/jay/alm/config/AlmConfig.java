package com.jay.alm.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;
import org.springframework.util.PropertyPlaceholderHelper;

import java.io.InputStream;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads and exposes the engine configuration from config.yaml.
 * Values are read once at startup. Sections not present in the file keep their defaults,
 * so a bare {@code new AlmConfig()} is a usable default configuration.
 */
@Slf4j
@Component
public class AlmConfig {

    @Value("${alm.config-file:config.yaml}")
    private String configFile;

    @Autowired
    private Environment env;

    private static final PropertyPlaceholderHelper PLACEHOLDER_HELPER =
        new PropertyPlaceholderHelper("${", "}", ":", true);

    /** Resolves ${VAR:default} placeholders using Spring Environment (env vars / system props). */
    private String resolve(String value) {
        if (value == null || env == null) return value;
        return PLACEHOLDER_HELPER.replacePlaceholders(value, env::getProperty);
    }

    // ── Sections ──────────────────────────────────────────────────────────────
    private Feeds feeds = new Feeds();
    private Reporting reporting = new Reporting();
    private Fx fx = new Fx();
    private Ledger ledger = new Ledger();
    private Reconciliation reconciliation = new Reconciliation();
    private Scheduler scheduler = new Scheduler();
    private Telegram telegram = new Telegram();

    @PostConstruct
    public void load() {
        try {
            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            mapper.registerModule(new JavaTimeModule());
            mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
            mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            InputStream is = getClass().getClassLoader().getResourceAsStream(configFile);
            if (is == null) {
                log.warn("Config file '{}' not found on classpath — using defaults", configFile);
                return;
            }
            ConfigRoot root;
            try (is) {
                root = mapper.readValue(is, ConfigRoot.class);
            }
            this.feeds          = root.getFeeds();
            this.reporting      = root.getReporting();
            this.fx             = root.getFx();
            this.ledger         = root.getLedger();
            this.reconciliation = root.getReconciliation();
            this.scheduler      = root.getScheduler();
            this.telegram       = root.getTelegram();

            // Resolve ${VAR:default} placeholders that Jackson reads as literal strings
            this.feeds.setDataDir(resolve(this.feeds.getDataDir()));
            this.telegram.setBotToken(resolve(this.telegram.getBotToken()));
            this.telegram.setChatId(resolve(this.telegram.getChatId()));
            log.info("AlmConfig loaded from '{}'. Reporting currency: {}, FX mode: {}, data dir: {}",
                configFile, reporting.getCurrency(), fx.getMode(), feeds.getDataDir());
        } catch (Exception e) {
            log.error("Failed to load {} — engine will use defaults: {}", configFile, e.getMessage());
        }
    }

    // ── Accessors ─────────────────────────────────────────────────────────────
    public Feeds feeds()                   { return feeds; }
    public Reporting reporting()           { return reporting; }
    public Fx fx()                         { return fx; }
    public Ledger ledger()                 { return ledger; }
    public Reconciliation reconciliation() { return reconciliation; }
    public Scheduler scheduler()           { return scheduler; }
    public Telegram telegram()             { return telegram; }

    // ── Config POJOs ──────────────────────────────────────────────────────────

    @Data public static class ConfigRoot {
        private Feeds feeds = new Feeds();
        private Reporting reporting = new Reporting();
        private Fx fx = new Fx();
        private Ledger ledger = new Ledger();
        private Reconciliation reconciliation = new Reconciliation();
        private Scheduler scheduler = new Scheduler();
        private Telegram telegram = new Telegram();
    }

    @Data public static class Feeds {
        private String dataDir = "./data/flex";
        private String tradesGlob = "Trades_*.xml";
        private String cashGlob = "Cash_Transactions_*.xml";
        private String navGlob = "NAV_*.xml";
        private String exercisesGlob = "Exercises_and_Expiries_*.xml";    // optional
        private String interestGlob = "Interest_Accruals_*.xml";          // optional
        private String sourceZone = "America/New_York";
        private LocalTime defaultTradeTime = LocalTime.of(16, 0);
        private LocalTime defaultDepositTime = LocalTime.of(8, 0);
        private LocalTime defaultCashTime = LocalTime.of(16, 0);
        private int parserThreads = 3;
        // Cash rows already booked through the Trades feed
        private List<String> excludedCashTypes = new ArrayList<>(List.of("Trade"));

        public boolean isExcludedCashType(String type) {
            return excludedCashTypes.stream().anyMatch(t -> t.equalsIgnoreCase(type));
        }

        public ZoneId sourceZoneId() { return ZoneId.of(sourceZone); }
    }

    @Data public static class Reporting {
        private String currency = "HKD";
        private String zone = "America/New_York";
        private LocalTime marketOpen = LocalTime.of(9, 30);
        // Used only when no NAV snapshot reports a starting value
        private BigDecimal openingNavFallback;

        public ZoneId zoneId() { return ZoneId.of(zone); }
    }

    public enum FxMode { FIXED, PER_EVENT }

    @Data public static class Fx {
        private FxMode mode = FxMode.PER_EVENT;
        // currency -> rate into the reporting currency
        private Map<String, BigDecimal> fixedRates = new LinkedHashMap<>(Map.of("USD", new BigDecimal("7.8472")));
        // currency -> (date -> rate); the latest entry on or before the event date applies
        private Map<String, Map<LocalDate, BigDecimal>> historicalRates = new LinkedHashMap<>();
    }

    @Data public static class Ledger {
        private boolean synthesizeAggregateCashFlow = true;
        private String depositWithdrawalType = "Deposits/Withdrawals";
    }

    @Data public static class Reconciliation {
        private BigDecimal navTolerance = new BigDecimal("1.00");
        private BigDecimal returnTolerancePct = new BigDecimal("0.01");
        private boolean failOnReturnDivergence = true;
        private boolean failOnUnresolvedAssignments = false;
    }

    @Data public static class Scheduler {
        private boolean enabled = false;
    }

    @Data public static class Telegram {
        private String apiBase = "https://api.telegram.org/bot";
        private String botToken = "";
        private String chatId = "";
    }
}
