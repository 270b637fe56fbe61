package com.jay.alm.layer1_ingest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.jay.alm.config.AlmConfig;
import com.jay.alm.exception.FeedParseException;
import com.jay.alm.model.CashTransaction;
import com.jay.alm.model.NavSnapshot;
import com.jay.alm.model.OptionLifecycleEvent;
import com.jay.alm.model.TradeExecution;
import com.jay.alm.model.enums.AssetCategory;
import com.jay.alm.model.enums.OptionEventType;
import com.jay.alm.model.enums.OptionRight;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads IBKR FlexQuery XML extracts.
 *
 * Records are attribute-only elements ({@code <Trade .../>}, {@code <CashTransaction .../>},
 * {@code <ChangeInNAV .../>}, {@code <OptionEAE .../>}, {@code <InterestAccrual .../>}) nested under
 * {@code FlexQueryResponse/FlexStatements/FlexStatement}.
 * Jackson's XML tree model folds repeated elements into arrays and empty containers into
 * empty text, so the walk below accepts objects, arrays and text at every level.
 *
 * Every record is validated here; a missing required attribute or a malformed number or
 * date raises {@link FeedParseException} naming the file and the attribute.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FlexFeedParser {

    static final String TRADE = "Trade";
    static final String CASH_TRANSACTION = "CashTransaction";
    static final String CHANGE_IN_NAV = "ChangeInNAV";
    static final String OPTION_EAE = "OptionEAE";
    static final String INTEREST_ACCRUAL = "InterestAccrual";
    static final String INTEREST_ACCRUAL_TYPE = "Interest Accrual";
    private static final String BASE_SUMMARY = "BASE_SUMMARY";
    private static final String FLEX_STATEMENT = "FlexStatement";

    private static final DateTimeFormatter BASIC_DATE = DateTimeFormatter.ofPattern("yyyyMMdd");
    private static final DateTimeFormatter COMPACT_TIME = DateTimeFormatter.ofPattern("HHmmss");

    // Trailing zone label on dateTime values, e.g. "20250701;121417 EDT"
    private static final Pattern ZONE_SUFFIX = Pattern.compile("^(.*\\d)\\s+([A-Za-z]{2,5})$");
    private static final Map<String, ZoneId> ZONE_LABELS = Map.of(
        "EDT", ZoneId.of("America/New_York"),
        "EST", ZoneId.of("America/New_York"),
        "ET", ZoneId.of("America/New_York"),
        "CDT", ZoneId.of("America/Chicago"),
        "CST", ZoneId.of("America/Chicago"),
        "PDT", ZoneId.of("America/Los_Angeles"),
        "PST", ZoneId.of("America/Los_Angeles"),
        "HKT", ZoneId.of("Asia/Hong_Kong"),
        "GMT", ZoneId.of("UTC"),
        "UTC", ZoneId.of("UTC"));

    private final AlmConfig config;
    private final XmlMapper xmlMapper = new XmlMapper();

    // ── Public API ─────────────────────────────────────────────────────────────

    public List<TradeExecution> parseTrades(Path file) {
        List<TradeExecution> trades = new ArrayList<>();
        for (Element e : readElements(file, TRADE)) {
            trades.add(toTrade(new Attributes(file, e.node())));
        }
        log.info("FlexFeedParser: {} trades from {}", trades.size(), file.getFileName());
        return trades;
    }

    public List<CashTransaction> parseCashTransactions(Path file) {
        List<CashTransaction> cash = new ArrayList<>();
        int excluded = 0;
        for (Element e : readElements(file, CASH_TRANSACTION)) {
            Attributes a = new Attributes(file, e.node());
            if (config.feeds().isExcludedCashType(a.optional("type"))) {
                excluded++;
                continue;
            }
            cash.add(toCashTransaction(a, e.statementToDate()));
        }
        log.info("FlexFeedParser: {} cash transactions from {} ({} excluded by type)",
            cash.size(), file.getFileName(), excluded);
        return cash;
    }

    /** Exercises-and-expiries rows; row types the engine does not use are skipped. */
    public List<OptionLifecycleEvent> parseOptionEvents(Path file) {
        List<OptionLifecycleEvent> events = new ArrayList<>();
        for (Element e : readElements(file, OPTION_EAE)) {
            Attributes a = new Attributes(file, e.node());
            OptionEventType type = OptionEventType.fromCode(a.optional("transactionType"));
            if (type == null) continue;
            events.add(toOptionEvent(a, type, e.statementToDate()));
        }
        log.info("FlexFeedParser: {} option exercise/assignment/expiration rows from {}",
            events.size(), file.getFileName());
        return events;
    }

    /**
     * Interest accrual rows as cash movements dated at the end of their accrual period.
     * Zero accruals and the base-currency summary row are dropped.
     */
    public List<CashTransaction> parseInterestAccruals(Path file) {
        List<CashTransaction> accruals = new ArrayList<>();
        for (Element e : readElements(file, INTEREST_ACCRUAL)) {
            Attributes a = new Attributes(file, e.node());
            String currency = a.optional("currencyPrimary");
            if (currency == null) currency = a.required("currency");
            if (BASE_SUMMARY.equalsIgnoreCase(currency)) continue;
            BigDecimal amount = a.decimalOrZero("interestAccrued");
            if (amount.signum() == 0) continue;
            accruals.add(toInterestAccrual(a, currency, amount, e.statementToDate()));
        }
        log.info("FlexFeedParser: {} interest accruals from {}", accruals.size(), file.getFileName());
        return accruals;
    }

    public List<NavSnapshot> parseNavSnapshots(Path file) {
        List<NavSnapshot> snapshots = new ArrayList<>();
        for (Element e : readElements(file, CHANGE_IN_NAV)) {
            snapshots.add(toNavSnapshot(new Attributes(file, e.node()), e.statementFromDate(), e.statementToDate()));
        }
        log.info("FlexFeedParser: {} NAV snapshots from {}", snapshots.size(), file.getFileName());
        return snapshots;
    }

    // ── Record mapping ────────────────────────────────────────────────────────

    TradeExecution toTrade(Attributes a) {
        AssetCategory category = AssetCategory.fromCode(a.optional("assetCategory"));
        String rightCode = a.optional("putCall");
        OptionRight right;
        try {
            right = rightCode == null ? null : OptionRight.fromCode(rightCode);
        } catch (IllegalArgumentException e) {
            throw a.malformed("putCall", rightCode, e);
        }
        String symbol = a.required("symbol");
        String underlying = a.optional("underlyingSymbol");
        return TradeExecution.builder()
            .transactionId(a.required("transactionID"))
            .timestamp(tradeTimestamp(a))
            .symbol(symbol)
            .underlyingSymbol(underlying != null ? underlying : symbol)
            .description(a.optional("description"))
            .quantity(a.decimal("quantity"))
            .tradePrice(a.decimal("tradePrice"))
            .proceeds(a.decimalOrZero("proceeds"))
            .commission(a.decimalOrZero("ibCommission"))
            .fifoPnlRealized(a.decimalOrZero("fifoPnlRealized"))
            .assetCategory(category)
            .transactionType(a.optional("transactionType"))
            .currency(a.required("currency"))
            .fxRateToBase(a.optionalDecimal("fxRateToBase"))
            .strike(a.optionalDecimal("strike"))
            .right(right)
            .expiry(a.optionalDate("expiry"))
            .multiplier(a.optionalDecimal("multiplier"))
            .build();
    }

    CashTransaction toCashTransaction(Attributes a, LocalDate statementDate) {
        String type = a.required("type");
        BigDecimal amount = a.decimal("amount");
        LocalTime fallbackTime = isDeposit(type, amount)
            ? config.feeds().getDefaultDepositTime()
            : config.feeds().getDefaultCashTime();
        String dateTime = a.optional("dateTime");
        if (dateTime == null) dateTime = a.optional("reportDate");
        Instant timestamp;
        if (dateTime != null) {
            timestamp = parseTimestamp(a, "dateTime", dateTime, fallbackTime);
        } else if (statementDate != null) {
            timestamp = toInstant(statementDate.atTime(fallbackTime));
        } else {
            throw a.missing("dateTime");
        }
        return CashTransaction.builder()
            .transactionId(a.required("transactionID"))
            .timestamp(timestamp)
            .type(type)
            .description(a.optional("description"))
            .amount(amount)
            .currency(a.required("currency"))
            .fxRateToBase(a.optionalDecimal("fxRateToBase"))
            .build();
    }

    OptionLifecycleEvent toOptionEvent(Attributes a, OptionEventType type, LocalDate statementDate) {
        LocalDate date = a.optionalDate("date");
        if (date == null) date = statementDate;
        if (date == null) throw a.missing("date");
        String rightCode = a.optional("putCall");
        OptionRight right;
        try {
            right = rightCode == null ? null : OptionRight.fromCode(rightCode);
        } catch (IllegalArgumentException e) {
            throw a.malformed("putCall", rightCode, e);
        }
        String symbol = a.required("symbol");
        String underlying = a.optional("underlyingSymbol");
        return OptionLifecycleEvent.builder()
            .tradeId(a.optional("tradeID"))
            .date(date)
            .type(type)
            .symbol(symbol)
            .underlyingSymbol(underlying != null ? underlying : symbol)
            .quantity(a.decimal("quantity"))
            .strike(a.optionalDecimal("strike"))
            .right(right)
            .tradePrice(a.optionalDecimal("tradePrice"))
            .markPrice(a.optionalDecimal("markPrice"))
            .currency(a.optional("currency"))
            .build();
    }

    CashTransaction toInterestAccrual(Attributes a, String currency, BigDecimal amount, LocalDate statementDate) {
        LocalDate to = a.optionalDate("toDate");
        if (to == null) to = statementDate;
        if (to == null) throw a.missing("toDate");
        return CashTransaction.builder()
            .transactionId("INT-" + to + "-" + currency)
            .timestamp(toInstant(to.atTime(config.feeds().getDefaultCashTime())))
            .type(INTEREST_ACCRUAL_TYPE)
            .description("Interest accrued in " + currency)
            .amount(amount)
            .currency(currency)
            .fxRateToBase(a.optionalDecimal("fxRateToBase"))
            .build();
    }

    NavSnapshot toNavSnapshot(Attributes a, LocalDate statementFrom, LocalDate statementTo) {
        LocalDate from = a.optionalDate("fromDate");
        LocalDate to = a.optionalDate("toDate");
        if (from == null) from = statementFrom;
        if (to == null) to = statementTo;
        if (from == null) throw a.missing("fromDate");
        if (to == null) throw a.missing("toDate");
        return NavSnapshot.builder()
            .fromDate(from)
            .toDate(to)
            .startingValue(a.decimal("startingValue"))
            .endingValue(a.decimal("endingValue"))
            .depositsWithdrawals(a.decimalOrZero("depositsWithdrawals"))
            .markToMarket(a.decimalOrZero("mtm"))
            .realized(a.decimalOrZero("realized"))
            .fees(a.decimalOrZero("otherFees"))
            .commissions(a.decimalOrZero("commissions"))
            .interest(a.decimalOrZero("interest"))
            .changeInInterestAccruals(a.decimalOrZero("changeInInterestAccruals"))
            .currency(a.optional("currency"))
            .build();
    }

    private boolean isDeposit(String type, BigDecimal amount) {
        return config.ledger().getDepositWithdrawalType().equalsIgnoreCase(type) && amount.signum() > 0;
    }

    private Instant tradeTimestamp(Attributes a) {
        String dateTime = a.optional("dateTime");
        if (dateTime != null) {
            return parseTimestamp(a, "dateTime", dateTime, config.feeds().getDefaultTradeTime());
        }
        String tradeDate = a.required("tradeDate");
        String tradeTime = a.optional("tradeTime");
        LocalDate date = parseDate(a, "tradeDate", tradeDate);
        LocalTime time = tradeTime == null
            ? config.feeds().getDefaultTradeTime()
            : parseTime(a, "tradeTime", tradeTime);
        return toInstant(date.atTime(time));
    }

    // ── Date/time parsing ─────────────────────────────────────────────────────

    /**
     * Accepts yyyyMMdd;HHmmss, yyyyMMdd HHmmss, yyyyMMdd and ISO forms, each optionally
     * followed by a zone label ("20250701;121417 EDT"). Without a label the source zone applies.
     */
    Instant parseTimestamp(Attributes a, String attr, String raw, LocalTime fallbackTime) {
        String value = raw.trim();
        ZoneId zone = config.feeds().sourceZoneId();
        Matcher labelled = ZONE_SUFFIX.matcher(value);
        if (labelled.matches()) {
            value = labelled.group(1).trim();
            zone = zoneForLabel(labelled.group(2), zone);
        }
        int sep = indexOfSeparator(value);
        if (sep < 0) {
            return parseDate(a, attr, value).atTime(fallbackTime).atZone(zone).toInstant();
        }
        LocalDate date = parseDate(a, attr, value.substring(0, sep));
        LocalTime time = parseTime(a, attr, value.substring(sep + 1));
        return date.atTime(time).atZone(zone).toInstant();
    }

    private static ZoneId zoneForLabel(String label, ZoneId sourceZone) {
        ZoneId zone = ZONE_LABELS.get(label.toUpperCase());
        if (zone == null) {
            log.debug("Unknown zone label '{}' — using source zone {}", label, sourceZone);
            return sourceZone;
        }
        return zone;
    }

    private static int indexOfSeparator(String value) {
        int semi = value.indexOf(';');
        if (semi >= 0) return semi;
        int space = value.indexOf(' ');
        if (space >= 0) return space;
        return value.indexOf('T');
    }

    private LocalDate parseDate(Attributes a, String attr, String raw) {
        String value = raw.trim();
        try {
            return value.contains("-") ? LocalDate.parse(value) : LocalDate.parse(value, BASIC_DATE);
        } catch (DateTimeParseException e) {
            throw a.malformed(attr, raw, e);
        }
    }

    private LocalTime parseTime(Attributes a, String attr, String raw) {
        String value = raw.trim();
        try {
            return value.contains(":") ? LocalTime.parse(value) : LocalTime.parse(value, COMPACT_TIME);
        } catch (DateTimeParseException e) {
            throw a.malformed(attr, raw, e);
        }
    }

    private Instant toInstant(LocalDateTime local) {
        return local.atZone(config.feeds().sourceZoneId()).toInstant();
    }

    // ── XML tree walk ─────────────────────────────────────────────────────────

    /** One record element plus the period of the statement that encloses it. */
    record Element(JsonNode node, LocalDate statementFromDate, LocalDate statementToDate) {}

    private List<Element> readElements(Path file, String elementName) {
        if (!Files.isRegularFile(file)) {
            throw new FeedParseException(String.valueOf(file), "extract file not found");
        }
        JsonNode root;
        try (InputStream in = Files.newInputStream(file)) {
            root = xmlMapper.readTree(in);
        } catch (IOException e) {
            throw new FeedParseException(file, "unreadable XML: " + e.getMessage(), e);
        }
        List<Element> found = new ArrayList<>();
        collect(file, root, elementName, null, null, found);
        return found;
    }

    private void collect(Path file, JsonNode node, String elementName,
                         LocalDate from, LocalDate to, List<Element> out) {
        if (node == null || !node.isContainerNode()) return;
        if (node.isArray()) {
            for (JsonNode child : node) collect(file, child, elementName, from, to, out);
            return;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (field.getKey().equals(elementName)) {
                List<JsonNode> items = new ArrayList<>();
                if (value.isArray()) value.forEach(items::add);
                else items.add(value);
                for (JsonNode item : items) {
                    if (!item.isObject()) continue;
                    // OptionEAE rows sit in a container of the same name
                    if (item.has(elementName)) collect(file, item, elementName, from, to, out);
                    else out.add(new Element(item, from, to));
                }
            } else if (field.getKey().equals(FLEX_STATEMENT)) {
                List<JsonNode> statements = new ArrayList<>();
                if (value.isArray()) value.forEach(statements::add);
                else statements.add(value);
                for (JsonNode statement : statements) {
                    if (!statement.isObject()) continue;
                    Attributes attrs = new Attributes(file, statement);
                    LocalDate stmtFrom = attrs.optionalDate("fromDate");
                    LocalDate stmtTo = attrs.optionalDate("toDate");
                    collect(file, statement, elementName,
                        stmtFrom != null ? stmtFrom : from, stmtTo != null ? stmtTo : to, out);
                }
            } else {
                collect(file, value, elementName, from, to, out);
            }
        }
    }

    /** Typed access to one element's attributes, failing with the file and attribute name. */
    final class Attributes {
        private final Path file;
        private final JsonNode node;

        Attributes(Path file, JsonNode node) {
            this.file = file;
            this.node = node;
        }

        String optional(String name) {
            JsonNode value = node.get(name);
            if (value == null || value.isNull() || !value.isValueNode()) return null;
            String text = value.asText().trim();
            return text.isEmpty() ? null : text;
        }

        String required(String name) {
            String value = optional(name);
            if (value == null) throw missing(name);
            return value;
        }

        BigDecimal decimal(String name) {
            return toDecimal(name, required(name));
        }

        BigDecimal decimalOrZero(String name) {
            String value = optional(name);
            return value == null ? BigDecimal.ZERO : toDecimal(name, value);
        }

        BigDecimal optionalDecimal(String name) {
            String value = optional(name);
            return value == null ? null : toDecimal(name, value);
        }

        LocalDate optionalDate(String name) {
            String value = optional(name);
            return value == null ? null : parseDate(this, name, value);
        }

        private BigDecimal toDecimal(String name, String value) {
            try {
                // Normalised so overlapping extracts compare equal regardless of trailing zeros
                BigDecimal parsed = new BigDecimal(value.replace(",", ""));
                return parsed.signum() == 0 ? BigDecimal.ZERO : parsed.stripTrailingZeros();
            } catch (NumberFormatException e) {
                throw malformed(name, value, e);
            }
        }

        FeedParseException missing(String name) {
            String id = optional("transactionID");
            return new FeedParseException(String.valueOf(file.getFileName()),
                "missing required attribute '" + name + "'" + (id != null ? " on transaction " + id : ""));
        }

        FeedParseException malformed(String name, String value, Throwable cause) {
            return new FeedParseException(file, "malformed attribute '" + name + "': " + value, cause);
        }
    }
}
