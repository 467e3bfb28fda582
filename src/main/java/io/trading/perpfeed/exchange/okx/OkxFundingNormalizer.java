package io.trading.perpfeed.exchange.okx;

import com.fasterxml.jackson.databind.JsonNode;
import io.trading.perpfeed.model.FundingInfoUpdate;
import io.trading.perpfeed.transport.MalformedResponseException;
import io.trading.perpfeed.transport.SymbolTranslator;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Queue;
import java.util.function.Function;

/**
 * Turns instrument info deltas into sparse funding updates.
 * Format: {"type":"delta","topic":"instruments.BTC-USDT-SWAP",
 *          "data":{"update":[{"index_price":"100","mark_price":"101",
 *                             "next_funding_time":"2024-01-01T08:00:00Z","predicted_funding_rate_e6":100}]}}
 *
 * Only fields present in an entry are set on the update; absent fields mean "unchanged".
 */
public class OkxFundingNormalizer implements MessageNormalizer<FundingInfoUpdate> {

    private static final String FIELD_INDEX_PRICE = "index_price";
    private static final String FIELD_MARK_PRICE = "mark_price";
    private static final String FIELD_NEXT_FUNDING_TIME = "next_funding_time";
    private static final String FIELD_PREDICTED_RATE_E6 = "predicted_funding_rate_e6";

    private static final int RATE_E6_SCALE = 6;
    private static final DateTimeFormatter SPACE_SEPARATED = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss[.SSS]");
    private static final List<Function<String, Long>> TIMESTAMP_PARSERS = List.of(
        text -> OffsetDateTime.parse(text).toEpochSecond(),
        text -> LocalDateTime.parse(text).toEpochSecond(ZoneOffset.UTC),
        text -> LocalDateTime.parse(text, SPACE_SEPARATED).toEpochSecond(ZoneOffset.UTC),
        text -> LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toEpochSecond()
    );

    private final SymbolTranslator symbols;

    public OkxFundingNormalizer(SymbolTranslator symbols) {
        this.symbols = symbols;
    }

    @Override
    public int normalize(JsonNode payload, Queue<? super FundingInfoUpdate> queue) {
        JsonNode type = payload.get("type");
        if (type == null || !OkxConstants.TYPE_DELTA.equals(type.asText())) {
            return 0;
        }

        String tradingPair = symbols.toCanonical(instrumentOf(payload));
        JsonNode entries = JsonFields.requireArray(JsonFields.require(payload, "data"), "update");

        int count = 0;
        for (JsonNode entry : entries) {
            FundingInfoUpdate.Builder update = FundingInfoUpdate.builder(tradingPair);
            if (entry.hasNonNull(FIELD_INDEX_PRICE)) {
                update.indexPrice(JsonFields.toDecimal(entry.get(FIELD_INDEX_PRICE), FIELD_INDEX_PRICE));
            }
            if (entry.hasNonNull(FIELD_MARK_PRICE)) {
                update.markPrice(JsonFields.toDecimal(entry.get(FIELD_MARK_PRICE), FIELD_MARK_PRICE));
            }
            if (entry.hasNonNull(FIELD_NEXT_FUNDING_TIME)) {
                update.nextFundingUtcTimestamp(toEpochSeconds(entry.get(FIELD_NEXT_FUNDING_TIME)));
            }
            if (entry.hasNonNull(FIELD_PREDICTED_RATE_E6)) {
                BigDecimal rateE6 = JsonFields.toDecimal(entry.get(FIELD_PREDICTED_RATE_E6), FIELD_PREDICTED_RATE_E6);
                update.rate(rateE6.movePointLeft(RATE_E6_SCALE));
            }
            queue.offer(update.build());
            count++;
        }
        return count;
    }

    private static String instrumentOf(JsonNode payload) {
        JsonNode topic = payload.get("topic");
        if (topic != null && topic.isTextual()) {
            return OkxMessageClassifier.lastSegment(topic.asText());
        }
        return JsonFields.requireText(JsonFields.require(payload, "arg"), "instId");
    }

    /**
     * Parses a UTC timestamp: ISO-8601 instant or offset date-time, ISO local date-time
     * (taken as UTC), "yyyy-MM-dd HH:mm:ss", an ISO date (midnight UTC), or epoch milliseconds.
     */
    static long toEpochSeconds(JsonNode value) {
        if (value.isNumber()) {
            return value.longValue() / 1000;
        }
        String text = value.asText().trim();
        if (!text.isEmpty() && text.chars().allMatch(Character::isDigit)) {
            return Long.parseLong(text) / 1000;
        }
        DateTimeParseException failure = null;
        for (Function<String, Long> parser : TIMESTAMP_PARSERS) {
            try {
                return parser.apply(text);
            } catch (DateTimeParseException e) {
                failure = e;
            }
        }
        throw new MalformedResponseException("Field '" + FIELD_NEXT_FUNDING_TIME + "' is not a timestamp: " + text, failure);
    }
}
