package io.trading.perpfeed.exchange.okx;

import com.fasterxml.jackson.databind.JsonNode;
import io.trading.perpfeed.model.PriceLevel;
import io.trading.perpfeed.transport.MalformedResponseException;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Field accessors for OKX JSON payloads. OKX sends most numbers as strings; both
 * representations are accepted. Every accessor fails with
 * {@link MalformedResponseException} when the field is absent or not numeric.
 */
final class JsonFields {

    private JsonFields() {
    }

    static JsonNode require(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        if (value == null || value.isNull()) {
            throw new MalformedResponseException("Missing field '" + field + "'");
        }
        return value;
    }

    static JsonNode requireArray(JsonNode node, String field) {
        JsonNode value = require(node, field);
        if (!value.isArray()) {
            throw new MalformedResponseException("Field '" + field + "' is not an array");
        }
        return value;
    }

    /**
     * Returns the first element of the "data" array of a response.
     */
    static JsonNode firstDataRow(JsonNode response) {
        JsonNode data = requireArray(response, "data");
        if (data.isEmpty()) {
            throw new MalformedResponseException("Empty 'data' array");
        }
        return data.get(0);
    }

    static String requireText(JsonNode node, String field) {
        JsonNode value = require(node, field);
        if (value.isContainerNode()) {
            throw new MalformedResponseException("Field '" + field + "' is not a scalar");
        }
        return value.asText();
    }

    static double requireDouble(JsonNode node, String field) {
        return toDouble(require(node, field), field);
    }

    static long requireLong(JsonNode node, String field) {
        JsonNode value = require(node, field);
        if (value.isIntegralNumber()) {
            return value.longValue();
        }
        try {
            return Long.parseLong(value.asText().trim());
        } catch (NumberFormatException e) {
            throw new MalformedResponseException("Field '" + field + "' is not an integer: " + value, e);
        }
    }

    static BigDecimal requireDecimal(JsonNode node, String field) {
        return toDecimal(require(node, field), field);
    }

    static BigDecimal toDecimal(JsonNode value, String field) {
        if (value.isNumber()) {
            return value.decimalValue();
        }
        try {
            return new BigDecimal(value.asText().trim());
        } catch (NumberFormatException e) {
            throw new MalformedResponseException("Field '" + field + "' is not a number: " + value, e);
        }
    }

    static double toDouble(JsonNode value, String field) {
        if (value.isNumber()) {
            return value.doubleValue();
        }
        if (value.isContainerNode()) {
            throw new MalformedResponseException("Field '" + field + "' is not a number: " + value);
        }
        try {
            return Double.parseDouble(value.asText().trim());
        } catch (NumberFormatException e) {
            throw new MalformedResponseException("Field '" + field + "' is not a number: " + value, e);
        }
    }

    /**
     * Reads a bids or asks array. Each row is [price, size, ...]; extra columns
     * (liquidated orders, order count) are ignored.
     */
    static List<PriceLevel> priceLevels(JsonNode node, String field) {
        JsonNode rows = requireArray(node, field);
        List<PriceLevel> levels = new ArrayList<>(rows.size());
        for (JsonNode row : rows) {
            if (!row.isArray() || row.size() < 2) {
                throw new MalformedResponseException("Invalid level in '" + field + "': " + row);
            }
            levels.add(new PriceLevel(toDouble(row.get(0), field), toDouble(row.get(1), field)));
        }
        return levels;
    }
}
