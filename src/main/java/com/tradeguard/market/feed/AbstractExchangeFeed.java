package com.tradeguard.market.feed;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradeguard.exception.MalformedMarketDataException;
import java.math.BigDecimal;
import java.math.RoundingMode;

/** JSON helpers shared by the exchange feeds. */
abstract class AbstractExchangeFeed implements ExchangeFeed {

    protected final ObjectMapper objectMapper;
    protected final String baseUrl;

    protected AbstractExchangeFeed(ObjectMapper objectMapper, String baseUrl) {
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl;
    }

    protected JsonNode readTree(String payload) {
        try {
            return objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new MalformedMarketDataException(name(), "unparseable frame", e);
        }
    }

    protected String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + name() + " subscribe message", e);
        }
    }

    /** Reads a decimal that exchanges send as either a JSON string or number; null if absent. */
    protected BigDecimal decimal(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        try {
            return node.isNumber() ? node.decimalValue() : new BigDecimal(node.asText());
        } catch (NumberFormatException e) {
            throw new MalformedMarketDataException(name(), "not a number: " + node);
        }
    }

    protected BigDecimal requiredDecimal(JsonNode node, String field) {
        BigDecimal value = decimal(node);
        if (value == null) {
            throw new MalformedMarketDataException(name(), "ticker without " + field);
        }
        return value;
    }

    /** Percentage move from {@code open} to {@code price}, or null if it cannot be computed. */
    protected static BigDecimal percentChange(BigDecimal open, BigDecimal price) {
        if (open == null || price == null || open.signum() == 0) {
            return null;
        }
        return price.subtract(open).multiply(BigDecimal.valueOf(100)).divide(open, 4, RoundingMode.HALF_UP);
    }
}
