package io.trading.perpfeed.exchange.okx;

import com.fasterxml.jackson.databind.JsonNode;
import io.trading.perpfeed.model.ChannelKind;

/**
 * Decides which output channel an inbound stream payload belongs to.
 *
 * Acknowledgements ("success" or "event" at top level) are never routed. The channel name
 * comes from the "topic" field with its trailing instrument segment removed
 * (e.g. "instruments.BTC-USDT-SWAP"), or from "arg.channel" when there is no topic.
 * Channels other than the three subscribed ones are UNROUTED.
 */
public class OkxMessageClassifier {

    private static final String FIELD_SUCCESS = "success";
    private static final String FIELD_EVENT = "event";
    private static final String FIELD_TOPIC = "topic";
    private static final String FIELD_ARG = "arg";
    private static final String FIELD_CHANNEL = "channel";

    public ChannelKind classify(JsonNode payload) {
        if (payload == null || !payload.isObject()) {
            return ChannelKind.UNROUTED;
        }
        if (payload.has(FIELD_SUCCESS) || payload.has(FIELD_EVENT)) {
            return ChannelKind.UNROUTED;
        }

        String channel = channelName(payload);
        if (channel == null) {
            return ChannelKind.UNROUTED;
        }
        return switch (channel) {
            case OkxConstants.WS_TRADES_CHANNEL -> ChannelKind.TRADE;
            case OkxConstants.WS_ORDER_BOOK_CHANNEL -> ChannelKind.DIFF;
            case OkxConstants.WS_INSTRUMENTS_CHANNEL -> ChannelKind.FUNDING;
            default -> ChannelKind.UNROUTED;
        };
    }

    private static String channelName(JsonNode payload) {
        JsonNode topic = payload.get(FIELD_TOPIC);
        if (topic != null && topic.isTextual()) {
            return stripLastSegment(topic.asText());
        }
        JsonNode arg = payload.get(FIELD_ARG);
        if (arg != null && arg.hasNonNull(FIELD_CHANNEL)) {
            return arg.get(FIELD_CHANNEL).asText();
        }
        return null;
    }

    /**
     * "instruments.BTC-USDT-SWAP" becomes "instruments"; a topic with no delimiter is all instrument.
     */
    static String stripLastSegment(String topic) {
        int cut = Math.max(topic.lastIndexOf('.'), topic.lastIndexOf('/'));
        return cut < 0 ? "" : topic.substring(0, cut);
    }

    /**
     * Returns the instrument segment of a topic, e.g. "BTC-USDT-SWAP".
     */
    static String lastSegment(String topic) {
        int cut = Math.max(topic.lastIndexOf('.'), topic.lastIndexOf('/'));
        return topic.substring(cut + 1);
    }
}
