package com.labelops.integration.telegram;

/**
 * A chat message as seen by the router.
 *
 * @param text     {@code null} for messages without text
 * @param hasMedia photo or document attached
 */
public record InboundMessage(long chatId, String text, boolean hasMedia) {

    public static InboundMessage text(long chatId, String text) {
        return new InboundMessage(chatId, text, false);
    }

    public boolean isText() {
        return text != null && !hasMedia;
    }
}
