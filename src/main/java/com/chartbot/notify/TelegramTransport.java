package com.chartbot.notify;

import com.chartbot.automation.error.DispatchException;

/**
 * Outbound Telegram messages. Text is Telegram legacy Markdown.
 */
public interface TelegramTransport {
    void sendMessage(String chatId, String text) throws DispatchException;

    void sendPhoto(String chatId, byte[] image, String mimeType, String caption) throws DispatchException;
}
