package com.incoresoft.sosync.telegram;

import com.incoresoft.sosync.config.TelegramProps;
import com.incoresoft.sosync.notification.NotificationDispatcher;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.telegram.telegrambots.bots.DefaultAbsSender;
import org.telegram.telegrambots.bots.DefaultBotOptions;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

import java.util.Map;

/**
 * Delivers group notifications to the Telegram chat configured for the group.
 * Groups without a chat (and no default chat) are skipped with a warning.
 */
@Slf4j
public class TelegramNotificationDispatcher extends DefaultAbsSender implements NotificationDispatcher {
    private final TelegramProps props;

    public TelegramNotificationDispatcher(DefaultBotOptions options, TelegramProps props) {
        super(options, props.getBotToken());
        this.props = props;
    }

    @Override
    public void init() {
        if (StringUtils.isBlank(props.getBotToken())) {
            throw new IllegalStateException("telegram.botToken must be set when telegram.enabled=true");
        }
        log.info("[NOTIFY] Telegram transport ready, {} group chat(s) configured", props.getChats().size());
    }

    @Override
    public void send(String groupId, String title, String body, Map<String, String> payload, String excludeUserId) {
        String chatId = props.chatFor(groupId);
        if (StringUtils.isBlank(chatId)) {
            log.warn("[NOTIFY] no Telegram chat for group {}, '{}' dropped", groupId, title);
            return;
        }
        SendMessage msg = new SendMessage(chatId, "*" + title + "*\n" + body);
        msg.enableMarkdown(true);
        try {
            execute(msg);
        } catch (TelegramApiException ex) {
            throw new IllegalStateException("Telegram delivery failed: " + ex.getMessage(), ex);
        }
    }

    @Override
    public void shutdown() {
        log.info("[NOTIFY] Telegram transport stopped");
    }
}
