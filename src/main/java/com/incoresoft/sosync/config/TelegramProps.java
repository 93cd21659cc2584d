package com.incoresoft.sosync.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.HashMap;
import java.util.Map;

@Data
@ConfigurationProperties(prefix = "telegram")
public class TelegramProps {
    private boolean enabled = false;
    private String botToken;
    /** Chat used for groups that have no entry in {@link #chats}. */
    private String defaultChatId;
    /** groupId -> Telegram chat id */
    private Map<String, String> chats = new HashMap<>();

    public String chatFor(String groupId) {
        return chats.getOrDefault(groupId, defaultChatId);
    }
}
