package com.incoresoft.sosync.config;

import com.incoresoft.sosync.notification.LoggingNotificationDispatcher;
import com.incoresoft.sosync.notification.NotificationDispatcher;
import com.incoresoft.sosync.telegram.TelegramNotificationDispatcher;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.telegram.telegrambots.bots.DefaultBotOptions;

/**
 * Picks the notification transport. One dispatcher instance is created at start-up and
 * handed to the coordinators; Spring drives its init/shutdown.
 */
@Configuration
public class NotificationConfig {

    @Bean(initMethod = "init", destroyMethod = "shutdown")
    @ConditionalOnProperty(prefix = "telegram", name = "enabled", havingValue = "true")
    public NotificationDispatcher telegramNotificationDispatcher(TelegramProps props) {
        return new TelegramNotificationDispatcher(new DefaultBotOptions(), props);
    }

    @Bean(initMethod = "init", destroyMethod = "shutdown")
    @ConditionalOnProperty(prefix = "telegram", name = "enabled", havingValue = "false", matchIfMissing = true)
    public NotificationDispatcher loggingNotificationDispatcher() {
        return new LoggingNotificationDispatcher();
    }
}
