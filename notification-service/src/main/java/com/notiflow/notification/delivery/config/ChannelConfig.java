package com.notiflow.notification.delivery.config;

import com.notiflow.notification.delivery.channel.BitrixChannel;
import com.notiflow.notification.delivery.channel.EmailChannel;
import com.sendgrid.SendGrid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.concurrent.ExecutorService;

/**
 * Enabled channels are tried in bean order: email first, then Bitrix.
 */
@Configuration
@Slf4j
public class ChannelConfig {

    @Bean
    @Order(1)
    @ConditionalOnProperty(prefix = "notification.channels.email", name = "enabled", havingValue = "true")
    public EmailChannel emailChannel(EmailChannelProperties properties,
                                     @Qualifier("channelIoExecutor") ExecutorService channelIoExecutor) {
        log.info("Email channel enabled (from={})", properties.getFromEmail());
        return new EmailChannel(new SendGrid(properties.getApiKey()), properties, channelIoExecutor);
    }

    @Bean
    @Order(2)
    @ConditionalOnProperty(prefix = "notification.channels.bitrix", name = "enabled", havingValue = "true")
    public BitrixChannel bitrixChannel(BitrixChannelProperties properties, WebClient.Builder webClientBuilder) {
        log.info("Bitrix channel enabled (baseUrl={})", properties.getBaseUrl());
        WebClient webClient = webClientBuilder.clone()
            .baseUrl(properties.getBaseUrl())
            .build();
        return new BitrixChannel(webClient, properties);
    }
}
