package me.golemcore.chorus.adapter.inbound.telegram;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.RequiredArgsConstructor;
import me.golemcore.chorus.domain.model.ChannelSpec;
import me.golemcore.chorus.infrastructure.config.BotProperties;
import me.golemcore.chorus.port.inbound.ChannelFactory;
import me.golemcore.chorus.port.inbound.ChannelPort;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.client.okhttp.OkHttpTelegramClient;
import org.telegram.telegrambots.longpolling.TelegramBotsLongPollingApplication;

/**
 * Creates one {@link TelegramChannelAdapter} per persona token, all polling
 * through the shared long-polling application.
 */
@Component
@RequiredArgsConstructor
public class TelegramChannelFactory implements ChannelFactory {

    private final TelegramBotsLongPollingApplication botsApplication;
    private final BotProperties properties;

    @Override
    public String getChannelType() {
        return TelegramChannelAdapter.CHANNEL_TYPE;
    }

    @Override
    public ChannelPort create(ChannelSpec spec) {
        return new TelegramChannelAdapter(spec.personaId(), spec.token(), botsApplication,
                new OkHttpTelegramClient(spec.token()), properties.getAttachments().getMaxDownloadBytes());
    }
}
