package me.golemcore.chorus;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * GolemCore Chorus: several bot personas sitting in the same group chats.
 *
 * <p>
 * Each persona owns its own channel connection and decides on its own whether
 * to speak. Expert personas answer every question straight away. Observer
 * personas wait, check whether the discussion moved to a new topic, ask the
 * model whether their role has something to add, and only then reply.
 *
 * <p>
 * Personas are configured under {@code bot.personas[*]} and can be tuned per
 * deployment through {@code BOT_ROLE_<ID>_*} environment variables.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ChorusApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChorusApplication.class, args);
    }
}
