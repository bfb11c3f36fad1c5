package me.golemcore.chorus.adapter.outbound.environment;

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
import me.golemcore.chorus.port.outbound.EnvironmentPort;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Reads settings through Spring's {@link Environment}, which covers OS
 * environment variables, system properties and application.properties.
 */
@Component
@RequiredArgsConstructor
public class SpringEnvironmentAdapter implements EnvironmentPort {

    private final Environment environment;

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(environment.getProperty(key));
    }
}
