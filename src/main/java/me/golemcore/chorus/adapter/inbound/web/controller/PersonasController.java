package me.golemcore.chorus.adapter.inbound.web.controller;

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
import me.golemcore.chorus.domain.model.PersonaSnapshot;
import me.golemcore.chorus.domain.model.PersonaStatus;
import me.golemcore.chorus.domain.service.PersonaOrchestrator;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Read-only status of the running personas.
 */
@RestController
@RequestMapping("/api/personas")
@RequiredArgsConstructor
public class PersonasController {

    private final PersonaOrchestrator personaOrchestrator;

    @GetMapping
    public Mono<ResponseEntity<List<PersonaStatus>>> listPersonas() {
        return Mono.just(ResponseEntity.ok(personaOrchestrator.getStatuses()));
    }

    @GetMapping("/{id}")
    public Mono<ResponseEntity<PersonaSnapshot>> getPersona(@PathVariable String id) {
        return Mono.just(personaOrchestrator.findEngine(id)
                .map(engine -> ResponseEntity.ok(engine.snapshot()))
                .orElseGet(() -> ResponseEntity.notFound().build()));
    }
}
