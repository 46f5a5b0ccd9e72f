package me.golemcore.guard.security;

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

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Publishes the current {@link PatternLibrary}. Evaluations take one
 * reference at their start and keep using it even if a refresh swaps in a
 * newer version meanwhile.
 */
@Component
@Slf4j
public class PatternLibraryHolder {

    private final PatternLibraryFactory factory;
    private final AtomicReference<PatternLibrary> current = new AtomicReference<>();

    public PatternLibraryHolder(PatternLibraryFactory factory) {
        this.factory = factory;
        this.current.set(factory.build(1));
    }

    public PatternLibrary current() {
        return current.get();
    }

    /**
     * Rebuild the library from the current configuration and publish it as the
     * next version.
     */
    public synchronized PatternLibrary refresh() {
        PatternLibrary next = factory.build(current.get().getVersion() + 1);
        current.set(next);
        log.info("[Patterns] Published pattern library v{}", next.getVersion());
        return next;
    }
}
