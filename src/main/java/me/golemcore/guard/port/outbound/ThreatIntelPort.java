package me.golemcore.guard.port.outbound;

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

import java.util.concurrent.CompletableFuture;

/**
 * Port for external domain reputation lookups.
 */
public interface ThreatIntelPort {

    /**
     * Check whether a domain is known to be malicious.
     *
     * @param domain
     *            lower-case host name without scheme or port
     * @return {@code true} when the service flags the domain; completes
     *         exceptionally when the lookup fails
     */
    CompletableFuture<Boolean> isMaliciousDomain(String domain);

    /**
     * Check if lookups are configured and enabled.
     */
    boolean isEnabled();
}
