package me.golemcore.guard.domain.model;

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

/**
 * Kinds of entries written to the moderation audit trail.
 */
public enum AuditEventType {

    /** A message produced at least one violation. */
    EVALUATION,

    /** The host platform could not apply a decided action. */
    ACTION_FAILED,

    /** Profile load or save failed after retries. */
    STORE_UNAVAILABLE,

    /** An operator changed a profile by hand. */
    MANUAL_OVERRIDE,

    /** A queued evaluation was rejected before it ran. */
    EVALUATION_DROPPED
}
