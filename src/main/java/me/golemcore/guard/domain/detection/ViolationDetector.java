package me.golemcore.guard.domain.detection;

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
 * One detection rule of the pipeline.
 *
 * <p>
 * Implementations must be thread-safe: the pipeline runs the detectors of one
 * evaluation concurrently and shares detector instances across users. Expected
 * conditions are reported through {@link DetectorResult}; an exception is
 * treated as a failed result.
 */
public interface ViolationDetector {

    /**
     * Stable name used in logs, degraded-detector lists and
     * {@code guard.detection.disabled-detectors}.
     */
    String getName();

    DetectorResult detect(DetectionContext context);
}
