package me.golemcore.reasoning.domain.breaker;

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

import java.time.Duration;

/**
 * Whether a breaker admitted a call.
 *
 * @param permitted
 *            call may proceed
 * @param consecutiveFailures
 *            failure count at decision time
 * @param retryAfter
 *            remaining cooldown when rejected
 */
public record BreakerAdmission(boolean permitted, int consecutiveFailures, Duration retryAfter) {

    static BreakerAdmission permit(int consecutiveFailures) {
        return new BreakerAdmission(true, consecutiveFailures, Duration.ZERO);
    }

    static BreakerAdmission reject(int consecutiveFailures, Duration retryAfter) {
        return new BreakerAdmission(false, consecutiveFailures, retryAfter);
    }
}
