package me.golemcore.memory.domain.model;

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
 * Outcome of the promotion gate for one view.
 */
public enum GateVerdict {
    KEEP_ACTIVE(ViewStatus.ACTIVE),
    EXPIRE(ViewStatus.EXPIRED),
    PROMOTE(ViewStatus.PROMOTED),
    REJECT(ViewStatus.REJECTED);

    private final ViewStatus resultingStatus;

    GateVerdict(ViewStatus resultingStatus) {
        this.resultingStatus = resultingStatus;
    }

    public ViewStatus getResultingStatus() {
        return resultingStatus;
    }

    public static GateVerdict forStatus(ViewStatus status) {
        for (GateVerdict verdict : values()) {
            if (verdict.resultingStatus == status) {
                return verdict;
            }
        }
        throw new IllegalArgumentException("No verdict for status " + status);
    }
}
