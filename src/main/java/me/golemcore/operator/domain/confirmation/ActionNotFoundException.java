package me.golemcore.operator.domain.confirmation;

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
 * Thrown when confirm or cancel references a pending action that is unknown,
 * already resolved, expired, or owned by another user.
 */
public class ActionNotFoundException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String pendingId;

    public ActionNotFoundException(String pendingId) {
        super("Pending action " + pendingId + " not found or expired");
        this.pendingId = pendingId;
    }

    public String getPendingId() {
        return pendingId;
    }
}
