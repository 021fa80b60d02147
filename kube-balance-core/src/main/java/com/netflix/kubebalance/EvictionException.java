/*
 * Copyright 2026 Netflix, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.netflix.kubebalance;

/**
 * Thrown by {@link EvictionApi} when an eviction request is refused or fails. Carries the HTTP status of the
 * response when there was one.
 */
public class EvictionException extends Exception {

    public static final int TOO_MANY_REQUESTS = 429;

    private final int statusCode;

    public EvictionException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public EvictionException(int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * @return the HTTP status code, or 0 if the request did not get a response
     */
    public int getStatusCode() {
        return statusCode;
    }

    public boolean isTooManyRequests() {
        return statusCode == TOO_MANY_REQUESTS;
    }
}
