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

package com.netflix.kubebalance.profiles;

/**
 * Thrown when a workload profile change event carries a payload that can't be decoded into a
 * {@link WorkloadProfile}.
 */
public class WorkloadProfileDecodingException extends Exception {

    public WorkloadProfileDecodingException(String message) {
        super(message);
    }

    public WorkloadProfileDecodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
