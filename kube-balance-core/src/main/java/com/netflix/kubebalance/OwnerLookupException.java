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
 * Thrown by {@link OwnerResolver} when an object referenced as the controller of a pod can't be fetched. This is
 * distinct from a pod having no recognized owner, which is not an error.
 */
public class OwnerLookupException extends Exception {

    public OwnerLookupException(String message, Throwable cause) {
        super(message, cause);
    }
}
