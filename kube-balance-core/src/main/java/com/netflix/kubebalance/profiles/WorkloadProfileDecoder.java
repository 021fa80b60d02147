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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Decodes a {@link WorkloadProfile} from the resource form delivered by a change event:
 * <pre>
 * {
 *   "metadata": { "name": "batch" },
 *   "spec": { "cpuRequests": "500m", "memoryRequests": "1Gi", "evictionPriority": 10 }
 * }
 * </pre>
 * The payload may be a JSON string, a Jackson tree, or any object Jackson can convert to a tree, such as a map or an
 * annotated resource class. A missing {@code evictionPriority} decodes as 0. A deletion tombstone of the form
 * {@code {"key": ..., "obj": {...}}} decodes as its inner object.
 */
public class WorkloadProfileDecoder {

    private final ObjectMapper mapper;

    public WorkloadProfileDecoder() {
        this(new ObjectMapper());
    }

    public WorkloadProfileDecoder(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public WorkloadProfile decode(Object payload) throws WorkloadProfileDecodingException {
        if (payload == null)
            throw new WorkloadProfileDecodingException("Null workload profile payload");
        if (payload instanceof WorkloadProfile)
            return (WorkloadProfile) payload;
        final JsonNode tree = unwrap(toTree(payload));
        final String name = nameOf(tree);
        final JsonNode spec = tree.path("spec");
        final JsonNode priority = spec.path("evictionPriority");
        final int evictionPriority;
        if (priority.isMissingNode() || priority.isNull())
            evictionPriority = 0;
        else if (priority.canConvertToInt() && priority.isIntegralNumber())
            evictionPriority = priority.intValue();
        else
            throw new WorkloadProfileDecodingException("Workload profile " + name +
                    ": evictionPriority is not an integer: " + priority);
        return new WorkloadProfile(
                name,
                spec.path("cpuRequests").textValue(),
                spec.path("memoryRequests").textValue(),
                evictionPriority
        );
    }

    /**
     * Decode only the name of a workload profile payload, ignoring its spec. Deletions are applied by name, so a
     * profile whose spec no longer decodes can still be removed.
     *
     * @param payload the profile payload, in any of the forms accepted by {@link #decode(Object)}
     * @return the profile name
     * @throws WorkloadProfileDecodingException if the payload carries no name
     */
    public String decodeName(Object payload) throws WorkloadProfileDecodingException {
        if (payload == null)
            throw new WorkloadProfileDecodingException("Null workload profile payload");
        if (payload instanceof WorkloadProfile)
            return ((WorkloadProfile) payload).getName();
        return nameOf(unwrap(toTree(payload)));
    }

    // tombstone of a deletion whose final state was missed, carrying the last known object
    private static JsonNode unwrap(JsonNode tree) {
        if (!tree.has("metadata") && tree.path("obj").isObject())
            return tree.get("obj");
        return tree;
    }

    private static String nameOf(JsonNode tree) throws WorkloadProfileDecodingException {
        final String name = tree.path("metadata").path("name").textValue();
        if (name == null || name.isEmpty())
            throw new WorkloadProfileDecodingException("Workload profile payload has no metadata.name");
        return name;
    }

    private JsonNode toTree(Object payload) throws WorkloadProfileDecodingException {
        if (payload instanceof JsonNode)
            return (JsonNode) payload;
        if (payload instanceof String) {
            try {
                return mapper.readTree((String) payload);
            } catch (JsonProcessingException e) {
                throw new WorkloadProfileDecodingException("Invalid workload profile JSON: " + e.getOriginalMessage(), e);
            }
        }
        try {
            return mapper.valueToTree(payload);
        } catch (IllegalArgumentException e) {
            throw new WorkloadProfileDecodingException("Can't convert " + payload.getClass().getName() +
                    " to a workload profile", e);
        }
    }
}
