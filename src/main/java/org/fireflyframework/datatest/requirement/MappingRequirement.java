/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
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
 */

package org.fireflyframework.datatest.requirement;

import org.fireflyframework.datatest.difference.ValueFormat;
import org.fireflyframework.datatest.match.Literals;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Requirement keyed by group: each entry applies to the observed group with the same key.
 *
 * <p>Entries are held in ascending {@link GroupKeyOrder}. A {@code null} key is allowed
 * and sorts first. Keys that are equal under {@link GroupKeyOrder#canonicalKey(Object)},
 * such as {@code 1} and {@code 1L}, may not both be present, and entries must not
 * themselves be mappings.</p>
 *
 * @param entries the sub-requirement per group key
 */
public record MappingRequirement(Map<Object, Requirement> entries) implements Requirement {

    public MappingRequirement {
        List<Map.Entry<Object, Requirement>> sorted = new ArrayList<>(entries.entrySet());
        Map<Object, Object> seen = new HashMap<>();
        for (Map.Entry<Object, Requirement> entry : sorted) {
            Object key = entry.getKey();
            if (entry.getValue() == null) {
                throw new MalformedRequirementException(
                        "Requirement for group " + ValueFormat.format(key) + " is missing");
            }
            if (entry.getValue() instanceof MappingRequirement) {
                throw new MalformedRequirementException(
                        "Requirement for group " + ValueFormat.format(key) + " must not be a nested mapping");
            }
            Object canonical = GroupKeyOrder.canonicalKey(key);
            if (seen.containsKey(canonical)) {
                throw new MalformedRequirementException("Group keys " + ValueFormat.format(seen.get(canonical))
                        + " and " + ValueFormat.format(key) + " denote the same group");
            }
            seen.put(canonical, key);
        }
        sorted.sort(Map.Entry.comparingByKey(GroupKeyOrder.INSTANCE));
        Map<Object, Requirement> copy = new LinkedHashMap<>();
        for (Map.Entry<Object, Requirement> entry : sorted) {
            copy.put(Literals.freeze(entry.getKey()), entry.getValue());
        }
        entries = Collections.unmodifiableMap(copy);
    }

    /**
     * Returns the sub-requirement for a group.
     *
     * @param key the group key, may be {@code null}
     * @return the sub-requirement, or {@code null} if the group is not required
     */
    public Requirement get(Object key) {
        return entries.get(key);
    }

    @Override
    public String failureMessage() {
        return "does not satisfy mapping requirement";
    }
}
