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

package org.fireflyframework.datatest.diff;

import org.fireflyframework.datatest.difference.Difference;
import org.fireflyframework.datatest.difference.Extra;
import org.fireflyframework.datatest.difference.Missing;
import org.fireflyframework.datatest.difference.ValueFormat;
import org.fireflyframework.datatest.requirement.ElementRequirement;
import org.fireflyframework.datatest.requirement.GroupKeyOrder;
import org.fireflyframework.datatest.requirement.MappingRequirement;
import org.fireflyframework.datatest.requirement.Requirement;
import org.fireflyframework.datatest.requirement.SequenceRequirement;
import org.fireflyframework.datatest.requirement.SetRequirement;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Compares grouped data against grouped requirements, one group at a time.
 *
 * <p>Groups are visited in ascending {@link GroupKeyOrder} over the union of required
 * and observed keys, and every difference is tagged with its group key:</p>
 * <ul>
 *   <li>a key present on both sides is compared with the {@link Differ}</li>
 *   <li>a key only in the requirement makes every required element {@link Missing}</li>
 *   <li>a key only in the data makes every observed element {@link Extra}</li>
 * </ul>
 *
 * <p>Keys are matched by {@link GroupKeyOrder#canonicalKey(Object)}, so {@code 1} and
 * {@code 1L} name the same group; such differences carry the required key.
 * Mismatched keys are reported as data, never as errors. Group values must be
 * scalars or collections; a nested map raises {@link ShapeMismatchException}.</p>
 */
public class GroupComparator {

    private final Differ differ;

    public GroupComparator(Differ differ) {
        this.differ = differ;
    }

    /**
     * Compares each group of the observed data against the requirement for the same key.
     *
     * @param requirement the grouped requirement
     * @param observed    the observed groups
     * @return the tagged differences, ordered by group key
     */
    public List<Difference> diffGroups(MappingRequirement requirement, Map<?, ?> observed) {
        Map<Object, Object> requiredKeys = indexKeys(requirement.entries().keySet());
        Map<Object, Object> observedKeys = indexKeys(observed.keySet());
        Map<Object, Object> displayKeys = new HashMap<>(observedKeys);
        displayKeys.putAll(requiredKeys);

        List<Object> groups = new ArrayList<>(displayKeys.keySet());
        groups.sort(Comparator.comparing(displayKeys::get, GroupKeyOrder.INSTANCE));

        List<Difference> differences = new ArrayList<>();
        for (Object group : groups) {
            boolean required = requiredKeys.containsKey(group);
            boolean present = observedKeys.containsKey(group);

            List<Difference> groupDifferences;
            if (required && present) {
                groupDifferences = differ.diff(requirement.get(requiredKeys.get(group)),
                        groupValue(observedKeys.get(group), observed, requirement));
            } else if (required) {
                groupDifferences = missingGroup(requirement.get(requiredKeys.get(group)));
            } else {
                groupDifferences = extraGroup(groupValue(observedKeys.get(group), observed, requirement));
            }
            tag(displayKeys.get(group), groupDifferences, differences);
        }
        return differences;
    }

    /**
     * Applies one requirement to every observed group.
     *
     * @param requirement a non-mapping requirement
     * @param observed    the observed groups
     * @return the tagged differences, ordered by group key
     */
    public List<Difference> diffEach(Requirement requirement, Map<?, ?> observed) {
        List<Difference> differences = new ArrayList<>();
        for (Object key : sorted(observed.keySet())) {
            tag(key, differ.diff(requirement, groupValue(key, observed, requirement)), differences);
        }
        return differences;
    }

    private List<Difference> missingGroup(Requirement requirement) {
        List<Difference> differences = new ArrayList<>();
        if (requirement instanceof SetRequirement set) {
            if (set.reportsMissing()) {
                set.members().forEach(member -> differences.add(new Missing(member.expected())));
            }
        } else if (requirement instanceof SequenceRequirement sequence) {
            sequence.items().forEach(item -> differences.add(new Missing(item.expected())));
        } else if (requirement instanceof ElementRequirement element) {
            differences.add(new Missing(element.expected()));
        }
        return differences;
    }

    private List<Difference> extraGroup(Object observed) {
        List<Difference> differences = new ArrayList<>();
        for (Object element : ObservedShape.elements(observed)) {
            differences.add(new Extra(element));
        }
        return differences;
    }

    private Object groupValue(Object key, Map<?, ?> observed, Requirement requirement) {
        Object value = observed.get(key);
        if (value instanceof Map<?, ?>) {
            throw new ShapeMismatchException(
                    "Group " + ValueFormat.format(key) + " holds nested grouped data",
                    requirement, ObservedShape.GROUPED);
        }
        return value;
    }

    // Keys equal by canonical form share one group; a second such key in the same map keeps its own.
    private static Map<Object, Object> indexKeys(Set<?> keys) {
        Map<Object, Object> index = new HashMap<>();
        for (Object key : sorted(keys)) {
            Object canonical = GroupKeyOrder.canonicalKey(key);
            index.put(index.containsKey(canonical) ? new DistinctKey(key) : canonical, key);
        }
        return index;
    }

    private static List<Object> sorted(Set<?> keys) {
        List<Object> ordered = new ArrayList<>(keys);
        ordered.sort(GroupKeyOrder.INSTANCE);
        return ordered;
    }

    private static void tag(Object key, List<Difference> source, List<Difference> target) {
        for (Difference difference : source) {
            target.add(difference.withKey(key));
        }
    }

    private record DistinctKey(Object key) {}
}
