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

import java.util.List;
import java.util.Objects;

/**
 * Unordered membership requirement. Each observed element must match exactly one
 * member; unmatched members are missing and unmatched elements are extra.
 *
 * @param members  the members in declared order
 * @param relation which unmatched side is reported
 */
public record SetRequirement(List<ElementRequirement> members, SetRelation relation) implements Requirement {

    public SetRequirement {
        members = List.copyOf(members);
        relation = Objects.requireNonNullElse(relation, SetRelation.EQUAL);
    }

    public SetRequirement(List<ElementRequirement> members) {
        this(members, SetRelation.EQUAL);
    }

    /**
     * Returns a copy of this requirement with the given relation.
     *
     * @param relation the relation
     * @return the new requirement
     */
    public SetRequirement withRelation(SetRelation relation) {
        return new SetRequirement(members, relation);
    }

    /**
     * Returns whether every member is a literal, which allows hash-based matching.
     *
     * @return {@code true} if all members are {@link EqualityRequirement}s
     */
    public boolean isLiteralOnly() {
        return members.stream().allMatch(EqualityRequirement.class::isInstance);
    }

    public boolean reportsMissing() {
        return relation.reportsMissing();
    }

    public boolean reportsExtra() {
        return relation.reportsExtra();
    }

    @Override
    public String failureMessage() {
        return switch (relation) {
            case EQUAL -> "does not satisfy set membership";
            case SUBSET -> "is not a subset of the required set";
            case SUPERSET -> "is not a superset of the required set";
        };
    }
}
