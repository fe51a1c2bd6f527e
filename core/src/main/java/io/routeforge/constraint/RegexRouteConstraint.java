/*
 * JBoss, Home of Professional Open Source.
 * Copyright 2025 Red Hat, Inc., and individual contributors
 * as indicated by the @author tags.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */

package io.routeforge.constraint;

import io.routeforge.RouteForgeMessages;
import io.routeforge.util.RouteValueEqualityComparer;

import java.util.Map;
import java.util.regex.Pattern;

/**
 * Constrains a route parameter to values that match a regular expression. Matching ignores case.
 *
 * <p>
 * Instances are immutable. Two instances are equal when their expressions are equal.</p>
 *
 * @author RouteForge contributors
 */
public class RegexRouteConstraint implements RouteConstraint {

    private final Pattern constraint;

    public RegexRouteConstraint(final String regexPattern) {
        if (regexPattern == null || regexPattern.isEmpty()) {
            throw RouteForgeMessages.MESSAGES.argumentNullOrEmpty("regexPattern");
        }
        this.constraint = Pattern.compile(regexPattern, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    public RegexRouteConstraint(final Pattern constraint) {
        if (constraint == null) {
            throw RouteForgeMessages.MESSAGES.argumentCannotBeNull("constraint");
        }
        this.constraint = constraint;
    }

    /**
     * @return The compiled regular expression.
     */
    public Pattern getConstraint() {
        return constraint;
    }

    @Override
    public boolean match(final String routeKey, final Map<String, Object> values) {
        if (routeKey == null) {
            throw RouteForgeMessages.MESSAGES.argumentCannotBeNull("routeKey");
        }
        if (values == null) {
            throw RouteForgeMessages.MESSAGES.argumentCannotBeNull("values");
        }

        final Object value = values.get(routeKey);
        if (value == null) {
            return false;
        }
        return constraint.matcher(RouteValueEqualityComparer.toRouteString(value)).find();
    }

    @Override
    public String toString() {
        return constraint.pattern();
    }

    @Override
    public int hashCode() {
        return constraint.pattern().hashCode();
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null) {
            return false;
        }
        if (getClass() != obj.getClass()) {
            return false;
        }
        final RegexRouteConstraint other = (RegexRouteConstraint) obj;
        return constraint.pattern().equals(other.constraint.pattern())
                && constraint.flags() == other.constraint.flags();
    }
}
