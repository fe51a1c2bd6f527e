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

package io.routeforge.pattern;

import io.routeforge.constraint.ParameterPolicy;

import java.util.Objects;

/**
 * A reference to a {@link ParameterPolicy} attached to a route parameter. A reference is either <i>resolved</i>, holding an
 * instantiated policy, or <i>deferred</i>, holding the textual name of a policy that is resolved later, for example
 * {@code int} or {@code range(1, 10)}.
 *
 * Instances of this class are immutable.
 *
 * @author RouteForge contributors
 */
public final class RoutePatternParameterPolicyReference {

    private final String content;
    private final ParameterPolicy parameterPolicy;

    RoutePatternParameterPolicyReference(final String content) {
        this.content = Objects.requireNonNull(content);
        this.parameterPolicy = null;
    }

    RoutePatternParameterPolicyReference(final ParameterPolicy parameterPolicy) {
        this.content = null;
        this.parameterPolicy = Objects.requireNonNull(parameterPolicy);
    }

    /**
     * @return The textual reference, or {@code null} if this reference is resolved.
     */
    public String getContent() {
        return content;
    }

    /**
     * @return The policy, or {@code null} if this reference is deferred.
     */
    public ParameterPolicy getParameterPolicy() {
        return parameterPolicy;
    }

    public boolean isResolved() {
        return parameterPolicy != null;
    }

    @Override
    public String toString() {
        return content != null ? content : parameterPolicy.toString();
    }

    @Override
    public int hashCode() {
        int hash = 5;
        hash = 97 * hash + Objects.hashCode(this.content);
        hash = 97 * hash + Objects.hashCode(this.parameterPolicy);
        return hash;
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
        final RoutePatternParameterPolicyReference other = (RoutePatternParameterPolicyReference) obj;
        return Objects.equals(this.content, other.content)
                && Objects.equals(this.parameterPolicy, other.parameterPolicy);
    }
}
