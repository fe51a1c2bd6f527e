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

import java.util.List;
import java.util.Objects;

/**
 * A named parameter inside a route pattern segment, for example {@code {id:int=1}}.
 *
 * <p>
 * A parameter carries its inline default value and parameter policies. Once the parameter is part of a {@link RoutePattern},
 * these reflect the out-of-line defaults and policies of the pattern as well.</p>
 *
 * Instances of this class are immutable.
 *
 * @author RouteForge contributors
 */
public final class RoutePatternParameterPart extends RoutePatternPart {

    private final String name;
    private final Object defaultValue;
    private final RoutePatternParameterKind parameterKind;
    private final List<RoutePatternParameterPolicyReference> parameterPolicies;
    private final boolean encodeSlashes;

    RoutePatternParameterPart(
            final String name,
            final Object defaultValue,
            final RoutePatternParameterKind parameterKind,
            final List<RoutePatternParameterPolicyReference> parameterPolicies,
            final boolean encodeSlashes
    ) {
        super(RoutePatternPartKind.PARAMETER);
        this.name = Objects.requireNonNull(name);
        this.defaultValue = defaultValue;
        this.parameterKind = Objects.requireNonNull(parameterKind);
        this.parameterPolicies = List.copyOf(parameterPolicies);
        this.encodeSlashes = encodeSlashes;
    }

    public String getName() {
        return name;
    }

    /**
     * @return The default value, or {@code null} if the parameter has none.
     */
    public Object getDefault() {
        return defaultValue;
    }

    public RoutePatternParameterKind getParameterKind() {
        return parameterKind;
    }

    /**
     * @return The policies of this parameter, in declaration order. Never {@code null}.
     */
    public List<RoutePatternParameterPolicyReference> getParameterPolicies() {
        return parameterPolicies;
    }

    /**
     * @return True if a '/' in the value of this parameter is percent-encoded when a path is generated from the pattern.
     */
    public boolean isEncodeSlashes() {
        return encodeSlashes;
    }

    public boolean isOptional() {
        return parameterKind == RoutePatternParameterKind.OPTIONAL;
    }

    public boolean isCatchAll() {
        return parameterKind == RoutePatternParameterKind.CATCH_ALL;
    }

    @Override
    public String toString() {
        final StringBuilder builder = new StringBuilder("{");
        if (isCatchAll()) {
            builder.append(encodeSlashes ? "*" : "**");
        }
        builder.append(name);
        for (final RoutePatternParameterPolicyReference policy : parameterPolicies) {
            builder.append(':').append(policy);
        }
        if (defaultValue != null) {
            builder.append('=').append(defaultValue);
        }
        if (isOptional()) {
            builder.append('?');
        }
        return builder.append('}').toString();
    }

    @Override
    public int hashCode() {
        int hash = 3;
        hash = 37 * hash + name.hashCode();
        hash = 37 * hash + Objects.hashCode(defaultValue);
        hash = 37 * hash + parameterKind.hashCode();
        hash = 37 * hash + parameterPolicies.hashCode();
        hash = 37 * hash + (encodeSlashes ? 1 : 0);
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
        final RoutePatternParameterPart other = (RoutePatternParameterPart) obj;
        if (this.encodeSlashes != other.encodeSlashes || this.parameterKind != other.parameterKind) {
            return false;
        }
        return name.equals(other.name)
                && Objects.equals(defaultValue, other.defaultValue)
                && parameterPolicies.equals(other.parameterPolicies);
    }
}
