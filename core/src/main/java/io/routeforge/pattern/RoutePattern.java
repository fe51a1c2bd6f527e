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
import java.util.Map;
import java.util.Objects;

/**
 * A parsed and normalized route pattern.
 *
 * <p>
 * A route pattern offers two views of the same data: the parameter parts inside {@link #getPathSegments()} carry their
 * default values and policies inline, while {@link #getDefaults()} and {@link #getParameterPolicies()} offer the same
 * information keyed by parameter name. {@link RoutePatternFactory} keeps the two views consistent. The flat views may contain
 * additional entries for names that do not correspond to a parameter.</p>
 *
 * <p>
 * All keys are compared case-insensitively. Instances of this class are immutable and may be shared between threads.</p>
 *
 * @author RouteForge contributors
 */
public final class RoutePattern {

    /**
     * Separator between the segments of a route pattern.
     */
    public static final char SEPARATOR = '/';

    private final String rawText;
    private final Map<String, Object> defaults;
    private final Map<String, List<RoutePatternParameterPolicyReference>> parameterPolicies;
    private final Map<String, Object> requiredValues;
    private final List<RoutePatternParameterPart> parameters;
    private final List<RoutePatternPathSegment> pathSegments;

    RoutePattern(
            final String rawText,
            final Map<String, Object> defaults,
            final Map<String, List<RoutePatternParameterPolicyReference>> parameterPolicies,
            final Map<String, Object> requiredValues,
            final List<RoutePatternParameterPart> parameters,
            final List<RoutePatternPathSegment> pathSegments
    ) {
        this.rawText = rawText;
        this.defaults = Objects.requireNonNull(defaults);
        this.parameterPolicies = Objects.requireNonNull(parameterPolicies);
        this.requiredValues = Objects.requireNonNull(requiredValues);
        this.parameters = Objects.requireNonNull(parameters);
        this.pathSegments = Objects.requireNonNull(pathSegments);
    }

    /**
     * @return The text the pattern was created from, or {@code null}. Only used for diagnostics.
     */
    public String getRawText() {
        return rawText;
    }

    /**
     * @return Default values keyed by parameter name, including defaults for names that are not parameters.
     */
    public Map<String, Object> getDefaults() {
        return defaults;
    }

    /**
     * @return Parameter policies keyed by parameter name.
     */
    public Map<String, List<RoutePatternParameterPolicyReference>> getParameterPolicies() {
        return parameterPolicies;
    }

    /**
     * @return Values that must be present for the pattern to match, keyed by name.
     */
    public Map<String, Object> getRequiredValues() {
        return requiredValues;
    }

    /**
     * @return All parameter parts of all segments, in order of appearance.
     */
    public List<RoutePatternParameterPart> getParameters() {
        return parameters;
    }

    public List<RoutePatternPathSegment> getPathSegments() {
        return pathSegments;
    }

    /**
     * Finds a parameter by name, ignoring case.
     *
     * @param name The name of the parameter.
     *
     * @return The parameter, or {@code null} if the pattern has no parameter with that name.
     */
    public RoutePatternParameterPart getParameter(final String name) {
        if (name == null) {
            return null;
        }
        for (final RoutePatternParameterPart parameter : parameters) {
            if (parameter.getName().equalsIgnoreCase(name)) {
                return parameter;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        if (rawText != null) {
            return rawText;
        }
        final StringBuilder builder = new StringBuilder();
        for (int i = 0; i < pathSegments.size(); ++i) {
            if (i > 0) {
                builder.append(SEPARATOR);
            }
            builder.append(pathSegments.get(i));
        }
        return builder.toString();
    }

    @Override
    public int hashCode() {
        int hash = 7;
        hash = 29 * hash + Objects.hashCode(rawText);
        hash = 29 * hash + pathSegments.hashCode();
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
        final RoutePattern other = (RoutePattern) obj;
        return Objects.equals(rawText, other.rawText)
                && pathSegments.equals(other.pathSegments)
                && parameters.equals(other.parameters)
                && defaults.equals(other.defaults)
                && parameterPolicies.equals(other.parameterPolicies)
                && requiredValues.equals(other.requiredValues);
    }
}
