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

/**
 * Parent class for the parts of a {@link RoutePatternPathSegment}.
 *
 * <p>
 * This class is not meant to be extended outside of this package. Parts are created through {@link RoutePatternFactory} and
 * are immutable.</p>
 *
 * @author RouteForge contributors
 */
public abstract class RoutePatternPart {

    private final RoutePatternPartKind partKind;

    RoutePatternPart(final RoutePatternPartKind partKind) {
        this.partKind = partKind;
    }

    public RoutePatternPartKind getPartKind() {
        return partKind;
    }

    public boolean isLiteral() {
        return partKind == RoutePatternPartKind.LITERAL;
    }

    public boolean isParameter() {
        return partKind == RoutePatternPartKind.PARAMETER;
    }

    public boolean isSeparator() {
        return partKind == RoutePatternPartKind.SEPARATOR;
    }
}
