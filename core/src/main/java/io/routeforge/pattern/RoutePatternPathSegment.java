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

/**
 * One '/' delimited section of a route pattern. A segment consists of one or more parts. Segments with more than one part,
 * such as {@code {name}.{extension}}, are called complex segments.
 *
 * <p>
 * Segments do not validate how their parts are arranged. That is the responsibility of the tokenizer that produced
 * them.</p>
 *
 * Instances of this class are immutable.
 *
 * @author RouteForge contributors
 */
public final class RoutePatternPathSegment {

    private final List<RoutePatternPart> parts;

    RoutePatternPathSegment(final List<RoutePatternPart> parts) {
        this.parts = List.copyOf(parts);
    }

    /**
     * @return The parts of this segment in order of appearance.
     */
    public List<RoutePatternPart> getParts() {
        return parts;
    }

    /**
     * @return True if this segment consists of exactly one part.
     */
    public boolean isSimple() {
        return parts.size() == 1;
    }

    @Override
    public String toString() {
        final StringBuilder builder = new StringBuilder();
        for (final RoutePatternPart part : parts) {
            builder.append(part);
        }
        return builder.toString();
    }

    @Override
    public int hashCode() {
        return parts.hashCode();
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
        return parts.equals(((RoutePatternPathSegment) obj).parts);
    }
}
