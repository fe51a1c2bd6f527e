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

package io.routeforge.util;

/**
 * Equality rules for route values.
 *
 * <p>
 * Route values are compared by their string representation, ignoring case. {@code null} and the empty string are
 * considered equal to each other and to nothing else.</p>
 *
 * @author RouteForge contributors
 */
public final class RouteValueEqualityComparer {

    public static final RouteValueEqualityComparer DEFAULT = new RouteValueEqualityComparer();

    private RouteValueEqualityComparer() {
    }

    /**
     * Renders a route value the way it is compared. {@code null} becomes the empty string.
     *
     * @param value The route value.
     *
     * @return The string form of the value.
     */
    public static String toRouteString(final Object value) {
        return value == null ? "" : value.toString();
    }

    public boolean equals(final Object x, final Object y) {
        final String stringX = toRouteString(x);
        final String stringY = toRouteString(y);
        if (stringX.isEmpty()) {
            return stringY.isEmpty();
        }
        return stringX.equalsIgnoreCase(stringY);
    }

    public int hashCode(final Object value) {
        // folded one char at a time, the same way String#equalsIgnoreCase compares
        final String string = toRouteString(value);
        int hash = 0;
        for (int i = 0; i < string.length(); ++i) {
            hash = 31 * hash + Character.toLowerCase(Character.toUpperCase(string.charAt(i)));
        }
        return hash;
    }
}
