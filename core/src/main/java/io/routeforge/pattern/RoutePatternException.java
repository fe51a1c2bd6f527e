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
 * Thrown when a route pattern is structurally invalid, for example when the same parameter name appears more than once.
 *
 * @author RouteForge contributors
 */
public class RoutePatternException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String pattern;

    /**
     * @param pattern The raw text of the offending route pattern. May be {@code null}.
     * @param message The error message.
     */
    public RoutePatternException(final String pattern, final String message) {
        super(message);
        this.pattern = pattern;
    }

    /**
     * @return The raw text of the offending route pattern.
     */
    public String getPattern() {
        return pattern;
    }
}
