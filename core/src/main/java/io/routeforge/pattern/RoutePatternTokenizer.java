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
 * Splits route template strings into path segments. Implementations are supplied by the routing layer and define the template
 * grammar; {@link RoutePatternFactory#parse(RoutePatternTokenizer, String)} feeds their output through the same normalization
 * as patterns that are assembled from parts.
 *
 * @author RouteForge contributors
 */
@FunctionalInterface
public interface RoutePatternTokenizer {

    /**
     * @param pattern The route template string. Never {@code null}.
     *
     * @return The segments of the template, in order.
     *
     * @throws RoutePatternException If the template is not valid.
     */
    List<RoutePatternPathSegment> tokenize(String pattern);
}
