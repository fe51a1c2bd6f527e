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

import java.util.Map;

/**
 * A {@link ParameterPolicy} that decides whether the value bound to a route parameter is acceptable.
 *
 * @author RouteForge contributors
 */
public interface RouteConstraint extends ParameterPolicy {

    /**
     * Determines whether the value stored under {@code routeKey} satisfies this constraint.
     *
     * @param routeKey The name of the route parameter.
     * @param values   The route values, keyed by parameter name.
     *
     * @return True if the value is acceptable.
     */
    boolean match(String routeKey, Map<String, Object> values);
}
