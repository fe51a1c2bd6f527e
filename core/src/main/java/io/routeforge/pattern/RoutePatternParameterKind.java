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
 * Defines how a {@link RoutePatternParameterPart} binds to a requested path.
 *
 * @author RouteForge contributors
 */
public enum RoutePatternParameterKind {
    /**
     * A value must be supplied for the parameter, either by the path or by a default value.
     */
    STANDARD,
    /**
     * The parameter may be absent. Optional parameters cannot have default values.
     */
    OPTIONAL,
    /**
     * The parameter captures the remainder of the path.
     */
    CATCH_ALL
}
