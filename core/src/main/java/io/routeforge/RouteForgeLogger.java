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

package io.routeforge;

import org.jboss.logging.BasicLogger;
import org.jboss.logging.Logger;
import org.jboss.logging.annotations.LogMessage;
import org.jboss.logging.annotations.Message;
import org.jboss.logging.annotations.MessageLogger;

import static org.jboss.logging.Logger.Level.DEBUG;

/**
 * log messages start at 5000
 *
 * @author RouteForge contributors
 */
@MessageLogger(projectCode = "RF")
public interface RouteForgeLogger extends BasicLogger {

    RouteForgeLogger PATTERN_LOGGER = Logger.getMessageLogger(RouteForgeLogger.class, RouteForgeLogger.class.getPackage().getName() + ".pattern");

    @LogMessage(level = DEBUG)
    @Message(id = 5001, value = "Route pattern '%s': folded %s out-of-line default(s) and %s out-of-line parameter policy set(s) into %s parameter(s)")
    void mergedRoutePattern(String pattern, int defaults, int parameterPolicies, int parameters);

    @LogMessage(level = DEBUG)
    @Message(id = 5002, value = "Combined route patterns '%s' and '%s' into '%s'")
    void combinedRoutePatterns(String left, String right, String combined);

    @LogMessage(level = DEBUG)
    @Message(id = 5003, value = "Slash encoding for route parameters is disabled by default via system property %s")
    void slashEncodingDisabled(String property);
}
