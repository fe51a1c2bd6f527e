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

import org.jboss.logging.Messages;
import org.jboss.logging.annotations.Message;
import org.jboss.logging.annotations.MessageBundle;

/**
 * Messages and exceptions raised while building and combining route patterns.
 *
 * @author RouteForge contributors
 */
@MessageBundle(projectCode = "RF")
public interface RouteForgeMessages {

    RouteForgeMessages MESSAGES = Messages.getBundle(RouteForgeMessages.class);

    @Message(id = 1, value = "Argument %s cannot be null")
    IllegalArgumentException argumentCannotBeNull(final String argument);

    @Message(id = 2, value = "Argument %s cannot be null or empty")
    IllegalArgumentException argumentNullOrEmpty(final String argument);

    @Message(id = 3, value = "The literal section '%s' is invalid. Literal sections cannot contain the '?' character.")
    IllegalArgumentException invalidLiteral(final String content);

    @Message(id = 4, value = "The route parameter name '%s' is invalid. Route parameter names must be non-empty and cannot contain these characters: '{', '}', '/', '?', '*'.")
    IllegalArgumentException invalidParameterName(final String parameterName);

    @Message(id = 5, value = "An optional parameter cannot have a default value: %s")
    IllegalArgumentException optionalParameterWithDefault(final String parameterName);

    @Message(id = 6, value = "The %s contain the key '%s' more than once when compared case-insensitively")
    IllegalArgumentException duplicateKey(final String dictionaryName, final String key);

    @Message(id = 7, value = "Route pattern '%s': the default value for parameter '%s' is specified both inline ('%s') and out-of-line ('%s'). Specify the default value in only one place.")
    IllegalStateException defaultSpecifiedInlineAndExplicitly(final String pattern, final String parameterName, final Object inlineValue, final Object outOfLineValue);

    @Message(id = 8, value = "Route pattern '%s': an optional parameter cannot have a default value, but a default was supplied for '%s'")
    IllegalStateException optionalCannotHaveDefaultValue(final String pattern, final String parameterName);

    @Message(id = 9, value = "Invalid constraint '%s'. A constraint must be of type 'String' or '%s'.")
    IllegalStateException invalidConstraintReference(final Object constraint, final String expectedType);

    @Message(id = 10, value = "Route pattern '%s': no corresponding parameter or default value could be found for the required value '%s=%s'. A non-null required value must correspond to a route parameter or the route pattern must have a matching default value.")
    IllegalStateException unsatisfiedRequiredValue(final String pattern, final String key, final Object value);

    @Message(id = 11, value = "Route pattern '%s': the %s of the combined patterns both define the key '%s' with different values ('%s' and '%s')")
    IllegalStateException repeatedDictionaryEntry(final String pattern, final String dictionaryName, final String key, final Object leftValue, final Object rightValue);

    @Message(id = 12, value = "Route pattern '%s': the route parameter name '%s' appears more than one time in the route pattern.")
    String repeatedParameter(final String pattern, final String parameterName);
}
