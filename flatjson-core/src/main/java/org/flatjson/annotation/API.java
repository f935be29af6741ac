/*
 * API.java
 *
 * This source file is part of the FoundationDB open source project
 *
 * Copyright 2015-2026 Apple Inc. and the FoundationDB project authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.flatjson.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks the stability level of a public type, field, constructor or method for consumers of the layer.
 *
 * <p>
 * An annotated type passes its status on to its members unless a member is annotated explicitly. A status may
 * become more stable at any time but must not become less stable before the next minor release.
 * </p>
 */
@Target({ElementType.TYPE, ElementType.METHOD, ElementType.CONSTRUCTOR, ElementType.FIELD})
@Retention(RetentionPolicy.CLASS)
@Documented
public @interface API {
    /**
     * Return the {@link Status} of the API element.
     * @return the current stability status of the annotated element
     */
    Status value();

    /**
     * Possible stability statuses, in increasing order of stability.
     */
    enum Status {
        /**
         * Public only so that another package of this project can reach it. May change at any time.
         */
        INTERNAL,

        /**
         * Should not be used in new code. May be removed in the next minor release.
         */
        DEPRECATED,

        /**
         * New features whose shape has not settled. May change or be removed without a change in version.
         */
        EXPERIMENTAL,

        /**
         * May change in the next minor release, but not before it.
         */
        UNSTABLE,

        /**
         * Shall not be changed in a backwards-incompatible way until the next major release.
         */
        STABLE
    }
}
