/*
 * API.java
 *
 * This source file is part of the Sample Space open source project
 *
 * Copyright 2020-2026 Sample Space project authors
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

package org.samplespace.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks how stable a public type, constructor, field or method is for code that builds and samples spaces.
 *
 * <p>
 * A member inherits the status of its enclosing type unless it is annotated itself. Statuses may only move
 * towards {@link Status#STABLE} between minor releases; moving away from it requires a release of the kind
 * described by the status being left.
 * </p>
 */
@Target({ElementType.TYPE, ElementType.METHOD, ElementType.CONSTRUCTOR, ElementType.FIELD})
@Retention(RetentionPolicy.CLASS)
@Documented
public @interface API {
    /**
     * The stability of the annotated element.
     * @return the current stability status of the annotated element
     */
    Status value();

    /**
     * Stability levels, from least to most stable.
     */
    enum Status {
        /**
         * Public only so that another package of the project can reach it. Sampling engines and callers
         * outside the project should not depend on it.
         */
        INTERNAL,

        /**
         * Kept for existing callers only and removed in the next minor release.
         */
        DEPRECATED,

        /**
         * New surface whose shape is still being worked out, for example additional compact notation forms.
         */
        EXPERIMENTAL,

        /**
         * May change in the next minor release, but not before it.
         */
        UNSTABLE,

        /**
         * Only changed incompatibly in a major release, such as the space building methods and the
         * canonical serialized form.
         */
        STABLE
    }
}
