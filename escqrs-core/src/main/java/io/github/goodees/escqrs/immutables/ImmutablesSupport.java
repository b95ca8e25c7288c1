package io.github.goodees.escqrs.immutables;

/*-
 * #%L
 * escqrs
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Style for immutable value types of the runtime, such as statistics and checkpoints. Accessors follow bean naming
 * ({@code getName()}, {@code isHealthy()}), while builder methods use the bare attribute name. The types serialize to
 * JSON with the attribute names as properties.
 */
@Target({ ElementType.PACKAGE, ElementType.TYPE })
@Retention(RetentionPolicy.CLASS)
@Value.Style(optionalAcceptNullable = true,//
        jdkOnly = true, //
        get = { "get*", "is*" },
        visibility = Value.Style.ImplementationVisibility.PUBLIC)
@JsonSerialize
public @interface ImmutablesSupport {

}
