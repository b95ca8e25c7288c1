package io.github.goodees.escqrs.bus.middleware;

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

import io.github.goodees.escqrs.bus.Middleware;
import io.github.goodees.escqrs.bus.Query;
import io.github.goodees.escqrs.bus.UnauthorizedQueryException;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Predicate;

/**
 * Lets a query through only when the authorizer approves it.
 */
public class AuthorizationMiddleware implements Middleware<Query> {
    private final Authorizer authorizer;

    public AuthorizationMiddleware(Authorizer authorizer) {
        this.authorizer = authorizer;
    }

    public static AuthorizationMiddleware allowing(Predicate<Query> predicate) {
        return new AuthorizationMiddleware(q -> CompletableFuture.completedFuture(predicate.test(q)));
    }

    @Override
    public CompletionStage<Object> execute(Query query, Next<Query> next) throws Exception {
        return authorizer.authorize(query).thenCompose(allowed -> {
            if (!Boolean.TRUE.equals(allowed)) {
                throw new UnauthorizedQueryException(query);
            }
            return next.proceed(query);
        });
    }

    @FunctionalInterface
    public interface Authorizer {
        CompletionStage<Boolean> authorize(Query query) throws Exception;
    }
}
