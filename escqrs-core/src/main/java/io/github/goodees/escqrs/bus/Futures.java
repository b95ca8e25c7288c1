package io.github.goodees.escqrs.bus;

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

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;

/**
 * Helpers for composing completion stages.
 */
public final class Futures {
    private Futures() {
    }

    public static Throwable unwrap(Throwable ex) {
        while (ex != null && ex.getCause() != null
                && (ex instanceof CompletionException || ex instanceof ExecutionException)) {
            ex = ex.getCause();
        }
        return ex;
    }

    public static <T> CompletableFuture<T> failed(Throwable t) {
        CompletableFuture<T> result = new CompletableFuture<>();
        result.completeExceptionally(unwrap(t));
        return result;
    }

    /**
     * Run a stage-returning call, turning a synchronous throw or null result into a completed stage.
     */
    public static <T> CompletableFuture<T> invoke(StageSupplier<T> call) {
        try {
            CompletionStage<T> stage = call.get();
            return stage == null ? CompletableFuture.completedFuture(null) : stage.toCompletableFuture();
        } catch (Exception e) {
            return failed(e);
        }
    }

    @FunctionalInterface
    public interface StageSupplier<T> {
        CompletionStage<T> get() throws Exception;
    }
}
