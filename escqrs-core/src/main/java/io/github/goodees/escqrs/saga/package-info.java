/**
 * Saga orchestration.
 *
 * <p>A {@link io.github.goodees.escqrs.saga.SagaDefinition} describes ordered steps, each sending a command and
 * optionally declaring how to compensate it. {@link io.github.goodees.escqrs.saga.SagaManager} runs instances of
 * the definitions: it learns about step outcomes from correlated events classified by an
 * {@link io.github.goodees.escqrs.saga.EventOutcomeClassifier}, or from command results, retries failed steps per
 * {@link io.github.goodees.escqrs.bus.RetryPolicy} and compensates completed steps in reverse order of completion or
 * all at once.</p>
 */
package io.github.goodees.escqrs.saga;
