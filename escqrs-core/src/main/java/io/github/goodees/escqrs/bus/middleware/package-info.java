/**
 * Reusable middlewares for {@link io.github.goodees.escqrs.bus.CommandBus} and
 * {@link io.github.goodees.escqrs.bus.QueryBus}.
 */
package io.github.goodees.escqrs.bus.middleware;
