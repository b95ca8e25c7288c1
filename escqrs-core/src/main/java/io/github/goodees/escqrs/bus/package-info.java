/**
 * Command and query buses.
 *
 * <p>Every message type has exactly one handler. Messages pass an envelope validation, then the registered
 * {@link io.github.goodees.escqrs.bus.Middleware}s in order, then the handler. Query results may be cached per
 * {@link io.github.goodees.escqrs.bus.CachePolicy}.</p>
 */
package io.github.goodees.escqrs.bus;
