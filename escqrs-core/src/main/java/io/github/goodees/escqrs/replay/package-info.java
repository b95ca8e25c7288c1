/**
 * Replay of the event log into handlers: new read models, repaired projections and audits of stream order.
 */
package io.github.goodees.escqrs.replay;
