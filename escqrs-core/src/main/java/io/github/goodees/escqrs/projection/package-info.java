/**
 * Read side: projections folding the event log into read models, tracked by checkpoints.
 */
package io.github.goodees.escqrs.projection;
