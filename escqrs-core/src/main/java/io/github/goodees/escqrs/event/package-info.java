/**
 * The event log model: domain events, their metadata and selection criteria.
 */
package io.github.goodees.escqrs.event;
