package io.estatekeeper.backend.activity;

/**
 * Published through Spring's {@code ApplicationEventPublisher} by domain services that want an
 * activity entry for an operation they are about to commit. Carries only plain values so it stays
 * valid after the publishing transaction closes.
 */
public record ActivityRequestedEvent(ActivityEventRecord record) {}
