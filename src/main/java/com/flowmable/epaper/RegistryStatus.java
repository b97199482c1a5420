package com.flowmable.epaper;

/**
 * Point-in-time view of a {@link DeliveryRegistry}.
 *
 * @param total     Frames currently stored
 * @param delivered Distinct stored frames that have been served at least once
 * @param cursor    Index of the frame the next poll will receive (0 when empty)
 */
public record RegistryStatus(int total, int delivered, int cursor) {}
