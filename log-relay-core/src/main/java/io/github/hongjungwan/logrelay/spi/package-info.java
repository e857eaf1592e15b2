/**
 * Service Provider Interfaces (SPI) for log-relay.
 *
 * <p>Implement these interfaces to plug in:</p>
 *
 * <ul>
 *   <li>{@link io.github.hongjungwan.logrelay.spi.LogSink} - Log destination</li>
 *   <li>{@link io.github.hongjungwan.logrelay.spi.StorageBackend} - Rate limit state storage</li>
 *   <li>{@link io.github.hongjungwan.logrelay.spi.KeyValueStore} - TTL aware storage contract</li>
 *   <li>{@link io.github.hongjungwan.logrelay.spi.DeliveryFailureListener} - Dropped batch reporting</li>
 * </ul>
 */
package io.github.hongjungwan.logrelay.spi;
