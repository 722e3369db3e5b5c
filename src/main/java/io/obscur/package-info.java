/**
 * Obscur messaging core source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.obscur.runtime.ObscurRuntime} wires one identity's components together.</li>
 *   <li>{@code io.obscur.crypto.CryptoService} is the single contract for keys, DMs, gift wraps and invites.</li>
 *   <li>{@code io.obscur.storage.MessageStore} is the authoritative message log and retry queue.</li>
 *   <li>{@code io.obscur.retry.RetryCoordinator} owns backoff timers and relay circuit breakers.</li>
 * </ul>
 */
package io.obscur;
