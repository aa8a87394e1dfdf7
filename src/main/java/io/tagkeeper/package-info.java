/**
 * TagKeeper source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.tagkeeper.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.tagkeeper.cli.TagKeeperCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.tagkeeper.engine.AggregateReporter} verifies and repairs a batch and scores it.</li>
 *   <li>{@code io.tagkeeper.scheduler.IntegrityScheduler} runs checks periodically and raises alerts.</li>
 *   <li>{@code io.tagkeeper.storage.SqliteLedger} is the authoritative record store.</li>
 * </ul>
 */
package io.tagkeeper;
