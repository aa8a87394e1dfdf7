/**
 * Runtime orchestration package.
 *
 * <p>{@link io.tagkeeper.runtime.TagKeeperRuntime} builds the ledger, tag
 * service, engines and scheduler from the data root and settings, and exposes
 * the operations used by the CLI.
 */
package io.tagkeeper.runtime;
