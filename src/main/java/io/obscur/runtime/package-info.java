/**
 * Runtime wiring package.
 *
 * <p>{@link io.obscur.runtime.ObscurRuntime} builds one identity's store,
 * crypto backend and retry machinery from its directory and settings file.
 */
package io.obscur.runtime;
