/**
 * Framework-neutral server core for the item API.
 *
 * <p>Contains:
 * <ul>
 *   <li>{@link io.itemapi.server.core.ItemsHandler} (routing and error boundary)</li>
 *   <li>the five resource handlers in {@code io.itemapi.server.core.handlers}</li>
 *   <li>the SQLite storage handle, schema initializer and JDBC store in {@code io.itemapi.server.core.storage}</li>
 *   <li>{@link io.itemapi.server.core.InMemoryItemStore} (reference store)</li>
 * </ul>
 *
 * <p>HTTP bindings adapt {@link io.itemapi.server.core.ServerRequest} and
 * {@link io.itemapi.server.core.ServerResponse} to their runtimes.
 */
package io.itemapi.server.core;
