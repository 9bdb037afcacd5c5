/**
 * Framework-neutral core of the item API.
 *
 * <p>Contains only the {@link io.itemapi.core.Item} model, wire constants and the
 * client-facing error hierarchy. Storage and HTTP bindings live in other modules.
 */
package io.itemapi.core;
