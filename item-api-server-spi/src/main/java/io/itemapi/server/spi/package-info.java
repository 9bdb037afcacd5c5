/**
 * Server-side SPI for the item API.
 *
 * <p>The SPI is blocking and minimal, intended to be adapted by HTTP bindings using their preferred
 * execution model.
 */
package io.itemapi.server.spi;
