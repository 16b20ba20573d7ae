/**
 * SPI for the collaborators the gateway depends on but does not own: the event loop and
 * transport ({@link io.rpcgateway.server.spi.EventLoop}, {@link io.rpcgateway.server.spi.HttpExchange}),
 * the command table, the readiness provider, and the operator notification channel.
 */
package io.rpcgateway.server.spi;
