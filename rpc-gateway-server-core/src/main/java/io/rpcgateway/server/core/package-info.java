/**
 * Framework-neutral JSON-RPC gateway.
 *
 * <p>Contains:
 * <ul>
 *   <li>{@link io.rpcgateway.server.core.JsonRpcDispatcher} (auth, parse, single/batch execution, reply)</li>
 *   <li>{@link io.rpcgateway.server.core.RequestFacade} (single-use view of one exchange)</li>
 *   <li>{@link io.rpcgateway.server.core.EventBridge} and {@link io.rpcgateway.server.core.TimerRegistry}
 *       (callbacks marshalled onto the event-loop thread)</li>
 *   <li>{@link io.rpcgateway.server.core.SingleThreadEventLoop} (reference event loop)</li>
 * </ul>
 *
 * <p>Transports adapt their native exchange to {@link io.rpcgateway.server.spi.HttpExchange} and route
 * requests through {@link io.rpcgateway.server.core.HttpHandlerRegistry}.
 */
package io.rpcgateway.server.core;
