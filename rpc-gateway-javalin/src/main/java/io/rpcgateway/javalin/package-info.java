/**
 * Javalin transport, YAML configuration loading and the standalone
 * {@link io.rpcgateway.javalin.GatewayServer}.
 */
package io.rpcgateway.javalin;
