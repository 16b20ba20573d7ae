/**
 * Protocol-level building blocks of the RPC gateway: header and envelope constants,
 * error codes, the {@link io.rpcgateway.core.RpcException} hierarchy, and the
 * {@link io.rpcgateway.core.Credential} the gateway authorizes against.
 */
package io.rpcgateway.core;
