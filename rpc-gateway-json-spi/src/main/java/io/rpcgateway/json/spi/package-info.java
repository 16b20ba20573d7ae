/**
 * JSON codec SPI. The gateway parses requests and builds replies through these interfaces only;
 * a library binding (for example {@code rpc-gateway-json-jackson}) supplies the implementation.
 */
package io.rpcgateway.json.spi;
