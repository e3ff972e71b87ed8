/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tsbench.query.cassandra.internal;

import java.net.InetSocketAddress;
import zipkin2.Endpoint;

/** One entry of a contact point list, such as "cassandra1:9042" or "[::1]". */
public final class HostAndPort {
  /**
   * Parses "host", "host:port", "[ipv6]" or "[ipv6]:port", defaulting the port when absent or
   * empty.
   */
  public static HostAndPort fromString(String hostPort, int defaultPort) {
    if (hostPort == null) throw new NullPointerException("hostPort == null");

    String host, port = null;
    if (hostPort.startsWith("[")) {
      int close = hostPort.indexOf(']');
      if (close == -1) throw new IllegalArgumentException(hostPort + " is missing ']'");
      host = hostPort.substring(1, close);
      if (!isIp(host)) {
        throw new IllegalArgumentException(hostPort + " contains an invalid IPv6 literal");
      }
      String rest = hostPort.substring(close + 1);
      if (!rest.isEmpty()) {
        if (rest.charAt(0) != ':') {
          throw new IllegalArgumentException(hostPort + " has junk after the address");
        }
        port = rest.substring(1);
      }
    } else {
      int colon = hostPort.indexOf(':');
      if (colon == -1) {
        host = hostPort;
      } else if (colon == hostPort.lastIndexOf(':')) {
        host = hostPort.substring(0, colon);
        port = hostPort.substring(colon + 1);
      } else if (isIp(hostPort)) { // unbracketed IPv6 can't have a port
        host = hostPort;
      } else {
        throw new IllegalArgumentException(hostPort + " is an invalid IPv6 literal");
      }
    }

    if (host.isEmpty()) throw new IllegalArgumentException(hostPort + " has an empty host");
    if (port == null || port.isEmpty()) return new HostAndPort(host, defaultPort);
    return new HostAndPort(host, parsePort(port, hostPort));
  }

  final String host;
  final int port;

  HostAndPort(String host, int port) {
    this.host = host;
    this.port = port;
  }

  /** Returns the unvalidated hostname or IP literal */
  public String getHost() {
    return host;
  }

  public int getPort() {
    return port;
  }

  /** Returns an unresolved address so that the driver resolves it on connect. */
  public InetSocketAddress toSocketAddress() {
    return InetSocketAddress.createUnresolved(host, port);
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof HostAndPort)) return false;
    HostAndPort that = (HostAndPort) o;
    return host.equals(that.host) && port == that.port;
  }

  @Override public int hashCode() {
    return 31 * host.hashCode() + port;
  }

  @Override public String toString() {
    return "HostAndPort{host=" + host + ", port=" + port + "}";
  }

  static boolean isIp(String host) {
    return Endpoint.newBuilder().parseIp(host); // zipkin's validator handles IPv6 forms
  }

  static int parsePort(String port, String hostPort) {
    for (int i = 0, length = port.length(); i < length; i++) {
      char c = port.charAt(i);
      if (c < '0' || c > '9') throw new IllegalArgumentException(hostPort + " has an invalid port");
    }
    if (port.length() > 5) throw new IllegalArgumentException(hostPort + " has an invalid port");
    int result = Integer.parseInt(port);
    if (result == 0 || result > 0xffff) {
      throw new IllegalArgumentException(hostPort + " has an invalid port");
    }
    return result;
  }
}
