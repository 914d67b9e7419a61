package io.fuzzdeck.api.reverse;

/**
 * Parameters for starting the reverse/facade server.
 */
public record FacadeServerParams(
        String bridgeAddr,
        String bridgeSecret,
        String localFacadeHost,
        int localFacadePort,
        int facadeRemotePort,
        boolean enableDnsLogServer,
        int dnsLogLocalPort,
        int dnsLogRemotePort,
        String externalDomain,
        boolean verify
) {

    public FacadeServerParams {
        checkPort(localFacadePort, "Local facade port");
        checkPort(facadeRemotePort, "Facade remote port");
        checkPort(dnsLogLocalPort, "DNS log local port");
        checkPort(dnsLogRemotePort, "DNS log remote port");
        bridgeAddr = bridgeAddr == null ? "" : bridgeAddr;
        bridgeSecret = bridgeSecret == null ? "" : bridgeSecret;
        externalDomain = externalDomain == null ? "" : externalDomain;
    }

    public static FacadeServerParams defaults() {
        return new FacadeServerParams("", "", "0.0.0.0", 4434, 0, false, 53, 0, "", false);
    }

    /**
     * Route the facade through a public bridge.
     */
    public FacadeServerParams withBridge(String addr, String secret) {
        return new FacadeServerParams(addr, secret, localFacadeHost, localFacadePort, facadeRemotePort,
                enableDnsLogServer, dnsLogLocalPort, dnsLogRemotePort, externalDomain, verify);
    }

    public boolean usesBridge() {
        return !bridgeAddr.isBlank();
    }

    private static void checkPort(int port, String name) {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException(name + " out of range: " + port);
        }
    }
}
