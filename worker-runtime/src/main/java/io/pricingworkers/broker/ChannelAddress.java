package io.pricingworkers.broker;

import io.pricingworkers.error.ConfigurationException;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code scheme://host:port/namespace}, e.g. {@code memory://localhost:6379/13} or {@code h2://mem:0/13}.
 */
public record ChannelAddress(String scheme, String host, int port, int namespace) {
    public static final String MEMORY = "memory";
    public static final String H2 = "h2";

    private static final Pattern FORMAT = Pattern.compile("^([a-zA-Z][a-zA-Z0-9+.-]*)://([^:/\\s]+):(\\d{1,5})/(\\d+)$");

    public ChannelAddress {
        if (port < 0 || port > 65535) throw new ConfigurationException("port out of range: " + port);
        if (namespace < 0) throw new ConfigurationException("namespace must be >= 0: " + namespace);
    }

    public static ChannelAddress parse(String address) {
        if (address == null) throw new ConfigurationException("channel address is missing");
        Matcher m = FORMAT.matcher(address.trim());
        if (!m.matches()) {
            throw new ConfigurationException("invalid channel address '" + address + "', expected scheme://host:port/namespace");
        }
        String scheme = m.group(1).toLowerCase(Locale.ROOT);
        if (!scheme.equals(MEMORY) && !scheme.equals(H2)) {
            throw new ConfigurationException("unsupported channel scheme '" + scheme + "' in " + address);
        }
        int port = Integer.parseInt(m.group(3));
        int ns;
        try {
            ns = Integer.parseInt(m.group(4));
        } catch (NumberFormatException e) {
            throw new ConfigurationException("namespace out of range in " + address, e);
        }
        return new ChannelAddress(scheme, m.group(2).toLowerCase(Locale.ROOT), port, ns);
    }

    public boolean sameServer(ChannelAddress other) {
        return scheme.equals(other.scheme) && host.equals(other.host) && port == other.port;
    }

    public String server() { return scheme + "://" + host + ":" + port; }

    /** JDBC url of the H2 database behind an {@code h2} address. */
    public String jdbcUrl() {
        if (!H2.equals(scheme)) throw new ConfigurationException("not an h2 address: " + this);
        if ("mem".equals(host)) return "jdbc:h2:mem:pricing_workers_" + port + ";DB_CLOSE_DELAY=-1";
        return "jdbc:h2:tcp://" + host + ":" + port + "/pricing_workers";
    }

    /** Broker and backend on the same server must not share a namespace. */
    public static void requireDistinct(ChannelAddress broker, ChannelAddress backend) {
        if (broker.sameServer(backend) && broker.namespace == backend.namespace) {
            throw new ConfigurationException("broker and backend share namespace " + broker.namespace + " on " + broker.server());
        }
    }

    @Override
    public String toString() { return server() + "/" + namespace; }
}
