package org.lexicon.indexing.hazelcast;

import java.net.InetAddress;
import java.net.NetworkInterface;
import java.net.SocketException;
import java.net.UnknownHostException;
import java.util.Collections;
import java.util.Enumeration;
import java.util.LinkedHashSet;
import java.util.Set;

import org.lexicon.indexing.config.IndexingConfig;
import org.lexicon.indexing.document.StoredObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hazelcast.config.Config;
import com.hazelcast.config.InMemoryFormat;
import com.hazelcast.config.JavaSerializationFilterConfig;
import com.hazelcast.config.MapConfig;
import com.hazelcast.config.TcpIpConfig;

/**
 * Builds the Hazelcast {@link Config} of the document store.
 *
 * <p>Members join over TCP-IP with a fixed member list; multicast and auto-detection are off.
 * Every bucket map ({@code <prefix>*}) shares one map configuration.</p>
 */
public final class HazelcastConfigFactory {
    private static final Logger logger = LoggerFactory.getLogger(HazelcastConfigFactory.class);

    private HazelcastConfigFactory() {}

    public static Config build(IndexingConfig.Hazelcast settings) {
        Config config = new Config();
        config.setClusterName(settings.clusterName());
        config.setProperty("hazelcast.phone.home.enabled", "false");
        configureNetwork(config, settings);
        configureDocumentMaps(config, settings);
        configureSerialization(config);
        return config;
    }

    private static void configureNetwork(Config config, IndexingConfig.Hazelcast s) {
        config.getNetworkConfig().setPort(s.port()).setPortAutoIncrement(false);

        // Inside a container the advertised IP is usually not a local interface; binding to it would fail.
        if (isLocalInterfaceAddress(s.currentNodeIp())) {
            config.getNetworkConfig().getInterfaces().setEnabled(true).addInterface(s.currentNodeIp());
        } else {
            logger.info("{} is not a local interface, binding to all interfaces", s.currentNodeIp());
            config.getNetworkConfig().getInterfaces().setEnabled(false);
        }
        config.getNetworkConfig().setPublicAddress(s.currentNodeIp() + ":" + s.port());

        var join = config.getNetworkConfig().getJoin();
        join.getMulticastConfig().setEnabled(false);
        join.getAutoDetectionConfig().setEnabled(false);

        TcpIpConfig tcpIp = join.getTcpIpConfig().setEnabled(true);
        tcpIp.getMembers().clear();
        memberAddresses(s).forEach(tcpIp::addMember);
    }

    static Set<String> memberAddresses(IndexingConfig.Hazelcast s) {
        Set<String> addresses = new LinkedHashSet<>();
        for (String member : s.members()) {
            String trimmed = member.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            if (trimmed.contains(":")) {
                addresses.add(trimmed);
            } else if (!s.memberPorts().isEmpty()) {
                s.memberPorts().forEach(port -> addresses.add(trimmed + ":" + port));
            } else {
                addresses.add(trimmed + ":" + s.port());
            }
        }
        return addresses;
    }

    private static boolean isLocalInterfaceAddress(String ip) {
        if (ip == null || ip.isBlank()) {
            return false;
        }
        String trimmed = ip.trim();
        if ("localhost".equalsIgnoreCase(trimmed) || "127.0.0.1".equals(trimmed)) {
            return true;
        }

        try {
            InetAddress target = InetAddress.getByName(trimmed);
            Enumeration<NetworkInterface> interfaces = NetworkInterface.getNetworkInterfaces();
            if (interfaces == null) {
                return false;
            }
            for (NetworkInterface nif : Collections.list(interfaces)) {
                if (Collections.list(nif.getInetAddresses()).contains(target)) {
                    return true;
                }
            }
        } catch (UnknownHostException | SocketException | SecurityException e) {
            logger.warn("Could not resolve local interfaces for {}: {}", trimmed, e.getMessage());
        }
        return false;
    }

    private static void configureDocumentMaps(Config config, IndexingConfig.Hazelcast s) {
        config.addMapConfig(new MapConfig(s.documentMapPrefix() + "*")
            .setBackupCount(s.backupCount())
            .setAsyncBackupCount(s.asyncBackupCount())
            .setInMemoryFormat(InMemoryFormat.BINARY));
    }

    private static void configureSerialization(Config config) {
        JavaSerializationFilterConfig filter = new JavaSerializationFilterConfig();
        filter.getWhitelist().addClasses(StoredObject.class.getName());
        config.getSerializationConfig().setJavaSerializationFilterConfig(filter);
    }
}
