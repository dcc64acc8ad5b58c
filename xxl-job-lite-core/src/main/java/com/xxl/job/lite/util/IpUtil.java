package com.xxl.job.lite.util;

import lombok.extern.slf4j.Slf4j;

import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.NetworkInterface;
import java.net.SocketException;
import java.util.Enumeration;

/**
 * 获取本机IP的工具类，执行器没有配置ip的时候，用它拼出注册到调度中心的地址
 */
@Slf4j
public class IpUtil {

    private static final String ANYHOST_VALUE = "0.0.0.0";
    private static final String LOCALHOST_VALUE = "127.0.0.1";

    private static volatile String LOCAL_IP;

    /**
     * 获取第一个非回环的IPv4地址，获取不到就退回到127.0.0.1
     */
    public static String getIp() {
        if (LOCAL_IP != null) {
            return LOCAL_IP;
        }
        String ip = findFirstNonLoopbackIpv4();
        LOCAL_IP = ip != null ? ip : LOCALHOST_VALUE;
        return LOCAL_IP;
    }

    public static String getIpPort(String ip, int port) {
        if (ip == null) {
            return null;
        }
        return ip.concat(":").concat(String.valueOf(port));
    }

    private static String findFirstNonLoopbackIpv4() {
        try {
            Enumeration<NetworkInterface> interfaces = NetworkInterface.getNetworkInterfaces();
            if (interfaces == null) {
                return null;
            }
            while (interfaces.hasMoreElements()) {
                NetworkInterface network = interfaces.nextElement();
                try {
                    if (network.isLoopback() || network.isVirtual() || !network.isUp()) {
                        continue;
                    }
                } catch (SocketException e) {
                    log.warn(">>>>>>>>>>> xxl-job, skip network interface {}: {}", network.getName(), e.getMessage());
                    continue;
                }
                Enumeration<InetAddress> addresses = network.getInetAddresses();
                while (addresses.hasMoreElements()) {
                    InetAddress address = addresses.nextElement();
                    if (address instanceof Inet4Address
                            && !address.isLoopbackAddress()
                            && !ANYHOST_VALUE.equals(address.getHostAddress())) {
                        return address.getHostAddress();
                    }
                }
            }
        } catch (SocketException e) {
            log.error(e.getMessage(), e);
        }
        return null;
    }

}
