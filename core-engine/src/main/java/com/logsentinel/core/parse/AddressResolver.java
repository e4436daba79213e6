package com.logsentinel.core.parse;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts or deterministically synthesizes the origin address of a log line.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>The first IPv4 literal in the message body (octets {@code 0..255}),
 * returned verbatim.</li>
 * <li>When the line carried a hostname, a {@code 192.168.x.y} address derived
 * from the MD5 digest of the hostname. Derived addresses are cached for the
 * lifetime of the resolver, so a hostname always maps to the same
 * address.</li>
 * <li>Keyword heuristics over the body: security and authentication terms map
 * into {@code 10.0.100.0/24}, network and connection terms into
 * {@code 172.16.0.0/24}, anything else to {@value #DEFAULT_ADDRESS}.</li>
 * </ol>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Safe for concurrent use; the hostname cache is a {@link ConcurrentHashMap}.
 * </p>
 *
 * @since 1.0.0
 */
public class AddressResolver {

    /** Returned when nothing better can be derived. */
    public static final String DEFAULT_ADDRESS = "192.168.1.1";

    private static final String OCTET = "(?:25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)";
    private static final Pattern IPV4 = Pattern.compile("\\b(?:" + OCTET + "\\.){3}" + OCTET + "\\b");

    private static final String[] SECURITY_WORDS = { "security", "auth", "login", "password", "ssh", "sudo",
            "denied", "unauthorized" };
    private static final String[] NETWORK_WORDS = { "network", "connection", "socket", "timeout", "dns",
            "interface" };

    private final Map<String, String> hostnameCache = new ConcurrentHashMap<>();

    /**
     * Resolve the origin address of a line.
     *
     * @param body     message body to scan; may be {@code null}
     * @param hostname hostname token of the line, or {@code null} when the
     *                 format carries none
     * @return a non-empty address
     */
    public String resolve(String body, String hostname) {
        String text = body != null ? body : "";
        Matcher m = IPV4.matcher(text);
        if (m.find()) {
            return m.group();
        }
        if (hostname != null && !hostname.isBlank()) {
            return fromHostname(hostname.trim());
        }
        return fromKeywords(text);
    }

    /**
     * Derive (or return the cached) address for a hostname.
     *
     * @param hostname non-blank hostname
     * @return {@code 192.168.x.y} where {@code x} and {@code y} are the first
     *         two bytes of the hostname's MD5 digest
     */
    public String fromHostname(String hostname) {
        return hostnameCache.computeIfAbsent(hostname, AddressResolver::deriveAddress);
    }

    /**
     * @return number of distinct hostnames seen so far
     */
    public int cachedHostnames() {
        return hostnameCache.size();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String deriveAddress(String hostname) {
        byte[] digest = md5(hostname.getBytes(StandardCharsets.UTF_8));
        return "192.168." + (digest[0] & 0xFF) + "." + (digest[1] & 0xFF);
    }

    private static String fromKeywords(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        int suffix = Math.floorMod(lower.hashCode(), 254) + 1;
        if (containsAny(lower, SECURITY_WORDS)) {
            return "10.0.100." + suffix;
        }
        if (containsAny(lower, NETWORK_WORDS)) {
            return "172.16.0." + suffix;
        }
        return DEFAULT_ADDRESS;
    }

    private static boolean containsAny(String text, String[] words) {
        for (String word : words) {
            if (text.contains(word)) {
                return true;
            }
        }
        return false;
    }

    private static byte[] md5(byte[] input) {
        try {
            return MessageDigest.getInstance("MD5").digest(input);
        } catch (NoSuchAlgorithmException e) {
            // every JRE is required to ship MD5
            throw new IllegalStateException("MD5 digest not available", e);
        }
    }
}
