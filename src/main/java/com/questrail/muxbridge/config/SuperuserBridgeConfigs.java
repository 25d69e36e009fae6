package com.questrail.muxbridge.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.muxbridge.util.Jsons;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Loads superuser bridge configurations from JSON.
 *
 * <p>Accepts either a bare array of entries or an object with a
 * {@code bridges} array.</p>
 */
public final class SuperuserBridgeConfigs
{
    public static final String DEFAULT_RESOURCE = "superuser-bridges.json";

    private SuperuserBridgeConfigs() {}

    public static List<SuperuserBridgeConfig> load(Path file) throws IOException
    {
        try (InputStream in = Files.newInputStream(file)) {
            return parse(in);
        }
    }

    /**
     * The configurations bundled on the classpath; empty when the resource is missing.
     */
    public static List<SuperuserBridgeConfig> loadDefaults() throws IOException
    {
        try (InputStream in = SuperuserBridgeConfigs.class.getClassLoader()
                .getResourceAsStream(DEFAULT_RESOURCE)) {
            return in == null ? List.of() : parse(in);
        }
    }

    public static List<SuperuserBridgeConfig> parse(InputStream in) throws IOException
    {
        JsonNode root = Jsons.mapper().readTree(in);
        if (root != null && root.isObject()) {
            root = root.get("bridges");
        }
        if (root == null || !root.isArray()) {
            throw new IOException("expected an array of superuser bridges");
        }

        List<SuperuserBridgeConfig> configs;
        try {
            configs = Jsons.mapper().convertValue(root, new TypeReference<List<SuperuserBridgeConfig>>() {});
        } catch (IllegalArgumentException e) {
            throw new IOException("invalid superuser bridge: " + e.getMessage(), e);
        }

        Set<String> labels = new HashSet<>();
        for (SuperuserBridgeConfig config : configs) {
            if (!labels.add(config.label())) {
                throw new IOException("duplicate superuser bridge label: " + config.label());
            }
        }
        return List.copyOf(configs);
    }
}
