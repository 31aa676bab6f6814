package com.microsim.core.random;

import com.microsim.core.ConfigurationException;
import org.agrona.collections.Object2ObjectHashMap;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * <h1>Stream Manager: One Generator per Subsystem</h1>
 *
 * <p>
 * Every consumer of randomness in a run ({@code "latent"}, {@code "mechanism"},
 * {@code "agents.<id>"}, ...) asks this manager for its own named stream.
 * No component is allowed to create a generator of its own.
 * </p>
 *
 * <h2>Isolation</h2>
 * <p>
 * A stream's seed is the first 8 bytes (big-endian) of
 * {@code SHA-256("<rootSeed>:<name>")}. It depends only on the root seed and
 * the name, never on creation order or on how many values other streams have
 * drawn. So the sequence observed on {@code "latent"} is the same whether an
 * agent drew zero or ten thousand values first.
 * </p>
 *
 * <h2>Lifecycle</h2>
 * <p>
 * {@link #initialize(long)} once per run; {@link #stream(String)} before that
 * is a {@link ConfigurationException}. One manager per Monte Carlo repetition,
 * seeded via {@link #deriveRepetitionSeed(long, int)}.
 * </p>
 */
public class StreamManager {

    private final Object2ObjectHashMap<String, RandomStream> streams = new Object2ObjectHashMap<>();

    private boolean initialized;
    private long rootSeed;

    /**
     * Convenience for {@code new StreamManager().initialize(rootSeed)}.
     */
    public static StreamManager withRootSeed(long rootSeed) {
        StreamManager manager = new StreamManager();
        manager.initialize(rootSeed);
        return manager;
    }

    public StreamManager initialize(long rootSeed) {
        if (initialized) {
            throw new ConfigurationException("Stream manager already initialized with root seed " + this.rootSeed);
        }
        this.rootSeed = rootSeed;
        this.initialized = true;
        return this;
    }

    public boolean isInitialized() {
        return initialized;
    }

    public long rootSeed() {
        requireInitialized();
        return rootSeed;
    }

    /**
     * Returns the stream bound to {@code name}, creating it on first request.
     * Repeated calls return the same instance.
     */
    public RandomStream stream(String name) {
        requireInitialized();
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Stream name must not be blank");
        }
        RandomStream stream = streams.get(name);
        if (stream == null) {
            stream = new RandomStream(name, deriveSeed(rootSeed + ":" + name));
            streams.put(name, stream);
        }
        return stream;
    }

    /**
     * Drops every cached stream; the next {@link #stream(String)} call for a
     * name starts that stream from its first value again.
     */
    public void reset() {
        requireInitialized();
        streams.clear();
    }

    public int streamCount() {
        return streams.size();
    }

    /**
     * Child seed for one repetition of a scenario. A pure function of its
     * inputs.
     *
     * @throws ConfigurationException if {@code repetitionIndex} is negative
     */
    public static long deriveRepetitionSeed(long scenarioSeed, int repetitionIndex) {
        if (repetitionIndex < 0) {
            throw new ConfigurationException("Repetition index must be non-negative: " + repetitionIndex);
        }
        return deriveSeed(scenarioSeed + ":repetition:" + repetitionIndex);
    }

    private void requireInitialized() {
        if (!initialized) {
            throw new ConfigurationException("Stream manager used before initialize(rootSeed)");
        }
    }

    private static long deriveSeed(String material) {
        byte[] digest = sha256().digest(material.getBytes(StandardCharsets.UTF_8));
        long seed = 0;
        for (int i = 0; i < 8; i++) {
            seed = (seed << 8) | (digest[i] & 0xFF);
        }
        return seed;
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            // Every JDK is required to ship SHA-256
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
