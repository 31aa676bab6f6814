package com.microsim.infra;

import com.microsim.core.ConfigurationException;
import com.microsim.core.MatchingEngine;
import com.microsim.core.ledger.PnlConvention;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Map;
import java.util.Properties;
import java.util.TreeMap;

/**
 * Immutable settings of one simulation run.
 * <p>
 * Read from Java properties. The classpath resource {@value #DEFAULTS_RESOURCE}
 * supplies the defaults; a scenario file overrides any key it names.
 * </p>
 *
 * <pre>
 * microsim.seed=42
 * microsim.pnl.convention=AVERAGE_COST
 * microsim.latency.submission=0
 * microsim.latency.fill=0
 * microsim.account.1.cash=100000
 * microsim.account.1.inventory=10
 * microsim.account.1.openingPrice=50
 * </pre>
 */
public final class SimulationConfig {

    public static final String DEFAULTS_RESOURCE = "microsim.properties";

    public static final String SEED = "microsim.seed";
    public static final String PNL_CONVENTION = "microsim.pnl.convention";
    public static final String SUBMISSION_LATENCY = "microsim.latency.submission";
    public static final String FILL_LATENCY = "microsim.latency.fill";
    public static final String ORDER_POOL = "microsim.pool.orders";
    public static final String LEVEL_POOL = "microsim.pool.levels";
    public static final String TAP_BUFFER_SIZE = "microsim.tap.bufferSize";
    public static final String JOURNAL_PATH = "microsim.journal.path";
    public static final String ACCOUNT_PREFIX = "microsim.account.";

    private final long seed;
    private final PnlConvention pnlConvention;
    private final long submissionLatency;
    private final long fillLatency;
    private final int orderPoolCapacity;
    private final int levelPoolCapacity;
    private final int tapBufferSize;
    private final String journalPath;
    private final Map<Long, AccountConfig> accounts;

    private SimulationConfig(Builder builder) {
        this.seed = builder.seed;
        this.pnlConvention = builder.pnlConvention;
        this.submissionLatency = builder.submissionLatency;
        this.fillLatency = builder.fillLatency;
        this.orderPoolCapacity = builder.orderPoolCapacity;
        this.levelPoolCapacity = builder.levelPoolCapacity;
        this.tapBufferSize = builder.tapBufferSize;
        this.journalPath = builder.journalPath;
        this.accounts = Collections.unmodifiableMap(new TreeMap<>(builder.accounts));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Defaults from the classpath only.
     */
    public static SimulationConfig load() {
        return fromProperties(defaults());
    }

    /**
     * Defaults overlaid with a scenario file.
     */
    public static SimulationConfig load(Path scenario) {
        Properties properties = defaults();
        try (Reader reader = Files.newBufferedReader(scenario, StandardCharsets.UTF_8)) {
            properties.load(reader);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read scenario " + scenario, e);
        }
        return fromProperties(properties);
    }

    /**
     * Defaults overlaid with a scenario resource on the classpath.
     */
    public static SimulationConfig loadResource(String resource) {
        Properties properties = defaults();
        loadResource(properties, resource, true);
        return fromProperties(properties);
    }

    public static SimulationConfig fromProperties(Properties properties) {
        Builder builder = builder();
        String value;
        if ((value = properties.getProperty(SEED)) != null) {
            builder.seed(parseLong(SEED, value));
        }
        if ((value = properties.getProperty(PNL_CONVENTION)) != null) {
            try {
                builder.pnlConvention(PnlConvention.valueOf(value.trim()));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException(PNL_CONVENTION + ": unknown convention '" + value + "'", e);
            }
        }
        if ((value = properties.getProperty(SUBMISSION_LATENCY)) != null) {
            builder.submissionLatency(parseLong(SUBMISSION_LATENCY, value));
        }
        if ((value = properties.getProperty(FILL_LATENCY)) != null) {
            builder.fillLatency(parseLong(FILL_LATENCY, value));
        }
        if ((value = properties.getProperty(ORDER_POOL)) != null) {
            builder.orderPoolCapacity(parseInt(ORDER_POOL, value));
        }
        if ((value = properties.getProperty(LEVEL_POOL)) != null) {
            builder.levelPoolCapacity(parseInt(LEVEL_POOL, value));
        }
        if ((value = properties.getProperty(TAP_BUFFER_SIZE)) != null) {
            builder.tapBufferSize(parseInt(TAP_BUFFER_SIZE, value));
        }
        if ((value = properties.getProperty(JOURNAL_PATH)) != null) {
            builder.journalPath(value.trim());
        }
        parseAccounts(properties, builder);
        return builder.build();
    }

    private static void parseAccounts(Properties properties, Builder builder) {
        Map<Long, long[]> raw = new TreeMap<>();
        for (String key : properties.stringPropertyNames()) {
            if (!key.startsWith(ACCOUNT_PREFIX)) {
                continue;
            }
            String rest = key.substring(ACCOUNT_PREFIX.length());
            int dot = rest.indexOf('.');
            if (dot <= 0) {
                throw new ConfigurationException(key + ": expected " + ACCOUNT_PREFIX + "<owner>.<field>");
            }
            long owner = parseLong(key, rest.substring(0, dot));
            long value = parseLong(key, properties.getProperty(key));
            long[] fields = raw.computeIfAbsent(owner, o -> new long[3]);
            switch (rest.substring(dot + 1)) {
                case "cash":
                    fields[0] = value;
                    break;
                case "inventory":
                    fields[1] = value;
                    break;
                case "openingPrice":
                    fields[2] = value;
                    break;
                default:
                    throw new ConfigurationException(key + ": unknown account field");
            }
        }
        for (Map.Entry<Long, long[]> entry : raw.entrySet()) {
            long[] fields = entry.getValue();
            builder.account(entry.getKey(), fields[0], fields[1], fields[2]);
        }
    }

    private static Properties defaults() {
        Properties properties = new Properties();
        loadResource(properties, DEFAULTS_RESOURCE, false);
        return properties;
    }

    private static void loadResource(Properties properties, String resource, boolean required) {
        InputStream in = SimulationConfig.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            if (required) {
                throw new ConfigurationException("Resource not found: " + resource);
            }
            return;
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            properties.load(reader);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read resource " + resource, e);
        }
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key + ": not a 32-bit integer '" + value + "'", e);
        }
    }

    private static long parseLong(String key, String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key + ": not an integer '" + value + "'", e);
        }
    }

    /**
     * Copy with a different root seed; everything else unchanged.
     */
    public SimulationConfig withSeed(long newSeed) {
        return toBuilder().seed(newSeed).build();
    }

    /**
     * Copy for one repetition: derived seed, and a journal directory of its
     * own so parallel repetitions never share a queue.
     */
    SimulationConfig forRepetition(long repetitionSeed, int repetition) {
        Builder builder = toBuilder().seed(repetitionSeed);
        if (!journalPath.isEmpty()) {
            builder.journalPath(journalPath + "/rep-" + repetition);
        }
        return builder.build();
    }

    public Builder toBuilder() {
        Builder builder = builder()
                .seed(seed)
                .pnlConvention(pnlConvention)
                .submissionLatency(submissionLatency)
                .fillLatency(fillLatency)
                .orderPoolCapacity(orderPoolCapacity)
                .levelPoolCapacity(levelPoolCapacity)
                .tapBufferSize(tapBufferSize)
                .journalPath(journalPath);
        builder.accounts.putAll(accounts);
        return builder;
    }

    public long seed() {
        return seed;
    }

    public PnlConvention pnlConvention() {
        return pnlConvention;
    }

    public long submissionLatency() {
        return submissionLatency;
    }

    public long fillLatency() {
        return fillLatency;
    }

    public LatencyModel latencyModel() {
        return new ConstantLatencyModel(submissionLatency, fillLatency);
    }

    public int orderPoolCapacity() {
        return orderPoolCapacity;
    }

    public int levelPoolCapacity() {
        return levelPoolCapacity;
    }

    /**
     * @return ring size of the event tap, 0 when the tap is disabled
     */
    public int tapBufferSize() {
        return tapBufferSize;
    }

    /**
     * @return Chronicle journal directory, empty when journaling is off
     */
    public String journalPath() {
        return journalPath;
    }

    /**
     * @return configured accounts by owner, ascending
     */
    public Map<Long, AccountConfig> accounts() {
        return accounts;
    }

    @Override
    public String toString() {
        return "SimulationConfig{" +
                "seed=" + seed +
                ", pnl=" + pnlConvention +
                ", latency=" + submissionLatency + "/" + fillLatency +
                ", pools=" + orderPoolCapacity + "/" + levelPoolCapacity +
                ", tap=" + tapBufferSize +
                ", journal='" + journalPath + '\'' +
                ", accounts=" + accounts.size() +
                '}';
    }

    /**
     * Starting balances of one participant.
     */
    public static final class AccountConfig {
        private final long cash;
        private final long inventory;
        private final long openingPrice;

        public AccountConfig(long cash, long inventory, long openingPrice) {
            this.cash = cash;
            this.inventory = inventory;
            this.openingPrice = openingPrice;
        }

        public long cash() {
            return cash;
        }

        public long inventory() {
            return inventory;
        }

        public long openingPrice() {
            return openingPrice;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof AccountConfig)) {
                return false;
            }
            AccountConfig that = (AccountConfig) o;
            return cash == that.cash && inventory == that.inventory && openingPrice == that.openingPrice;
        }

        @Override
        public int hashCode() {
            return 31 * (31 * Long.hashCode(cash) + Long.hashCode(inventory)) + Long.hashCode(openingPrice);
        }

        @Override
        public String toString() {
            return "AccountConfig{cash=" + cash + ", inventory=" + inventory + ", openingPrice=" + openingPrice + '}';
        }
    }

    public static final class Builder {
        private long seed;
        private PnlConvention pnlConvention = PnlConvention.AVERAGE_COST;
        private long submissionLatency;
        private long fillLatency;
        private int orderPoolCapacity = MatchingEngine.DEFAULT_ORDER_POOL_CAPACITY;
        private int levelPoolCapacity = MatchingEngine.DEFAULT_LEVEL_POOL_CAPACITY;
        private int tapBufferSize;
        private String journalPath = "";
        private final Map<Long, AccountConfig> accounts = new TreeMap<>();

        private Builder() {
        }

        public Builder seed(long seed) {
            this.seed = seed;
            return this;
        }

        public Builder pnlConvention(PnlConvention pnlConvention) {
            this.pnlConvention = pnlConvention;
            return this;
        }

        public Builder submissionLatency(long submissionLatency) {
            this.submissionLatency = submissionLatency;
            return this;
        }

        public Builder fillLatency(long fillLatency) {
            this.fillLatency = fillLatency;
            return this;
        }

        public Builder orderPoolCapacity(int orderPoolCapacity) {
            this.orderPoolCapacity = orderPoolCapacity;
            return this;
        }

        public Builder levelPoolCapacity(int levelPoolCapacity) {
            this.levelPoolCapacity = levelPoolCapacity;
            return this;
        }

        public Builder tapBufferSize(int tapBufferSize) {
            this.tapBufferSize = tapBufferSize;
            return this;
        }

        public Builder journalPath(String journalPath) {
            this.journalPath = journalPath == null ? "" : journalPath;
            return this;
        }

        public Builder account(long owner, long cash, long inventory, long openingPrice) {
            accounts.put(owner, new AccountConfig(cash, inventory, openingPrice));
            return this;
        }

        /**
         * @throws ConfigurationException naming the first invalid key
         */
        public SimulationConfig build() {
            if (pnlConvention == null) {
                throw new ConfigurationException(PNL_CONVENTION + ": must be set");
            }
            if (submissionLatency < 0) {
                throw new ConfigurationException(SUBMISSION_LATENCY + ": must be non-negative, got " + submissionLatency);
            }
            if (fillLatency < 0) {
                throw new ConfigurationException(FILL_LATENCY + ": must be non-negative, got " + fillLatency);
            }
            if (orderPoolCapacity <= 0) {
                throw new ConfigurationException(ORDER_POOL + ": must be positive, got " + orderPoolCapacity);
            }
            if (levelPoolCapacity <= 0) {
                throw new ConfigurationException(LEVEL_POOL + ": must be positive, got " + levelPoolCapacity);
            }
            if (tapBufferSize < 0 || (tapBufferSize > 0 && Integer.bitCount(tapBufferSize) != 1)) {
                throw new ConfigurationException(TAP_BUFFER_SIZE + ": must be 0 or a power of two, got " + tapBufferSize);
            }
            for (Map.Entry<Long, AccountConfig> entry : accounts.entrySet()) {
                AccountConfig account = entry.getValue();
                if (account.inventory() != 0 && account.openingPrice() <= 0) {
                    throw new ConfigurationException(ACCOUNT_PREFIX + entry.getKey()
                            + ".openingPrice: must be positive when inventory is set");
                }
            }
            return new SimulationConfig(this);
        }
    }
}
