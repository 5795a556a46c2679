package io.tokenledger.core.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

/** Collection metadata for a ledger instance. */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class LedgerConfig {
    private static final Logger LOG = Logger.getLogger(LedgerConfig.class.getName());
    private static final ObjectMapper JSON = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public static final String DEFAULT_NAME = "MyContract";
    public static final String DEFAULT_SYMBOL = "MC";
    public static final String DEFAULTS_RESOURCE = "ledger-defaults.json";

    @JsonProperty("name")
    public final String name;
    @JsonProperty("symbol")
    public final String symbol;
    @JsonProperty("baseUri")
    public final String baseUri;

    @JsonCreator
    public LedgerConfig(@JsonProperty("name") String name,
                        @JsonProperty("symbol") String symbol,
                        @JsonProperty("baseUri") String baseUri) {
        this.name = name == null ? DEFAULT_NAME : name;
        this.symbol = symbol == null ? DEFAULT_SYMBOL : symbol;
        this.baseUri = baseUri == null ? "" : baseUri;
    }

    public static LedgerConfig defaultLocal() {
        return new LedgerConfig(DEFAULT_NAME, DEFAULT_SYMBOL, "");
    }

    public LedgerConfig withBaseUri(String baseUri) {
        return new LedgerConfig(this.name, this.symbol, baseUri);
    }

    public static LedgerConfig load(Path path) {
        if (!Files.exists(path)) {
            LOG.info("No ledger config at " + path + ", using defaults");
            return defaultLocal();
        }
        try {
            LedgerConfig config = JSON.readValue(path.toFile(), LedgerConfig.class);
            LOG.info("Loaded ledger config " + config.name + " (" + config.symbol + ") from " + path);
            return config;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read ledger config from " + path, e);
        }
    }

    public static LedgerConfig fromClasspath(String resource) {
        try (InputStream in = LedgerConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                LOG.info("Ledger config resource " + resource + " not found, using defaults");
                return defaultLocal();
            }
            return JSON.readValue(in, LedgerConfig.class);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read ledger config resource " + resource, e);
        }
    }

    public void save(Path path) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            JSON.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), this);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to persist ledger config to " + path, e);
        }
    }
}
