package io.crosslane.settings;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import io.crosslane.model.AccountId;
import io.crosslane.model.ChainId;
import io.crosslane.model.LaneId;
import io.crosslane.model.Ratio;
import io.crosslane.model.Weight;

import java.io.File;
import java.math.BigInteger;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

public class SettingsReader {
    static final String CONFIG_ROOT = "crosslane";
    static final String MISSING_CONFIG = "Configuration file `%s` does not exist";

    private final BridgeSettings bridgeSettings;
    private final Config config;

    public SettingsReader(String userConfigPath) {
        this.config = readConfigFromPath(userConfigPath);
        this.bridgeSettings = fromConfig(this.config);
        // init log4j logging system as soon as possible after having read the settings
        LogInitializer.initLogManager(this.bridgeSettings.getLogInfo());
    }

    public BridgeSettings getBridgeSettings() {
        return bridgeSettings;
    }

    public Config getConfig() {
        return config;
    }

    // User settings override the defaults of reference.conf
    public static Config readConfigFromPath(String userConfigPath) {
        File userConfigFile = new File(userConfigPath);
        if (!userConfigFile.isFile())
            throw new IllegalArgumentException(String.format(MISSING_CONFIG, userConfigPath));
        return ConfigFactory.parseFile(userConfigFile)
                .withFallback(ConfigFactory.load())
                .resolve();
    }

    public static BridgeSettings fromConfig(Config rootConfig) {
        Config config = rootConfig.getConfig(CONFIG_ROOT);
        Config bridge = config.getConfig("bridge");
        List<LaneId> lanes = config.getStringList("lanes.ids").stream()
                .map(LaneId::fromName)
                .collect(Collectors.toList());
        return new BridgeSettings(
                ChainId.fromName(bridge.getString("thisChain")),
                ChainId.fromName(bridge.getString("bridgedChain")),
                lanes,
                laneSettings(config.getConfig("lanes")),
                bridgedChainSettings(config.getConfig("bridgedChain")),
                feeMarketSettings(config.getConfig("feeMarket")),
                dispatchSettings(config.getConfig("dispatch")),
                config.getLong("headerPool.maxFutureNumberDifference"),
                logInfo(config.getConfig("logInfo")));
    }

    static LaneSettings laneSettings(Config config) {
        return new LaneSettings(
                config.getLong("maxPendingMessages"),
                config.getInt("maxMessagesToPruneAtOnce"),
                config.getInt("maxUnrewardedRelayerEntries"),
                config.getLong("maxUnconfirmedMessages"));
    }

    static BridgedChainSettings bridgedChainSettings(Config config) {
        return new BridgedChainSettings(
                config.getString("storageNamespace"),
                config.getInt("maxExtrinsicSize"),
                Weight.of(config.getLong("maxExtrinsicWeight")),
                balance(config, "deliveryBaseFee"),
                balance(config, "feePerWeightUnit"),
                config.getInt("relayerFeePercent"));
    }

    static FeeMarketSettings feeMarketSettings(Config config) {
        Optional<BigInteger> slashProtect = config.hasPath("slashProtect")
                ? Optional.of(balance(config, "slashProtect"))
                : Optional.empty();
        return new FeeMarketSettings(
                config.getInt("assignedRelayersNumber"),
                config.getLong("slotLength"),
                balance(config, "collateralPerOrder"),
                Ratio.fromPercent(config.getInt("baseFeePercent")),
                Ratio.fromPercent(config.getInt("assignedRelayersRewardPercent")),
                Ratio.fromPercent(config.getInt("messageRelayersRewardPercent")),
                Ratio.fromPercent(config.getInt("confirmRelayersRewardPercent")),
                Ratio.fromPercent(config.getInt("assignedRelayerSlashPercent")),
                balance(config, "slashPerBlock"),
                slashProtect,
                new AccountId(config.getString("treasuryAccount")),
                new AccountId(config.getString("relayerFundAccount")));
    }

    static DispatchSettings dispatchSettings(Config config) {
        return new DispatchSettings(
                config.getInt("specVersion"),
                balance(config, "feePerWeightUnit"),
                Weight.of(config.getLong("forwardedWeightCredit")));
    }

    static LogInfo logInfo(Config config) {
        return new LogInfo(
                config.getString("logDir"),
                config.getString("logFileName"),
                config.getString("logFileLevel"),
                config.getString("logConsoleLevel"));
    }

    // Balances are strings, they may exceed the range of a long
    private static BigInteger balance(Config config, String path) {
        BigInteger value = new BigInteger(config.getString(path));
        if (value.signum() < 0)
            throw new IllegalArgumentException(String.format("Balance `%s` at `%s` is negative", value, path));
        return value;
    }
}
