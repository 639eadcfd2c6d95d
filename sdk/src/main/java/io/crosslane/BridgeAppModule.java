package io.crosslane;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.google.inject.name.Named;
import io.crosslane.dispatch.MessageDispatch;
import io.crosslane.events.BridgeEventSink;
import io.crosslane.fee.Currency;
import io.crosslane.fee.FeeMarket;
import io.crosslane.fee.FeeMarketPayment;
import io.crosslane.fee.LinearSlasher;
import io.crosslane.fee.Order;
import io.crosslane.fee.Relayer;
import io.crosslane.fee.RelayersRegistry;
import io.crosslane.finality.UnsignedHeaderPoolValidator;
import io.crosslane.lane.ChainMessageVerifier;
import io.crosslane.lane.ConfiguredBridgedChain;
import io.crosslane.lane.ConfiguredThisChain;
import io.crosslane.lane.DeliveryFeeEstimator;
import io.crosslane.lane.LaneMessageVerifier;
import io.crosslane.lane.LaneStores;
import io.crosslane.lane.MessagesLedger;
import io.crosslane.model.AccountId;
import io.crosslane.model.MessageKey;
import io.crosslane.proof.MessagesProofVerifier;
import io.crosslane.proof.StateRootAnchor;
import io.crosslane.settings.BridgeSettings;
import io.crosslane.settings.BridgedChainSettings;
import io.crosslane.storage.KeyValueStore;

import java.util.function.LongSupplier;

/**
 * Wires the bridge components from {@link BridgeSettings}.
 * <p>
 * The application binds, in {@link #configureApp()}, everything that belongs to the chain the bridge runs on:
 * <ul>
 *     <li>"BridgeSettings": {@link BridgeSettings}</li>
 *     <li>"Currency": {@link Currency}</li>
 *     <li>"StateRootAnchor": {@link StateRootAnchor} of the bridged headers</li>
 *     <li>"MessageDispatch": {@link MessageDispatch} of inbound messages</li>
 *     <li>"EventSink": {@link BridgeEventSink}</li>
 *     <li>"BlockNumber": {@link LongSupplier} of the current block number</li>
 *     <li>"LaneStores": {@link LaneStores}</li>
 *     <li>"OrdersStorage" and "RelayersStorage": key-value stores of the fee market</li>
 * </ul>
 */
public abstract class BridgeAppModule extends AbstractModule {

    @Override
    protected final void configure() {
        configureApp();
    }

    protected abstract void configureApp();

    @Provides
    @Singleton
    RelayersRegistry relayersRegistry(@Named("BridgeSettings") BridgeSettings settings,
                                      @Named("RelayersStorage") KeyValueStore<AccountId, Relayer> relayers,
                                      @Named("Currency") Currency currency) {
        return new RelayersRegistry(relayers, currency, settings.getFeeMarket());
    }

    @Provides
    @Singleton
    FeeMarket feeMarket(@Named("BridgeSettings") BridgeSettings settings,
                        @Named("OrdersStorage") KeyValueStore<MessageKey, Order> orders,
                        RelayersRegistry registry) {
        return new FeeMarket(orders, registry, settings.getFeeMarket());
    }

    @Provides
    @Singleton
    FeeMarketPayment feeMarketPayment(@Named("BridgeSettings") BridgeSettings settings,
                                      @Named("Currency") Currency currency,
                                      @Named("EventSink") BridgeEventSink eventSink,
                                      FeeMarket feeMarket) {
        return new FeeMarketPayment(currency, feeMarket, new LinearSlasher(settings.getFeeMarket().getSlashPerBlock()),
                settings.getFeeMarket(), eventSink);
    }

    @Provides
    @Singleton
    MessagesLedger messagesLedger(@Named("BridgeSettings") BridgeSettings settings,
                                  @Named("StateRootAnchor") StateRootAnchor anchor,
                                  @Named("MessageDispatch") MessageDispatch messageDispatch,
                                  @Named("EventSink") BridgeEventSink eventSink,
                                  @Named("BlockNumber") LongSupplier blockNumber,
                                  @Named("LaneStores") LaneStores stores,
                                  FeeMarket feeMarket,
                                  FeeMarketPayment payment) {
        BridgedChainSettings bridgedChain = settings.getBridgedChain();
        ChainMessageVerifier chainVerifier = new ChainMessageVerifier(
                new ConfiguredBridgedChain(bridgedChain.getMaxExtrinsicSize(), bridgedChain.getMaxExtrinsicWeight()));
        LaneMessageVerifier laneVerifier = new LaneMessageVerifier(
                new ConfiguredThisChain(settings.getLanes(), settings.getLaneSettings().getMaxPendingMessages()), feeMarket);
        MessagesProofVerifier proofVerifier = new MessagesProofVerifier(anchor, bridgedChain.getStorageNamespace());
        return new MessagesLedger(settings.getLaneSettings(), chainVerifier, laneVerifier, proofVerifier,
                messageDispatch, feeMarket, payment, stores, eventSink, blockNumber);
    }

    @Provides
    @Singleton
    UnsignedHeaderPoolValidator headerPoolValidator(@Named("BridgeSettings") BridgeSettings settings) {
        return new UnsignedHeaderPoolValidator(settings.getMaxFutureNumberDifference());
    }

    @Provides
    @Singleton
    DeliveryFeeEstimator deliveryFeeEstimator(@Named("BridgeSettings") BridgeSettings settings) {
        BridgedChainSettings bridgedChain = settings.getBridgedChain();
        return new DeliveryFeeEstimator(bridgedChain.getDeliveryBaseFee(), bridgedChain.getFeePerWeightUnit(),
                bridgedChain.getRelayerFeePercent());
    }
}
