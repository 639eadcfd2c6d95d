package io.crosslane;

import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.TypeLiteral;
import com.google.inject.name.Names;
import io.crosslane.dispatch.MessageDispatch;
import io.crosslane.events.BridgeEventLog;
import io.crosslane.events.BridgeEventSink;
import io.crosslane.fee.Currency;
import io.crosslane.fee.FeeMarket;
import io.crosslane.fee.FeeMarketPayment;
import io.crosslane.fee.InMemoryCurrency;
import io.crosslane.fee.Order;
import io.crosslane.fee.Relayer;
import io.crosslane.finality.UnsignedHeaderPoolValidator;
import io.crosslane.lane.DeliveryFeeEstimator;
import io.crosslane.lane.LaneStores;
import io.crosslane.lane.MessagesLedger;
import io.crosslane.model.AccountId;
import io.crosslane.model.LaneId;
import io.crosslane.model.MessageKey;
import io.crosslane.model.OutboundLaneData;
import io.crosslane.model.Weight;
import io.crosslane.payload.DispatchFeePayment;
import io.crosslane.payload.MessagePayload;
import io.crosslane.payload.RawOrigin;
import io.crosslane.payload.SourceAccountOrigin;
import io.crosslane.proof.StateRootAnchor;
import io.crosslane.settings.BridgeSettings;
import io.crosslane.settings.SettingsReader;
import io.crosslane.storage.InMemoryKeyValueStore;
import io.crosslane.storage.KeyValueStore;
import org.junit.Before;
import org.junit.Test;

import java.math.BigInteger;
import java.util.List;
import java.util.function.LongSupplier;

import static org.junit.Assert.*;
import static org.mockito.Mockito.mock;

public class BridgeAppModuleTest {
    private static final AccountId SUBMITTER = new AccountId("5555555555555555555555555555555555555555555555555555555555555555");
    private static final BigInteger COLLATERAL = new BigInteger("100000000000000000000");

    private InMemoryCurrency currency;
    private Injector injector;

    private static class TestBridgeAppModule extends BridgeAppModule {
        private final BridgeSettings settings;
        private final Currency currency;

        TestBridgeAppModule(BridgeSettings settings, Currency currency) {
            this.settings = settings;
            this.currency = currency;
        }

        @Override
        protected void configureApp() {
            LongSupplier blockNumber = () -> 10;

            bind(BridgeSettings.class)
                    .annotatedWith(Names.named("BridgeSettings"))
                    .toInstance(settings);
            bind(Currency.class)
                    .annotatedWith(Names.named("Currency"))
                    .toInstance(currency);
            bind(StateRootAnchor.class)
                    .annotatedWith(Names.named("StateRootAnchor"))
                    .toInstance(mock(StateRootAnchor.class));
            bind(MessageDispatch.class)
                    .annotatedWith(Names.named("MessageDispatch"))
                    .toInstance(mock(MessageDispatch.class));
            bind(BridgeEventSink.class)
                    .annotatedWith(Names.named("EventSink"))
                    .toInstance(new BridgeEventLog());
            bind(LongSupplier.class)
                    .annotatedWith(Names.named("BlockNumber"))
                    .toInstance(blockNumber);
            bind(LaneStores.class)
                    .annotatedWith(Names.named("LaneStores"))
                    .toInstance(LaneStores.inMemory());
            bind(new TypeLiteral<KeyValueStore<MessageKey, Order>>() {})
                    .annotatedWith(Names.named("OrdersStorage"))
                    .toInstance(new InMemoryKeyValueStore<>());
            bind(new TypeLiteral<KeyValueStore<AccountId, Relayer>>() {})
                    .annotatedWith(Names.named("RelayersStorage"))
                    .toInstance(new InMemoryKeyValueStore<>());
        }
    }

    @Before
    public void setUp() {
        String path = getClass().getClassLoader().getResource("user.conf").getFile();
        BridgeSettings settings = new SettingsReader(path).getBridgeSettings();
        currency = new InMemoryCurrency();
        injector = Guice.createInjector(new TestBridgeAppModule(settings, currency));
    }

    @Test
    public void whenInjectorIsCreated_componentsAreSharedSingletons() {
        // Act
        FeeMarket feeMarket = injector.getInstance(FeeMarket.class);

        // Assert
        assertSame(feeMarket, injector.getInstance(FeeMarket.class));
        assertSame(injector.getInstance(MessagesLedger.class), injector.getInstance(MessagesLedger.class));
        assertSame(injector.getInstance(FeeMarketPayment.class), injector.getInstance(FeeMarketPayment.class));
        assertNotNull(injector.getInstance(UnsignedHeaderPoolValidator.class));
        assertEquals(BigInteger.valueOf(1100000000), injector.getInstance(DeliveryFeeEstimator.class).estimate(Weight.ZERO));
    }

    @Test
    public void whenRelayersEnrol_wiredLedgerAcceptsMessages() throws Exception {
        // Arrange
        FeeMarket feeMarket = injector.getInstance(FeeMarket.class);
        byte prefix = 1;
        for (long fee : List.of(10L, 20L, 30L)) {
            byte[] id = new byte[AccountId.LENGTH];
            id[0] = prefix++;
            AccountId relayer = new AccountId(id);
            currency.deposit(relayer, COLLATERAL);
            feeMarket.getRegistry().enroll(relayer, COLLATERAL, BigInteger.valueOf(fee));
        }
        currency.deposit(SUBMITTER, BigInteger.valueOf(1000));
        MessagesLedger ledger = injector.getInstance(MessagesLedger.class);
        MessagePayload payload = new MessagePayload(1, Weight.of(100), new SourceAccountOrigin(SUBMITTER),
                DispatchFeePayment.AT_SOURCE_CHAIN, new byte[]{7});

        // Act
        long nonce = ledger.sendMessage(RawOrigin.signed(SUBMITTER), LaneId.fromName("pars"), payload, BigInteger.valueOf(30));

        // Assert
        assertEquals(1, nonce);
        assertEquals(new OutboundLaneData(1, 0, 1), ledger.outboundLaneData(LaneId.fromName("pars")));
        assertEquals(10, feeMarket.getOrder(new MessageKey(LaneId.fromName("pars"), 1)).get().getCreatedAt());
    }
}
