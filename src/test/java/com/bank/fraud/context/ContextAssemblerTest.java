package com.bank.fraud.context;

import com.bank.fraud.config.MetricsConfig;
import com.bank.fraud.config.MonitoringConfig;
import com.bank.fraud.exception.InvalidTransactionException;
import com.bank.fraud.exception.LedgerUnavailableException;
import com.bank.fraud.model.Transaction;
import com.bank.fraud.testutil.TestDataFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.BiConsumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ContextAssemblerTest {

    private ExecutorService executor;
    private SimpleMeterRegistry registry;
    private MonitoringConfig config;
    private Transaction txn;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        registry = new SimpleMeterRegistry();
        config = new MonitoringConfig();
        config.getAssembly().setGroupTimeoutMs(200);
        config.getAssembly().setDeadlineMs(500);
        txn = TestDataFactory.debit("TXN-1", "ACC-1", 100, TestDataFactory.NOW);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static SignalGroup group(String prefix, BiConsumer<SignalInput, SignalWriter> body) {
        return new SignalGroup() {
            @Override
            public String prefix() {
                return prefix;
            }

            @Override
            public void contribute(SignalInput input, SignalWriter out) {
                body.accept(input, out);
            }
        };
    }

    private ContextAssembler assembler(SignalGroup... groups) {
        return new ContextAssembler(List.of(groups), config, executor, new MetricsConfig(registry));
    }

    @Test
    void build_mergesAllGroupsUnderTheirPrefixes() {
        ContextAssembler assembler = assembler(
                group("velocity", (in, out) -> out.put("tx_count_1h", 3L)),
                group("geo", (in, out) -> out.put("country", "US").unknown("distance_km")));

        Context context = assembler.build(txn);

        assertThat(context.number("velocity.tx_count_1h")).contains(3.0);
        assertThat(context.text("geo.country")).contains("US");
        assertThat(context.asMap()).containsKey("geo.distance_km");
        assertThat(context.has("geo.distance_km")).isFalse();
        assertThat(context.list(ContextAssembler.DEGRADED_GROUPS)).isEmpty();
        assertThat(assembler.getGroupPrefixes()).containsExactly("geo", "velocity");
    }

    @Test
    void build_sequentialMode_sameResult() {
        config.getAssembly().setParallel(false);
        ContextAssembler assembler = assembler(
                group("a", (in, out) -> out.put("x", true)),
                group("b", (in, out) -> out.put("y", 1.5)));

        Context context = assembler.build(txn);

        assertThat(context.isTrue("a.x")).isTrue();
        assertThat(context.number("b.y")).contains(1.5);
    }

    @Test
    void build_windowsAnchoredAtTransactionTime() {
        ContextAssembler assembler = assembler(
                group("clock", (in, out) -> out.put("at", in.at().toString())));

        assertThat(assembler.build(txn).text("clock.at")).contains(TestDataFactory.NOW.toString());
    }

    @Test
    void constructor_duplicatePrefix_rejected() {
        assertThatThrownBy(() -> assembler(
                group("geo", (in, out) -> {}),
                group("geo", (in, out) -> {})))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("geo");
    }

    @Test
    void constructor_reservedOrDottedPrefix_rejected() {
        assertThatThrownBy(() -> assembler(group("context", (in, out) -> {})))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> assembler(group("geo.sub", (in, out) -> {})))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void build_slowGroup_degradedAndLeftOut() {
        ContextAssembler assembler = assembler(
                group("fast", (in, out) -> out.put("ok", true)),
                group("slow", (in, out) -> {
                    try {
                        Thread.sleep(5_000);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    out.put("late", true);
                }));

        Context context = assembler.build(txn);

        assertThat(context.isTrue("fast.ok")).isTrue();
        assertThat(context.asMap()).doesNotContainKey("slow.late");
        assertThat(context.list(ContextAssembler.DEGRADED_GROUPS)).containsExactly("slow");
        assertThat(registry.get("context.group.degraded.count").tag("group", "slow").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void build_slowGroupSequential_degradedWithinBudget() {
        config.getAssembly().setParallel(false);
        ContextAssembler assembler = assembler(
                group("a", (in, out) -> out.put("ok", true)),
                group("b", (in, out) -> {
                    try {
                        Thread.sleep(5_000);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    out.put("late", true);
                }),
                group("c", (in, out) -> out.put("after", true)));

        long start = System.nanoTime();
        Context context = assembler.build(txn);
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        assertThat(elapsedMs).isLessThan(2_000);
        assertThat(context.isTrue("a.ok")).isTrue();
        assertThat(context.isTrue("c.after")).isTrue();
        assertThat(context.asMap()).doesNotContainKey("b.late");
        assertThat(context.list(ContextAssembler.DEGRADED_GROUPS)).containsExactly("b");
    }

    @Test
    void build_groupHitsLedgerOutage_propagates() {
        ContextAssembler assembler = assembler(
                group("fast", (in, out) -> out.put("ok", true)),
                group("history", (in, out) -> {
                    throw new LedgerUnavailableException("ledger down", null);
                }));

        assertThatThrownBy(() -> assembler.build(txn)).isInstanceOf(LedgerUnavailableException.class);
    }

    @Test
    void build_groupHitsLedgerOutageSequential_propagates() {
        config.getAssembly().setParallel(false);
        ContextAssembler assembler = assembler(group("history", (in, out) -> {
            throw new LedgerUnavailableException("ledger down", null);
        }));

        assertThatThrownBy(() -> assembler.build(txn)).isInstanceOf(LedgerUnavailableException.class);
    }

    @Test
    void build_unreadableMetadata_invalidTransaction() {
        ContextAssembler assembler = assembler(group("a", (in, out) -> out.put("x", true)));
        Transaction bad = txn.toBuilder().metadata("{not json").build();

        assertThatThrownBy(() -> assembler.build(bad)).isInstanceOf(InvalidTransactionException.class);
    }

    @Test
    void build_arrayMetadata_invalidTransaction() {
        ContextAssembler assembler = assembler(group("a", (in, out) -> out.put("x", true)));

        assertThatThrownBy(() -> assembler.build(txn.toBuilder().metadata("[1,2]").build()))
                .isInstanceOf(InvalidTransactionException.class);
    }
}
