package io.github.samzhu.modelprice.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import io.github.samzhu.modelprice.document.Pricing;
import io.github.samzhu.modelprice.document.PricingRecord;
import io.github.samzhu.modelprice.document.ProviderType;

class PricingStoreTest {

    private static final Instant T1 = Instant.parse("2025-01-01T00:00:00Z");
    private static final Instant T2 = Instant.parse("2025-01-02T00:00:00Z");

    @Test
    void shouldDropStaleRecordsWhenProviderIsReplaced() {
        // Given: 第一次刷新有 old-model
        PricingStore store = new PricingStore(null);
        store.replaceProvider(ProviderType.OPENAI,
            List.of(record(ProviderType.OPENAI, "old-model"), record(ProviderType.OPENAI, "gpt-4o")), T1);

        // When: 第二次刷新不再包含 old-model
        store.replaceProvider(ProviderType.OPENAI, List.of(record(ProviderType.OPENAI, "gpt-4o")), T2);

        // Then
        PricingSnapshot snapshot = store.snapshot();
        assertThat(snapshot.findById("openai:old-model")).isEmpty();
        assertThat(snapshot.findById("openai:gpt-4o")).isPresent();
        assertThat(snapshot.lastRefresh()).isEqualTo(T2);
        assertThat(snapshot.updatedAt(ProviderType.OPENAI)).isEqualTo(T2);
    }

    @Test
    void shouldLeaveOtherProvidersUntouched() {
        PricingStore store = new PricingStore(null);
        store.replaceProvider(ProviderType.XAI, List.of(record(ProviderType.XAI, "grok-beta")), T1);

        store.replaceProvider(ProviderType.OPENAI, List.of(record(ProviderType.OPENAI, "gpt-4o")), T2);

        PricingSnapshot snapshot = store.snapshot();
        assertThat(snapshot.size()).isEqualTo(2);
        assertThat(snapshot.updatedAt(ProviderType.XAI)).isEqualTo(T1);
        assertThat(snapshot.updatedAt(ProviderType.OPENAI)).isEqualTo(T2);
    }

    @Test
    void shouldKeepIdsUniqueWithinABatch() {
        PricingStore store = new PricingStore(null);

        store.replaceProvider(ProviderType.OPENAI, List.of(
            record(ProviderType.OPENAI, "gpt-4o", "0.1"),
            record(ProviderType.OPENAI, "gpt-4o", "0.2")), T1);

        PricingSnapshot snapshot = store.snapshot();
        assertThat(snapshot.size()).isEqualTo(1);
        assertThat(snapshot.findById("openai:gpt-4o")).get()
            .satisfies(record -> assertThat(record.pricing().input()).isEqualByComparingTo("0.2"));
    }

    @Test
    void shouldRejectWholeCallWhenAnyRecordBelongsToAnotherProvider() {
        // Given
        PricingStore store = new PricingStore(null);
        store.replaceProvider(ProviderType.XAI, List.of(record(ProviderType.XAI, "grok-beta")), T1);
        PricingSnapshot before = store.snapshot();

        // When / Then: 單次多提供者發佈中任一批次不合法，整個快照不變
        assertThatThrownBy(() -> store.replaceProviders(Map.of(
                ProviderType.OPENAI, List.of(record(ProviderType.OPENAI, "gpt-4o")),
                ProviderType.XAI, List.of(record(ProviderType.OPENAI, "sneaky"))), T2))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(store.snapshot()).isSameAs(before);
    }

    @Test
    void shouldPublishMultipleProvidersInOneSnapshot() {
        PricingStore store = new PricingStore(null);

        store.replaceProviders(Map.of(
            ProviderType.OPENAI, List.of(record(ProviderType.OPENAI, "gpt-4o")),
            ProviderType.XAI, List.of(record(ProviderType.XAI, "grok-beta"))), T1);

        assertThat(store.snapshot().countByProvider(ProviderType.OPENAI)).isEqualTo(1);
        assertThat(store.snapshot().countByProvider(ProviderType.XAI)).isEqualTo(1);
        assertThat(store.snapshot().lastRefresh()).isEqualTo(T1);
    }

    @Test
    void shouldMirrorPublishedBatchesToArchive() {
        PricingArchive archive = mock(PricingArchive.class);
        PricingStore store = new PricingStore(archive);
        List<PricingRecord> records = List.of(record(ProviderType.OPENAI, "gpt-4o"));

        store.replaceProvider(ProviderType.OPENAI, records, T1);

        verify(archive).mirror(ProviderType.OPENAI, records);
    }

    @Test
    void shouldKeepPublishedSnapshotWhenMirrorFails() {
        PricingArchive archive = mock(PricingArchive.class);
        doThrow(new IllegalStateException("mongo down")).when(archive).mirror(eq(ProviderType.OPENAI), any());
        PricingStore store = new PricingStore(archive);

        store.replaceProvider(ProviderType.OPENAI, List.of(record(ProviderType.OPENAI, "gpt-4o")), T1);

        assertThat(store.snapshot().findById("openai:gpt-4o")).isPresent();
    }

    @Test
    void shouldRestoreWithoutMirroringOrTouchingLastRefresh() {
        PricingArchive archive = mock(PricingArchive.class);
        PricingStore store = new PricingStore(archive);

        store.restore(List.of(record(ProviderType.OPENAI, "gpt-4o"), record(ProviderType.XAI, "grok-beta")));

        PricingSnapshot snapshot = store.snapshot();
        assertThat(snapshot.size()).isEqualTo(2);
        assertThat(snapshot.lastRefresh()).isNull();
        assertThat(snapshot.updatedAt(ProviderType.OPENAI)).isEqualTo(T1);
        verify(archive, never()).mirror(any(), any());
    }

    private static PricingRecord record(ProviderType provider, String modelId) {
        return record(provider, modelId, "0.001");
    }

    private static PricingRecord record(ProviderType provider, String modelId, String input) {
        return PricingRecord.builder()
            .provider(provider)
            .modelId(modelId)
            .modelName(modelId)
            .pricing(Pricing.builder().set(Pricing.Component.INPUT, new BigDecimal(input)).build())
            .lastUpdated(T1)
            .build();
    }
}
