package io.github.samzhu.modelprice.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.Test;

import io.github.samzhu.modelprice.document.PricingRecord;
import io.github.samzhu.modelprice.document.ProviderType;
import io.github.samzhu.modelprice.exception.DuplicateProviderException;
import io.github.samzhu.modelprice.exception.UnknownProviderException;

class ProviderRegistryTest {

    @Test
    void shouldListProvidersInRegistrationOrder() {
        // Given
        ProviderRegistry registry = new ProviderRegistry();

        // When
        registry.register(stub(ProviderType.XAI));
        registry.register(stub(ProviderType.AWS_BEDROCK));
        registry.register(stub(ProviderType.OPENAI));

        // Then
        assertThat(registry.all()).extracting(PricingProvider::name)
            .containsExactly("xai", "aws_bedrock", "openai");
        assertThat(registry.size()).isEqualTo(3);
    }

    @Test
    void shouldRejectDuplicateRegistration() {
        ProviderRegistry registry = new ProviderRegistry();
        registry.register(stub(ProviderType.OPENAI));

        assertThatThrownBy(() -> registry.register(stub(ProviderType.OPENAI)))
            .isInstanceOf(DuplicateProviderException.class)
            .hasMessageContaining("openai");
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    void shouldLookUpByName() {
        ProviderRegistry registry = new ProviderRegistry();
        PricingProvider openai = stub(ProviderType.OPENAI);
        registry.register(openai);

        assertThat(registry.get("openai")).isSameAs(openai);
        assertThat(registry.contains("openai")).isTrue();
        assertThat(registry.contains("xai")).isFalse();
    }

    @Test
    void shouldFailLookupOfUnregisteredName() {
        ProviderRegistry registry = new ProviderRegistry();

        assertThatThrownBy(() -> registry.get("azure_openai"))
            .isInstanceOf(UnknownProviderException.class)
            .hasMessageContaining("azure_openai");
    }

    private static PricingProvider stub(ProviderType type) {
        return new PricingProvider() {
            @Override
            public ProviderType type() {
                return type;
            }

            @Override
            public List<PricingRecord> fetch() {
                return List.of();
            }
        };
    }
}
