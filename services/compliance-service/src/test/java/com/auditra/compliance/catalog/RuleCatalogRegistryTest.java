package com.auditra.compliance.catalog;

import com.auditra.compliance.config.ComplianceProperties;
import com.auditra.compliance.exception.CatalogException;
import com.auditra.compliance.support.ComplianceFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("Rule catalog registry")
class RuleCatalogRegistryTest {

    @Mock
    private RuleCatalogLoader loader;

    private RuleCatalogRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new RuleCatalogRegistry(loader, new ComplianceProperties());
    }

    @Test
    @DisplayName("Should fail fast when no catalog has been loaded")
    void shouldRejectAccessBeforeInitialization() {
        assertThatThrownBy(() -> registry.current()).isInstanceOf(CatalogException.class);
    }

    @Test
    @DisplayName("Should propagate an initial load failure")
    void shouldPropagateInitialFailure() {
        when(loader.load(anyString())).thenThrow(new CatalogException("broken"));

        assertThatThrownBy(() -> registry.initialize()).isInstanceOf(CatalogException.class);
    }

    @Test
    @DisplayName("Should swap in the reloaded catalog")
    void shouldSwapOnReload() {
        RuleCatalog first = ComplianceFixtures.defaultCatalog();
        RuleCatalog second = RuleCatalog.of("next", List.of());
        when(loader.load(ComplianceFixtures.DEFAULT_CATALOG)).thenReturn(first, second);

        registry.initialize();
        RuleCatalog snapshot = registry.current();
        RuleCatalog reloaded = registry.reload();

        assertThat(reloaded).isSameAs(second);
        assertThat(registry.current()).isSameAs(second);
        assertThat(snapshot.version()).isEqualTo("2024.06-1");
        assertThat(snapshot.size()).isEqualTo(7);
    }

    @Test
    @DisplayName("Should keep the previous catalog when a reload fails")
    void shouldKeepPreviousCatalogOnFailedReload() {
        RuleCatalog first = ComplianceFixtures.defaultCatalog();
        when(loader.load(ComplianceFixtures.DEFAULT_CATALOG))
            .thenReturn(first)
            .thenThrow(new CatalogException("inline", List.of("rule 'x': condition set is empty")));

        registry.initialize();

        assertThatThrownBy(() -> registry.reload())
            .isInstanceOf(CatalogException.class)
            .hasMessageContaining("condition set is empty");
        assertThat(registry.current()).isSameAs(first);
    }
}
