package formroutes.page;

import formroutes.model.FieldDescriptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

public class FallbackFieldDiscoveryTest {

    @Mock FieldDiscoveryStrategy<String> primary;
    @Mock FieldDiscoveryStrategy<String> fallback;

    private AutoCloseable mocks;
    private FallbackFieldDiscovery<String> discovery;

    private final List<FieldDescriptor> primaryFields  = List.of(FieldDescriptor.builder("assisted").build());
    private final List<FieldDescriptor> fallbackFields = List.of(FieldDescriptor.builder("heuristic").build());

    @BeforeMethod
    public void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        when(primary.name()).thenReturn("assisted");
        when(fallback.name()).thenReturn("heuristic");
        when(fallback.discover("page")).thenReturn(fallbackFields);
        discovery = new FallbackFieldDiscovery<>(primary, fallback);
    }

    @AfterMethod
    public void tearDown() throws Exception {
        mocks.close();
    }

    @Test(description = "Primary results are used when it finds fields")
    public void testPrimaryWins() {
        when(primary.discover("page")).thenReturn(primaryFields);

        assertThat(discovery.discover("page")).isEqualTo(primaryFields);
        verify(fallback, never()).discover(anyString());
    }

    @Test(description = "An empty primary result falls back")
    public void testEmptyFallsBack() {
        when(primary.discover("page")).thenReturn(List.of());

        assertThat(discovery.discover("page")).isEqualTo(fallbackFields);
    }

    @Test(description = "A failing primary falls back")
    public void testFailureFallsBack() {
        when(primary.discover("page")).thenThrow(new IllegalStateException("service unavailable"));

        assertThat(discovery.discover("page")).isEqualTo(fallbackFields);
        assertThat(discovery.name()).isEqualTo("assisted+heuristic");
    }
}
