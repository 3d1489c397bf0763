package com.delta.catalogcrawler.crawl.fetch;

import com.delta.catalogcrawler.crawl.concurrent.CancelToken;
import com.delta.catalogcrawler.crawl.model.SiteTotals;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FallbackFetchCapabilityTest {

    @Mock
    private FetchCapability primary;

    @Mock
    private FetchCapability secondary;

    @Test
    void navigationFailureFallsBackToSecondary() {
        when(primary.fetchSiteTotals(any())).thenThrow(new CrawlException(CrawlErrorKind.NAVIGATION, "refused"));
        when(primary.name()).thenReturn("http");
        when(secondary.name()).thenReturn("jsoup");
        when(secondary.fetchSiteTotals(any())).thenReturn(new SiteTotals(7, 3));

        SiteTotals totals = new FallbackFetchCapability(primary, secondary).fetchSiteTotals(CancelToken.create());

        assertThat(totals).isEqualTo(new SiteTotals(7, 3));
        verify(secondary).fetchSiteTotals(any());
    }

    @Test
    void extractionFailureIsNotRetriedOnSecondary() {
        when(primary.fetchListingPage(2, null, 1)).thenThrow(new CrawlException(CrawlErrorKind.EXTRACTION, "no records"));

        FallbackFetchCapability capability = new FallbackFetchCapability(primary, secondary);

        assertThatThrownBy(() -> capability.fetchListingPage(2, null, 1))
            .isInstanceOf(CrawlException.class)
            .hasMessageContaining("no records");
        verifyNoInteractions(secondary);
    }

    @Test
    void cancelledCallIsNotRetriedOnSecondary() {
        CancelToken token = CancelToken.create();
        token.cancel("stop");
        when(primary.fetchRecordDetail("https://catalog.test/item/1", token, 1))
            .thenThrow(new CrawlException(CrawlErrorKind.TIMEOUT, "slow"));

        FallbackFetchCapability capability = new FallbackFetchCapability(primary, secondary);

        assertThatThrownBy(() -> capability.fetchRecordDetail("https://catalog.test/item/1", token, 1))
            .isInstanceOf(CrawlException.class);
        verifyNoInteractions(secondary);
    }
}
