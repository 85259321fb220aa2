package com.backtester.unit.feed;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.backtester.config.BacktestProperties;
import com.backtester.domain.model.PriceBar;
import com.backtester.exception.BusinessException;
import com.backtester.exception.ErrorCode;
import com.backtester.exception.ResourceNotFoundException;
import com.backtester.feed.CsvBarLoader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CsvBarLoaderTest {

    @TempDir
    Path dataDir;

    private CsvBarLoader loader;

    @BeforeEach
    void setUp() {
        BacktestProperties properties = new BacktestProperties();
        properties.setDataDirectory(dataDir.toString());
        loader = new CsvBarLoader(properties);
    }

    @Test
    void load_readsBarsFromDataDirectory() throws IOException {
        Files.writeString(dataDir.resolve("aapl.csv"), """
                timestamp,ticker,open,high,low,close,volume
                # split-adjusted
                2024-01-02,AAPL,187.15,188.44,183.89,185.64,82488700

                2024-01-03T16:00:00,AAPL,184.22,185.88,183.43,184.25
                """);

        List<PriceBar> bars = loader.load("aapl.csv");

        assertThat(bars).hasSize(2);
        PriceBar first = bars.get(0);
        assertThat(first.getTimestamp()).isEqualTo(LocalDateTime.of(2024, 1, 2, 0, 0));
        assertThat(first.getTicker()).isEqualTo("AAPL");
        assertThat(first.getClose()).isEqualByComparingTo("185.64");
        assertThat(first.getVolume()).isEqualTo(82488700L);
        assertThat(bars.get(1).getTimestamp()).isEqualTo(LocalDateTime.of(2024, 1, 3, 16, 0));
        assertThat(bars.get(1).getVolume()).isZero();
    }

    @Test
    void load_missingFileIsNotFound() {
        assertThatThrownBy(() -> loader.load("missing.csv")).isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void load_pathOutsideDataDirectoryIsRejected() {
        assertThatThrownBy(() -> loader.load("../outside.csv"))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.VALIDATION_ERROR);
    }

    @Test
    void parse_malformedRowReportsLine() {
        List<String> lines = List.of("2024-01-02,AAPL,1,2,0.5,1.5,100", "2024-01-03,AAPL,1,2,0.5,abc,100");

        assertThatThrownBy(() -> loader.parse(lines, "inline"))
                .isInstanceOf(BusinessException.class)
                .hasMessageContaining("row 2");
    }

    @Test
    void parse_tooFewColumnsIsRejected() {
        assertThatThrownBy(() -> loader.parse(List.of("2024-01-02,AAPL,1,2"), "inline"))
                .isInstanceOf(BusinessException.class);
    }
}
