package com.backtester.feed;

import com.backtester.config.BacktestProperties;
import com.backtester.domain.model.PriceBar;
import com.backtester.exception.BusinessException;
import com.backtester.exception.ErrorCode;
import com.backtester.exception.ResourceNotFoundException;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Loads price bars from CSV files in the configured data directory.
 *
 * <p>Expected columns: {@code timestamp,ticker,open,high,low,close,volume}. A header row whose
 * first cell is {@code timestamp} is skipped, as are blank lines and lines starting with
 * {@code #}. The timestamp is either an ISO date-time ({@code 2024-01-02T16:00}) or an ISO
 * date, which is read as the start of that day. Volume is optional.
 *
 * <p>File names are resolved inside {@code backtester.data-directory}; names that escape the
 * directory are rejected.
 */
@Component
public class CsvBarLoader {

    private static final Logger log = LoggerFactory.getLogger(CsvBarLoader.class);

    private static final String HEADER_FIRST_CELL = "timestamp";
    private static final int MIN_COLUMNS = 6;

    private final BacktestProperties backtestProperties;

    public CsvBarLoader(BacktestProperties backtestProperties) {
        this.backtestProperties = backtestProperties;
    }

    /**
     * Reads all bars from {@code fileName} under the data directory.
     *
     * @throws ResourceNotFoundException if the file does not exist
     * @throws BusinessException with {@link ErrorCode#VALIDATION_ERROR} on a malformed row or
     *         a path outside the data directory
     */
    public List<PriceBar> load(String fileName) {
        Path dataDirectory = Paths.get(backtestProperties.getDataDirectory()).toAbsolutePath().normalize();
        Path file = dataDirectory.resolve(fileName).normalize();
        if (!file.startsWith(dataDirectory)) {
            throw new BusinessException(
                    ErrorCode.VALIDATION_ERROR, "Data file must be inside the data directory: " + fileName);
        }
        if (!Files.isRegularFile(file)) {
            throw new ResourceNotFoundException("Data file", fileName);
        }

        try {
            List<PriceBar> bars = parse(Files.readAllLines(file, StandardCharsets.UTF_8), fileName);
            log.info("Loaded {} bars from {}", bars.size(), file);
            return bars;
        } catch (IOException e) {
            throw new BusinessException(ErrorCode.INTERNAL_ERROR, "Failed to read data file: " + fileName, e);
        }
    }

    /**
     * Parses CSV lines into bars. {@code source} is only used in error messages.
     */
    public List<PriceBar> parse(List<String> lines, String source) {
        List<PriceBar> bars = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            String[] cells = line.split(",", -1);
            if (i == 0 && HEADER_FIRST_CELL.equalsIgnoreCase(cells[0].trim())) {
                continue;
            }
            bars.add(parseRow(cells, source, i + 1));
        }
        return bars;
    }

    private PriceBar parseRow(String[] cells, String source, int lineNumber) {
        if (cells.length < MIN_COLUMNS) {
            throw malformed(source, lineNumber, "expected at least " + MIN_COLUMNS + " columns, got " + cells.length);
        }
        try {
            String ticker = cells[1].trim();
            if (ticker.isEmpty()) {
                throw malformed(source, lineNumber, "ticker is empty");
            }
            BigDecimal close = new BigDecimal(cells[5].trim());
            if (close.signum() < 0) {
                throw malformed(source, lineNumber, "close price is negative");
            }
            long volume = cells.length > 6 && !cells[6].isBlank() ? Long.parseLong(cells[6].trim()) : 0L;

            return PriceBar.builder()
                    .timestamp(parseTimestamp(cells[0].trim()))
                    .ticker(ticker)
                    .open(new BigDecimal(cells[2].trim()))
                    .high(new BigDecimal(cells[3].trim()))
                    .low(new BigDecimal(cells[4].trim()))
                    .close(close)
                    .volume(volume)
                    .build();
        } catch (NumberFormatException | DateTimeParseException e) {
            throw malformed(source, lineNumber, e.getMessage());
        }
    }

    private static LocalDateTime parseTimestamp(String value) {
        if (value.contains("T")) {
            return LocalDateTime.parse(value);
        }
        return LocalDate.parse(value).atStartOfDay();
    }

    private static BusinessException malformed(String source, int lineNumber, String reason) {
        return new BusinessException(
                ErrorCode.VALIDATION_ERROR,
                String.format("Malformed row %d in %s: %s", lineNumber, source, reason),
                Map.of("source", source, "line", lineNumber));
    }
}
