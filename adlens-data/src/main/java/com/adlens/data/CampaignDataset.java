package com.adlens.data;

import com.adlens.engine.CreativeSampleSource;
import com.adlens.engine.SeriesFailure;
import com.adlens.engine.SeriesResult;
import com.adlens.engine.TimeSeriesProvider;
import com.adlens.model.CreativeSample;
import com.adlens.model.DatasetSummary;
import com.adlens.model.Task;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * In-memory campaign dataset loaded from a CSV file with a header row.
 * <p>
 * Serves daily metric series (mean of the metric per calendar day, chronological, days without a value omitted),
 * optionally filtered to one {@code campaign_name}. When the dataset has no {@code ctr} column, CTR is derived per
 * row from {@code clicks / impressions}. No schema validation is performed.
 */
public final class CampaignDataset implements TimeSeriesProvider, CreativeSampleSource {

    private static final Logger log = LoggerFactory.getLogger(CampaignDataset.class);

    public static final String COL_DATE = "date";
    public static final String COL_CAMPAIGN = "campaign_name";
    public static final String COL_ADSET = "adset_name";
    public static final String COL_SPEND = "spend";
    public static final String COL_CLICKS = "clicks";
    public static final String COL_IMPRESSIONS = "impressions";
    public static final String COL_CTR = "ctr";
    public static final String COL_CREATIVE_TYPE = "creative_type";
    public static final String COL_CREATIVE_MESSAGE = "creative_message";

    static final int TOP_CAMPAIGNS = 5;

    private static final CsvMapper CSV = CsvMapper.builder()
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
            .enable(CsvParser.Feature.TRIM_SPACES)
            .build();

    private final String source;
    private final Set<String> columns;
    private final List<Row> rows;

    private CampaignDataset(String source, Set<String> columns, List<Row> rows) {
        this.source = source;
        this.columns = Collections.unmodifiableSet(columns);
        this.rows = List.copyOf(rows);
    }

    /**
     * @throws NoSuchFileException if {@code csv} does not exist
     * @throws IOException         if the file cannot be read or parsed
     */
    public static CampaignDataset load(Path csv) throws IOException {
        if (!Files.isRegularFile(csv)) {
            throw new NoSuchFileException(csv.toString(), null, "dataset not found");
        }
        log.info("Loading dataset | path={}", csv);
        try (Reader reader = Files.newBufferedReader(csv, StandardCharsets.UTF_8)) {
            return parse(reader, csv.toString());
        }
    }

    public static CampaignDataset parse(Reader reader, String source) throws IOException {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        Set<String> columns = new LinkedHashSet<>();
        List<Row> rows = new ArrayList<>();
        int undated = 0;
        try (MappingIterator<Map<String, String>> it = CSV.readerFor(Map.class).with(schema).readValues(reader)) {
            boolean hasRows = it.hasNextValue();
            if (it.getParserSchema() instanceof CsvSchema) {
                for (CsvSchema.Column column : (CsvSchema) it.getParserSchema()) {
                    columns.add(column.getName().trim());
                }
            }
            while (hasRows) {
                Map<String, String> raw = it.nextValue();
                Map<String, String> values = new LinkedHashMap<>();
                for (Map.Entry<String, String> e : raw.entrySet()) {
                    String key = e.getKey().trim();
                    columns.add(key);
                    values.put(key, e.getValue());
                }
                LocalDate date = parseDate(values.get(COL_DATE));
                if (date == null) undated++;
                rows.add(new Row(date, values));
                hasRows = it.hasNextValue();
            }
        }
        log.info("Dataset loaded | source={} | rows={} | columns={} | undatedRows={}",
                source, rows.size(), columns.size(), undated);
        return new CampaignDataset(source, columns, rows);
    }

    @Override
    public SeriesResult getSeries(String scope, String metric) {
        if (!columns.contains(COL_DATE)) {
            log.warn("Dataset has no date column | source={}", source);
            return SeriesResult.failure(SeriesFailure.MISSING, "dataset has no " + COL_DATE + " column");
        }
        boolean allScope = Task.isAllScope(scope);
        List<Row> selected = new ArrayList<>();
        for (Row row : rows) {
            if (row.date == null) continue;
            if (!allScope && !scope.trim().equals(row.text(COL_CAMPAIGN))) continue;
            selected.add(row);
        }
        if (selected.isEmpty()) {
            log.warn("No data for scope | scope={} | metric={}", scope, metric);
            return SeriesResult.failure(SeriesFailure.EMPTY, "no rows for scope " + scope);
        }
        if (!hasMetric(metric)) {
            log.warn("Metric missing | metric={} | source={}", metric, source);
            return SeriesResult.failure(SeriesFailure.METRIC_NOT_FOUND, metric);
        }

        Map<LocalDate, double[]> daily = new TreeMap<>();
        for (Row row : selected) {
            double value = metricValue(row, metric);
            if (!Double.isFinite(value)) continue;
            double[] acc = daily.computeIfAbsent(row.date, d -> new double[2]);
            acc[0] += value;
            acc[1]++;
        }
        double[] values = new double[daily.size()];
        int i = 0;
        for (double[] acc : daily.values()) {
            values[i++] = acc[0] / acc[1];
        }
        log.debug("Time series built | scope={} | metric={} | days={}", scope, metric, values.length);
        return SeriesResult.of(values);
    }

    /**
     * Up to {@code limit} creatives with every creative field present, first occurrence of each message,
     * in file order.
     */
    @Override
    public List<CreativeSample> creativeSample(int limit) {
        for (String col : List.of(COL_CAMPAIGN, COL_ADSET, COL_CREATIVE_TYPE, COL_CREATIVE_MESSAGE)) {
            if (!columns.contains(col)) {
                log.warn("Creative column missing | column={}", col);
            }
        }
        List<CreativeSample> out = new ArrayList<>();
        Set<String> seenMessages = new HashSet<>();
        for (Row row : rows) {
            if (out.size() >= limit) break;
            String campaign = row.text(COL_CAMPAIGN);
            String adset = row.text(COL_ADSET);
            String type = row.text(COL_CREATIVE_TYPE);
            String message = row.text(COL_CREATIVE_MESSAGE);
            double ctr = metricValue(row, COL_CTR);
            if (campaign == null || adset == null || type == null || message == null || !Double.isFinite(ctr)) continue;
            if (!seenMessages.add(message)) continue;
            out.add(new CreativeSample(campaign, adset, type, message, ctr));
        }
        log.info("Creative sample built | size={}", out.size());
        return out;
    }

    public DatasetSummary summary() {
        LocalDate min = null;
        LocalDate max = null;
        Set<String> campaigns = new HashSet<>();
        Map<String, Double> spend = new LinkedHashMap<>();
        for (Row row : rows) {
            if (row.date != null) {
                if (min == null || row.date.isBefore(min)) min = row.date;
                if (max == null || row.date.isAfter(max)) max = row.date;
            }
            String campaign = row.text(COL_CAMPAIGN);
            if (campaign == null) continue;
            campaigns.add(campaign);
            double s = row.number(COL_SPEND);
            if (Double.isFinite(s)) spend.merge(campaign, s, Double::sum);
        }
        Map<String, Double> top = new LinkedHashMap<>();
        spend.entrySet().stream()
                .sorted(Map.Entry.<String, Double>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(TOP_CAMPAIGNS)
                .forEach(e -> top.put(e.getKey(), e.getValue()));
        return new DatasetSummary(rows.size(),
                min != null ? min.toString() : null,
                max != null ? max.toString() : null,
                columns.contains(COL_CAMPAIGN) ? campaigns.size() : null,
                top);
    }

    public int size() {
        return rows.size();
    }

    public Set<String> columns() {
        return columns;
    }

    public String getSource() {
        return source;
    }

    private boolean hasMetric(String metric) {
        if (columns.contains(metric)) return true;
        return COL_CTR.equals(metric) && columns.contains(COL_CLICKS) && columns.contains(COL_IMPRESSIONS);
    }

    private double metricValue(Row row, String metric) {
        if (columns.contains(metric)) return row.number(metric);
        if (COL_CTR.equals(metric)) {
            double clicks = row.number(COL_CLICKS);
            double impressions = row.number(COL_IMPRESSIONS);
            return impressions > 0 ? clicks / impressions : Double.NaN;
        }
        return Double.NaN;
    }

    /** Accepts {@code yyyy-MM-dd}, optionally followed by a time part. */
    static LocalDate parseDate(String value) {
        if (value == null) return null;
        String v = value.trim();
        if (v.length() > 10) v = v.substring(0, 10);
        try {
            return LocalDate.parse(v);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static final class Row {
        final LocalDate date;
        final Map<String, String> values;

        Row(LocalDate date, Map<String, String> values) {
            this.date = date;
            this.values = values;
        }

        String text(String column) {
            String v = values.get(column);
            return v == null || v.isBlank() ? null : v.trim();
        }

        double number(String column) {
            String v = text(column);
            if (v == null) return Double.NaN;
            try {
                return Double.parseDouble(v);
            } catch (NumberFormatException e) {
                return Double.NaN;
            }
        }
    }
}
