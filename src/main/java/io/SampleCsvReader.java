package io;

import ebm.FeatureType;
import ebm.Sample;
import ebm.ScoringModel;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads samples from a CSV file with a header row. Columns are matched to
 * the model's main features by name; extra columns are ignored.
 */
public class SampleCsvReader {
    private static final Logger logger = LoggerFactory.getLogger(SampleCsvReader.class);

    private final ScoringModel model;

    public SampleCsvReader(ScoringModel model) {
        this.model = model;
    }

    public List<Sample> read(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            List<Sample> samples = read(reader);
            logger.info("Read {} samples from {}", samples.size(), path);
            return samples;
        }
    }

    public List<Sample> read(Reader reader) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT
                .withFirstRecordAsHeader()
                .withIgnoreEmptyLines()
                .withTrim(true);
        List<Sample> samples = new ArrayList<>();
        try (CSVParser parser = new CSVParser(reader, format)) {
            Map<String, Integer> header = parser.getHeaderMap();
            for (String name : model.getFeatureNames()) {
                if (!header.containsKey(name)) {
                    throw new IllegalArgumentException("CSV has no column for feature '" + name + "'");
                }
            }
            for (CSVRecord record : parser) {
                List<Object> values = new ArrayList<>(model.getFeatureCount());
                for (int i = 0; i < model.getFeatureCount(); i++) {
                    String raw = record.get(model.getFeatureName(i));
                    values.add(model.getFeatureType(i) == FeatureType.CONTINUOUS ? parseNumber(i, raw, record) : raw);
                }
                samples.add(Sample.of(values));
            }
        }
        return samples;
    }

    private Double parseNumber(int feature, String raw, CSVRecord record) {
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Line " + record.getRecordNumber() + ": feature '"
                    + model.getFeatureName(feature) + "' is not numeric: '" + raw + "'", e);
        }
    }
}
