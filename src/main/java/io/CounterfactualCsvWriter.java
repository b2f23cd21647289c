package io;

import coach.CfResult;
import coach.Counterfactual;
import coach.FeatureChange;
import ebm.Sample;
import ebm.ScoringModel;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes counterfactuals as CSV: one row per counterfactual with its source
 * sample, position, cost, gain, changed features and full data.
 */
public class CounterfactualCsvWriter implements AutoCloseable {
    private static final String[] LEADING_COLUMNS = {"sample", "cf", "distance", "scoreGain", "changed"};

    private final ScoringModel model;
    private final CSVPrinter printer;

    public CounterfactualCsvWriter(ScoringModel model, Writer writer) throws IOException {
        this.model = model;
        List<String> header = new ArrayList<>(List.of(LEADING_COLUMNS));
        header.addAll(model.getFeatureNames());
        this.printer = new CSVPrinter(writer, CSVFormat.DEFAULT.withHeader(header.toArray(new String[0])));
    }

    public void write(int sampleIndex, CfResult result) throws IOException {
        List<Counterfactual> cfs = result.getCounterfactuals();
        for (int c = 0; c < cfs.size(); c++) {
            Counterfactual cf = cfs.get(c);
            List<Object> row = new ArrayList<>();
            row.add(sampleIndex);
            row.add(c);
            row.add(cf.getDistance());
            row.add(cf.getTotalScoreGain());
            row.add(describe(cf.getChanges()));
            Sample data = cf.getData();
            for (int i = 0; i < model.getFeatureCount(); i++) {
                row.add(data.get(i));
            }
            printer.printRecord(row);
        }
    }

    private static String describe(List<FeatureChange> changes) {
        List<String> parts = new ArrayList<>();
        for (FeatureChange change : changes) {
            parts.add(change.getFeatureName());
        }
        return String.join(";", parts);
    }

    public void flush() throws IOException {
        printer.flush();
    }

    @Override
    public void close() throws IOException {
        printer.close();
    }
}
