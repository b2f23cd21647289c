package coach;

import ebm.ModelDescription;
import ebm.Sample;
import ebm.ScoringModel;
import io.CounterfactualCsvWriter;
import io.SampleCsvReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import solver.OjAlgoSolver;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Batch entry point: counterfactuals for every sample of a CSV file.
 *
 * Usage: CoachMain &lt;model.json&gt; &lt;samples.csv&gt; &lt;output.csv&gt; [totalCfs]
 */
public class CoachMain {
    private static final Logger logger = LoggerFactory.getLogger(CoachMain.class);

    private static final int DEFAULT_TOTAL_CFS = 3;

    public static void main(String[] args) {
        if (args.length < 3) {
            logger.error("Usage: java coach.CoachMain <model.json> <samples.csv> <output.csv> [totalCfs]");
            System.exit(2);
        }
        try {
            int totalCfs = args.length > 3 ? Integer.parseInt(args[3]) : DEFAULT_TOTAL_CFS;
            int written = run(Paths.get(args[0]), Paths.get(args[1]), Paths.get(args[2]), totalCfs);
            logger.info("Wrote {} counterfactuals to {}", written, args[2]);
        } catch (IOException | RuntimeException e) {
            logger.error("Counterfactual generation failed: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    static int run(Path modelPath, Path samplesPath, Path outputPath, int totalCfs) throws IOException {
        ScoringModel model = new ScoringModel(ModelDescription.fromFile(modelPath));
        CounterfactualCoach coach = new CounterfactualCoach(model, new OjAlgoSolver());
        List<Sample> samples = new SampleCsvReader(model).read(samplesPath);

        int written = 0;
        try (Writer out = Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8);
             CounterfactualCsvWriter writer = new CounterfactualCsvWriter(model, out)) {
            for (int s = 0; s < samples.size(); s++) {
                Sample sample = samples.get(s);
                CfConfig.Builder config = new CoachConstraints(model, sample).toConfig().totalCfs(totalCfs);
                if (!model.isClassifier()) {
                    // ask for at least one more unit of the predicted value
                    double score = model.score(sample);
                    config.targetRange(score + 1, Double.POSITIVE_INFINITY);
                }
                CfResult result = coach.generateCfs(config.build());
                if (!result.isSuccessful()) {
                    logger.warn("Sample {}: only {} of {} counterfactuals found", s,
                            result.getCounterfactuals().size(), totalCfs);
                }
                writer.write(s, result);
                written += result.getCounterfactuals().size();
            }
        }
        return written;
    }
}
