package coach;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds a fixed number of plans one counterfactual at a time. A plan that
 * changes a single feature already changed alone by an earlier plan is
 * dropped and the search continues in its place.
 */
public class PlanGenerator {
    private static final Logger logger = LoggerFactory.getLogger(PlanGenerator.class);

    public static final int DEFAULT_TOTAL_PLANS = 5;

    private final CounterfactualCoach coach;

    public PlanGenerator(CounterfactualCoach coach) {
        this.coach = coach;
    }

    public PlanBatch generatePlans(CfConfig config) {
        return generatePlans(config, DEFAULT_TOTAL_PLANS);
    }

    public PlanBatch generatePlans(CfConfig config, int totalPlans) {
        List<Counterfactual> plans = new ArrayList<>();
        Set<Integer> failed = new LinkedHashSet<>();
        Set<String> singleFeatures = new HashSet<>();

        CfResult result = coach.generateCfs(config.toBuilder().totalCfs(1).build());
        if (!result.isSuccessful()) {
            for (int i = 0; i < totalPlans; i++) {
                failed.add(i);
            }
            logger.warn("No plan found for sample {}", config.getSample());
            return new PlanBatch(plans, failed, result.getResumeState());
        }
        remember(result.getCounterfactuals().get(0), singleFeatures);
        plans.add(result.getCounterfactuals().get(0));

        int i = 1;
        while (i < totalPlans) {
            result = coach.generateSubCfs(result.getResumeState());
            if (!result.isSuccessful()) {
                for (int j = i; j < totalPlans; j++) {
                    failed.add(j);
                }
                break;
            }
            Counterfactual plan = result.getCounterfactuals().get(0);
            String single = singleFeature(plan);
            if (single != null && singleFeatures.contains(single)) {
                logger.debug("Skipping another single-feature plan on '{}'", single);
                continue;
            }
            remember(plan, singleFeatures);
            plans.add(plan);
            i++;
        }
        logger.info("Generated {} of {} plans", plans.size(), totalPlans);
        return new PlanBatch(plans, failed, result.getResumeState());
    }

    private static void remember(Counterfactual plan, Set<String> singleFeatures) {
        String single = singleFeature(plan);
        if (single != null) {
            singleFeatures.add(single);
        }
    }

    private static String singleFeature(Counterfactual plan) {
        return plan.getChanges().size() == 1 ? plan.getChanges().get(0).getFeatureName() : null;
    }
}
