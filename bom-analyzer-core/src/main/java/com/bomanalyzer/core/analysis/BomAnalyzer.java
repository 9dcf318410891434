package com.bomanalyzer.core.analysis;

import com.bomanalyzer.core.model.AnalysisReport;
import com.bomanalyzer.core.model.Catalogue;
import com.bomanalyzer.core.model.DepthResult;
import com.bomanalyzer.core.model.RollUpResult;
import com.bomanalyzer.core.model.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Runs the analysis passes over a catalogue in order: validation, depths, rolled-up costs.
 *
 * <p>Each pass starts from an empty diagnostic log, so running the analyzer twice over the same
 * catalogue yields equal reports. A {@link CycleDetectedException} from any pass aborts the run.
 */
public class BomAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(BomAnalyzer.class);

    private final CatalogueValidator validator;
    private final DepthAnalyzer depthAnalyzer;
    private final CostRollUpEngine costRollUpEngine;

    /**
     * Creates an analyzer with the default passes.
     */
    public BomAnalyzer() {
        this(new CatalogueValidator(), new DepthAnalyzer(), new CostRollUpEngine());
    }

    /**
     * Creates an analyzer with the given passes.
     *
     * @param validator validation pass
     * @param depthAnalyzer depth pass
     * @param costRollUpEngine roll-up pass
     */
    public BomAnalyzer(CatalogueValidator validator, DepthAnalyzer depthAnalyzer, CostRollUpEngine costRollUpEngine) {
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        this.depthAnalyzer = Objects.requireNonNull(depthAnalyzer, "depthAnalyzer must not be null");
        this.costRollUpEngine = Objects.requireNonNull(costRollUpEngine, "costRollUpEngine must not be null");
    }

    /**
     * Analyses a catalogue.
     *
     * @param catalogue catalogue to analyse
     * @return combined results of all passes
     * @throws CycleDetectedException if the product structure contains a cycle
     */
    public AnalysisReport analyze(Catalogue catalogue) {
        Objects.requireNonNull(catalogue, "catalogue must not be null");
        log.info("Analysing catalogue of {} products", catalogue.size());

        ValidationResult validation = validator.validate(catalogue);
        DepthResult depths = depthAnalyzer.computeDepths(catalogue);
        List<RollUpResult> rollUps = costRollUpEngine.computeRolledUpCosts(catalogue);

        return new AnalysisReport(catalogue, validation, depths, rollUps);
    }
}
